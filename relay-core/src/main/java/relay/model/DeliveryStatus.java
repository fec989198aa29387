package relay.model;

import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle state of a {@link ConnectorDelivery}.
 *
 * <p>Integer codes are what the JDBC stores persist; wire names are what APIs and audit
 * metadata use.
 */
public enum DeliveryStatus {
  QUEUED(0),
  RETRYING(1),
  DELIVERED(2),
  DEAD_LETTERED(3);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Whether the pump may still attempt a delivery in this state.
   */
  public boolean isPending() {
    return this == QUEUED || this == RETRYING;
  }

  public boolean isTerminal() {
    return !isPending();
  }

  /**
   * States a delivery must be in for a transition into {@code this} to be legal.
   */
  public Set<DeliveryStatus> legalSources() {
    return switch (this) {
      case QUEUED -> Set.of(DEAD_LETTERED);
      case RETRYING, DELIVERED, DEAD_LETTERED -> Set.of(QUEUED, RETRYING);
    };
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }

  public static DeliveryStatus fromWireName(String wireName) {
    return valueOf(wireName.trim().toUpperCase(Locale.ROOT));
  }
}
