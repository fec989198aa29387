package relay.reliability;

import java.util.Locale;

/**
 * Remediation proposed for a ranked connector.
 */
public enum Recommendation {
  REDRIVE_DEAD_LETTERS,
  PROCESS_QUEUE,
  HEALTHY;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Recommendation fromWireName(String wireName) {
    return valueOf(wireName.trim().toUpperCase(Locale.ROOT));
  }
}
