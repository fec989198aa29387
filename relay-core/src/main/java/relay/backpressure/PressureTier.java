package relay.backpressure;

import java.util.Locale;

/**
 * Queue pressure classification used by the {@link TuningAdvisor}. Declared in ascending order.
 */
public enum PressureTier {
  LOW(3),
  MEDIUM(2),
  HIGH(1);

  private final int suggestedMinLimit;

  PressureTier(int suggestedMinLimit) {
    this.suggestedMinLimit = suggestedMinLimit;
  }

  /** Tighter floor as pressure rises, so a struggling endpoint is not hammered. */
  public int suggestedMinLimit() {
    return suggestedMinLimit;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
