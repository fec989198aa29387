package relay.backpressure;

import java.util.Locale;

/**
 * Which cap reduced a connector's drain below what was requested.
 */
public enum ThrottleReason {
  DISABLED,
  RETRYING_LIMIT,
  DUE_NOW_LIMIT;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
