package relay.backpressure;

import relay.ValidationException;

/**
 * Drain caps for one connector (or a project default).
 *
 * <p>Out-of-range values are rejected with a {@link ValidationException}, never clamped.
 *
 * @param enabled     whether the pump may drain this connector at all
 * @param maxRetrying cap on deliveries drained per tick, sized against the retrying backlog
 * @param maxDueNow   cap on deliveries drained per tick, sized against the due-now backlog
 * @param minLimit    floor on the per-tick drain so a throttled connector still makes progress
 */
public record BackpressureSettings(boolean enabled, int maxRetrying, int maxDueNow, int minLimit) {
  public static final int MAX_CAP = 10_000;
  public static final int MAX_MIN_LIMIT = 100;

  public BackpressureSettings {
    checkRange("max_retrying", maxRetrying, 1, MAX_CAP);
    checkRange("max_due_now", maxDueNow, 1, MAX_CAP);
    checkRange("min_limit", minLimit, 1, MAX_MIN_LIMIT);
  }

  static void checkRange(String field, int value, int min, int max) {
    if (value < min || value > max) {
      throw new ValidationException(field, "must be between " + min + " and " + max + ", got " + value);
    }
  }
}
