package relay.delivery;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempts-1)}, capped at {@code maxDelay}.
 *
 * <p>With a non-zero {@code jitter} the delay is scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter)} and capped again; with zero jitter the schedule is
 * deterministic.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, 0.0);
  }

  /**
   * @param baseDelayMs delay before the second attempt (milliseconds)
   * @param maxDelayMs  cap on any delay (milliseconds)
   * @param jitter      relative jitter in {@code [0, 1)}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay = maxDelayMs;
    if (attempts < 63) {
      long factor = 1L << (attempts - 1);
      // Past this point baseDelayMs * factor would exceed the cap (or overflow).
      if (factor <= maxDelayMs / baseDelayMs) {
        delay = baseDelayMs * factor;
      }
    }
    if (jitter > 0.0) {
      delay = (long) (delay * ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter));
    }
    return Math.min(maxDelayMs, Math.max(0L, delay));
  }
}
