package relay.pump;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>With a positive {@code ttlMs}, an entry older than the TTL may be re-acquired. That covers
 * an attempt whose worker hung past its timeout without releasing.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Long> inflight = new ConcurrentHashMap<>();
  private final long ttlMs;

  public DefaultInFlightTracker() {
    this(0L);
  }

  /**
   * @param ttlMs time-to-live in milliseconds; {@code 0} keeps entries until released
   */
  public DefaultInFlightTracker(long ttlMs) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0");
    }
    this.ttlMs = ttlMs;
  }

  @Override
  public boolean tryAcquire(String deliveryId) {
    long now = System.currentTimeMillis();
    Long existing = inflight.putIfAbsent(deliveryId, now);
    if (existing == null) {
      return true;
    }
    return ttlMs > 0 && now - existing > ttlMs && inflight.replace(deliveryId, existing, now);
  }

  @Override
  public void release(String deliveryId) {
    inflight.remove(deliveryId);
  }

  int size() {
    return inflight.size();
  }
}
