package relay.pump;

/**
 * Guards against two drains in the same process attempting the same delivery at once.
 */
public interface InFlightTracker {
  boolean tryAcquire(String deliveryId);

  void release(String deliveryId);
}
