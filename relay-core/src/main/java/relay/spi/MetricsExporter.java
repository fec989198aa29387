package relay.spi;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of deliveries accepted by enqueue.
     */
    void incrementEnqueued();

    /**
     * Increments the count of enqueue calls answered with an existing delivery.
     */
    void incrementDuplicates();

    /**
     * Increments the count of successful attempts.
     */
    void incrementDelivered();

    /**
     * Increments the count of failed attempts that scheduled a retry.
     */
    void incrementRetried();

    /**
     * Increments the count of deliveries moved to dead-lettered.
     */
    void incrementDeadLettered();

    /**
     * Adds the number of dead letters returned to the queue by a redrive.
     */
    default void incrementRedriven(int count) {
    }

    /**
     * Increments the count of pump or guardian ticks skipped because the previous one was still running.
     */
    default void incrementSkippedTicks() {
    }

    /**
     * Increments the count of guardian actions executed.
     */
    default void incrementGuardianActions() {
    }

    /**
     * Records the latency of one attempt.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordAttemptLatencyMs(long latencyMs) {
    }

    /**
     * Records how far behind schedule the oldest due delivery drained in a tick was.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestDueLagMs(long lagMs);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementDuplicates() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementRetried() {
        }

        @Override
        public void incrementDeadLettered() {
        }

        @Override
        public void recordOldestDueLagMs(long lagMs) {
        }
    }
}
