package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import relay.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.delivery.enqueued} - deliveries accepted by enqueue</li>
 *   <li>{@code relay.delivery.duplicates} - enqueue calls answered with an existing delivery</li>
 *   <li>{@code relay.delivery.delivered} - successful attempts</li>
 *   <li>{@code relay.delivery.retried} - failed attempts that scheduled a retry</li>
 *   <li>{@code relay.delivery.dead_lettered} - deliveries quarantined</li>
 *   <li>{@code relay.delivery.redriven} - dead letters returned to the queue</li>
 *   <li>{@code relay.tick.skipped} - pump or guardian ticks skipped while the previous one ran</li>
 *   <li>{@code relay.guardian.actions} - guardian actions executed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.lag.oldest_due.ms} - schedule lag of the oldest due delivery drained last tick</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code relay.attempt.latency.ms} - connector attempt latency</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter enqueued;
    private final Counter duplicates;
    private final Counter delivered;
    private final Counter retried;
    private final Counter deadLettered;
    private final Counter redriven;
    private final Counter skippedTicks;
    private final Counter guardianActions;
    private final Gauge lagGauge;
    private final DistributionSummary attemptLatency;

    private final AtomicLong oldestDueLagMs = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "relay"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "relay");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.relay"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.enqueued = Counter.builder(namePrefix + ".delivery.enqueued")
                .description("Deliveries accepted by enqueue")
                .register(registry);
        this.duplicates = Counter.builder(namePrefix + ".delivery.duplicates")
                .description("Enqueue calls answered with an existing delivery")
                .register(registry);
        this.delivered = Counter.builder(namePrefix + ".delivery.delivered")
                .description("Successful connector attempts")
                .register(registry);
        this.retried = Counter.builder(namePrefix + ".delivery.retried")
                .description("Failed attempts that scheduled a retry")
                .register(registry);
        this.deadLettered = Counter.builder(namePrefix + ".delivery.dead_lettered")
                .description("Deliveries moved to dead-lettered")
                .register(registry);
        this.redriven = Counter.builder(namePrefix + ".delivery.redriven")
                .description("Dead letters returned to the queue")
                .register(registry);
        this.skippedTicks = Counter.builder(namePrefix + ".tick.skipped")
                .description("Ticks skipped because the previous one was still running")
                .register(registry);
        this.guardianActions = Counter.builder(namePrefix + ".guardian.actions")
                .description("Guardian actions executed")
                .register(registry);

        this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest_due.ms", oldestDueLagMs, AtomicLong::get)
                .register(registry);

        this.attemptLatency = DistributionSummary.builder(namePrefix + ".attempt.latency.ms")
                .description("Connector attempt latency in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementEnqueued() {
        if (closed) return;
        enqueued.increment();
    }

    @Override
    public void incrementDuplicates() {
        if (closed) return;
        duplicates.increment();
    }

    @Override
    public void incrementDelivered() {
        if (closed) return;
        delivered.increment();
    }

    @Override
    public void incrementRetried() {
        if (closed) return;
        retried.increment();
    }

    @Override
    public void incrementDeadLettered() {
        if (closed) return;
        deadLettered.increment();
    }

    @Override
    public void incrementRedriven(int count) {
        if (closed || count <= 0) return;
        redriven.increment(count);
    }

    @Override
    public void incrementSkippedTicks() {
        if (closed) return;
        skippedTicks.increment();
    }

    @Override
    public void incrementGuardianActions() {
        if (closed) return;
        guardianActions.increment();
    }

    @Override
    public void recordAttemptLatencyMs(long latencyMs) {
        if (closed) return;
        attemptLatency.record(latencyMs);
    }

    @Override
    public void recordOldestDueLagMs(long lagMs) {
        if (closed) return;
        oldestDueLagMs.set(lagMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the control plane is closed to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(enqueued, duplicates, delivered, retried, deadLettered, redriven,
                skippedTicks, guardianActions, lagGauge, attemptLatency)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
