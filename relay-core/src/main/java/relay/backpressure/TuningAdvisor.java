package relay.backpressure;

import relay.ControlPlaneConfig;
import relay.model.DeliverySummary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Suggests backpressure numbers from current queue pressure.
 *
 * <p>Each connector is tiered against the configured default caps: {@link PressureTier#HIGH} at
 * or above either cap, {@link PressureTier#MEDIUM} at or above
 * {@link ControlPlaneConfig#getMediumPressureRatio()} of either cap, {@link PressureTier#LOW}
 * otherwise. Caps are sized to twice the observed backlog (never below the defaults) so no
 * connector is starved; the project recommendation takes the largest caps and the smallest floor.
 */
public final class TuningAdvisor {
  private final ControlPlaneConfig config;

  public TuningAdvisor(ControlPlaneConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public TuningSuggestion suggest(Collection<DeliverySummary> summaries) {
    BackpressureSettings defaults = config.getDefaultBackpressure();
    if (summaries == null || summaries.isEmpty()) {
      return new TuningSuggestion(defaults, List.of());
    }

    List<ConnectorTuning> rows = new ArrayList<>(summaries.size());
    for (DeliverySummary summary : summaries) {
      PressureTier tier = classify(summary, defaults);
      BackpressureSettings suggested = new BackpressureSettings(true,
          cap(Math.max(defaults.maxRetrying(), summary.retrying() * 2L)),
          cap(Math.max(defaults.maxDueNow(), summary.dueNow() * 2L)),
          tier.suggestedMinLimit());
      rows.add(new ConnectorTuning(summary.connectorType(), tier, summary.retrying(), summary.dueNow(),
          summary.outstanding(), suggested));
    }
    rows.sort(Comparator.comparing(ConnectorTuning::tier).reversed()
        .thenComparing(Comparator.comparingInt(ConnectorTuning::outstanding).reversed())
        .thenComparing(ConnectorTuning::connectorType));

    int maxRetrying = rows.stream().mapToInt(r -> r.suggested().maxRetrying()).max().orElse(defaults.maxRetrying());
    int maxDueNow = rows.stream().mapToInt(r -> r.suggested().maxDueNow()).max().orElse(defaults.maxDueNow());
    int minLimit = rows.stream().mapToInt(r -> r.suggested().minLimit()).min().orElse(defaults.minLimit());
    return new TuningSuggestion(new BackpressureSettings(true, maxRetrying, maxDueNow, minLimit), rows);
  }

  PressureTier classify(DeliverySummary summary, BackpressureSettings defaults) {
    int retrying = summary.retrying();
    int dueNow = summary.dueNow();
    if (retrying >= defaults.maxRetrying() || dueNow >= defaults.maxDueNow()) {
      return PressureTier.HIGH;
    }
    double ratio = config.getMediumPressureRatio();
    if (retrying >= Math.ceil(defaults.maxRetrying() * ratio) || dueNow >= Math.ceil(defaults.maxDueNow() * ratio)) {
      return PressureTier.MEDIUM;
    }
    return PressureTier.LOW;
  }

  private static int cap(long value) {
    return (int) Math.min(BackpressureSettings.MAX_CAP, value);
  }
}
