package relay;

import relay.audit.AuditPayload;
import relay.delivery.DeliveryQueue;
import relay.delivery.DeliverySnapshot;
import relay.guardian.GuardianPolicy;
import relay.insights.ConnectorInsights;
import relay.insights.InsightsEngine;
import relay.insights.OutcomeSummarizer;
import relay.insights.OutcomeTrend;
import relay.insights.PolicyUpdate;
import relay.model.ConnectorDelivery;
import relay.model.DeliverySummary;
import relay.reliability.RankedConnector;
import relay.reliability.ReliabilityInput;
import relay.reliability.ReliabilityRanker;
import relay.reliability.TrendComparison;
import relay.spi.AuditLog;
import relay.util.Arguments;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only analysis over point-in-time snapshots of the delivery store: insights, outcome
 * trends, reliability ranking and risk trends.
 *
 * <p>Each connector is analysed from its newest {@link ControlPlaneConfig#getAnalyticsSampleLimit()}
 * deliveries. Nothing here takes locks; results may be up to one pump tick stale.
 */
public final class ConnectorAnalytics {
  public static final int MAX_AUDIT_LIMIT = 1000;

  private final DeliveryQueue deliveryQueue;
  private final AuditLog auditLog;
  private final ReliabilityRanker ranker;
  private final ControlPlaneConfig config;
  private final Clock clock;

  public ConnectorAnalytics(DeliveryQueue deliveryQueue, AuditLog auditLog, ReliabilityRanker ranker,
      ControlPlaneConfig config, Clock clock) {
    this.deliveryQueue = Objects.requireNonNull(deliveryQueue, "deliveryQueue");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.ranker = Objects.requireNonNull(ranker, "ranker");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ConnectorInsights insights(String projectId, String connectorType, int lookbackHours) {
    checkLookback(lookbackHours);
    DeliverySnapshot snapshot = deliveryQueue.snapshot(projectId, connectorType, config.getAnalyticsSampleLimit());
    return InsightsEngine.computeInsights(snapshot.deliveries(), snapshot.attemptsByDelivery(), lookbackHours,
        clock.instant());
  }

  public OutcomeTrend outcomes(String projectId, String connectorType, int lookbackHours) {
    checkLookback(lookbackHours);
    List<ConnectorDelivery> deliveries =
        deliveryQueue.listDeliveries(projectId, connectorType, config.getAnalyticsSampleLimit());
    return OutcomeSummarizer.summarizeOutcomes(deliveries, lookbackHours, clock.instant());
  }

  /**
   * The backpressure policy-update feed, newest first, rebuilt from the last {@code limit}
   * policy-update audit events.
   */
  public List<PolicyUpdate> policyUpdates(String projectId, int limit) {
    String project = Arguments.projectId(projectId);
    Arguments.range("limit", limit, 1, MAX_AUDIT_LIMIT);
    return OutcomeSummarizer.policyUpdates(
        auditLog.listEvents(project, Set.of(AuditPayload.POLICY_UPDATED), null, limit));
  }

  /**
   * Summary plus insights for every connector type the project has deliveries for.
   */
  public List<ReliabilityInput> reliabilityInputs(String projectId, int lookbackHours) {
    checkLookback(lookbackHours);
    Instant now = clock.instant();
    List<ReliabilityInput> inputs = new ArrayList<>();
    for (Map.Entry<String, DeliverySummary> e : deliveryQueue.summarizeAll(projectId).entrySet()) {
      DeliverySnapshot snapshot = deliveryQueue.snapshot(projectId, e.getKey(), config.getAnalyticsSampleLimit());
      ConnectorInsights insights = InsightsEngine.computeInsights(snapshot.deliveries(),
          snapshot.attemptsByDelivery(), lookbackHours, now);
      inputs.add(new ReliabilityInput(e.getKey(), e.getValue(), insights));
    }
    return inputs;
  }

  public List<RankedConnector> rankReliability(String projectId, int lookbackHours) {
    return ranker.rank(reliabilityInputs(projectId, lookbackHours));
  }

  /**
   * Compares each connector's current risk with its risk one window earlier.
   *
   * <p>The baseline ranks the deliveries created before {@code now - L}, with queue counts as
   * they stand for those rows and insights over {@code [now - 2L, now - L)}.
   */
  public List<TrendComparison> reliabilityTrend(String projectId, int lookbackHours) {
    checkLookback(lookbackHours);
    Instant now = clock.instant();
    Instant baselineEnd = now.minus(Duration.ofHours(lookbackHours));
    List<ReliabilityInput> current = new ArrayList<>();
    List<ReliabilityInput> baseline = new ArrayList<>();
    for (Map.Entry<String, DeliverySummary> e : deliveryQueue.summarizeAll(projectId).entrySet()) {
      String type = e.getKey();
      DeliverySnapshot snapshot = deliveryQueue.snapshot(projectId, type, config.getAnalyticsSampleLimit());
      current.add(new ReliabilityInput(type, e.getValue(), InsightsEngine.computeInsights(
          snapshot.deliveries(), snapshot.attemptsByDelivery(), lookbackHours, now)));

      List<ConnectorDelivery> older = snapshot.deliveries().stream()
          .filter(d -> d.createdAt().isBefore(baselineEnd))
          .collect(Collectors.toList());
      if (!older.isEmpty()) {
        baseline.add(new ReliabilityInput(type, DeliverySummary.of(type, older, baselineEnd),
            InsightsEngine.computeInsights(older, snapshot.attemptsByDelivery(), lookbackHours, baselineEnd)));
      }
    }
    return ReliabilityRanker.compareTrends(ranker.rank(current), ranker.rank(baseline), config.getRiskStableDelta());
  }

  private static void checkLookback(int lookbackHours) {
    Arguments.range("lookback_hours", lookbackHours, 1, GuardianPolicy.MAX_LOOKBACK_HOURS);
  }
}
