package relay.reliability;

import relay.insights.ConnectorInsights;
import relay.model.DeliverySummary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores connectors by operational risk and proposes a remediation for each.
 *
 * <p>Score = weighted queue pressure (dead letters, due now, retrying, queued), attempts beyond
 * the first, delivery and attempt failure rates, and capped error volume. Failure-rate terms only
 * apply when the window has deliveries (resp. attempts), so an idle connector scores zero.
 */
public final class ReliabilityRanker {
  static final double LOW_DELIVERY_SUCCESS = 0.95;
  static final double LOW_ATTEMPT_SUCCESS = 0.9;
  static final int HIGH_ERROR_VOLUME = 5;
  static final int HIGH_ATTEMPT_COUNT = 3;

  private final RiskWeights weights;

  public ReliabilityRanker() {
    this(RiskWeights.defaults());
  }

  public ReliabilityRanker(RiskWeights weights) {
    this.weights = Objects.requireNonNull(weights, "weights");
  }

  /**
   * Ranks connectors by descending risk; equal scores order by connector type.
   */
  public List<RankedConnector> rank(Collection<ReliabilityInput> records) {
    List<RankedConnector> ranked = new ArrayList<>(records.size());
    for (ReliabilityInput record : records) {
      ranked.add(score(record));
    }
    ranked.sort(Comparator.comparingDouble(RankedConnector::riskScore).reversed()
        .thenComparing(RankedConnector::connectorType));
    return ranked;
  }

  RankedConnector score(ReliabilityInput record) {
    DeliverySummary s = record.summary();
    ConnectorInsights in = record.insights();

    double deliveryFailure = in.deliveryCount() > 0 ? (1.0 - in.deliverySuccessRate()) * weights.deliveryFailure() : 0.0;
    double attemptFailure = in.attemptCount() > 0 ? (1.0 - in.attemptSuccessRate()) * weights.attemptFailure() : 0.0;
    RiskBreakdown breakdown = new RiskBreakdown(
        s.deadLettered() * weights.deadLettered(),
        s.dueNow() * weights.dueNow(),
        s.retrying() * weights.retrying(),
        s.queued() * weights.queued(),
        Math.max(0, in.maxAttemptsObserved() - 1) * weights.excessAttempts(),
        deliveryFailure,
        attemptFailure,
        Math.min(in.errorOccurrences(), weights.errorOccurrenceCap()) * weights.errorOccurrence());

    double risk = Math.round(breakdown.total() * 100.0) / 100.0;
    return new RankedConnector(record.connectorType(), risk, recommend(s), reasons(s, in), breakdown, s, in);
  }

  static Recommendation recommend(DeliverySummary summary) {
    if (summary.deadLettered() > 0) {
      return Recommendation.REDRIVE_DEAD_LETTERS;
    }
    if (summary.dueNow() > 0 || summary.queued() > 0) {
      return Recommendation.PROCESS_QUEUE;
    }
    return Recommendation.HEALTHY;
  }

  private static List<RiskReason> reasons(DeliverySummary s, ConnectorInsights in) {
    EnumSet<RiskReason> reasons = EnumSet.noneOf(RiskReason.class);
    if (s.deadLettered() > 0) {
      reasons.add(RiskReason.DEAD_LETTERS);
    }
    if (s.dueNow() > 0) {
      reasons.add(RiskReason.DUE_NOW_BACKLOG);
    }
    if (s.retrying() > 0) {
      reasons.add(RiskReason.RETRY_BACKLOG);
    }
    if (s.queued() > 0) {
      reasons.add(RiskReason.QUEUED_BACKLOG);
    }
    if (in.deliveryCount() > 0 && in.deliverySuccessRate() < LOW_DELIVERY_SUCCESS) {
      reasons.add(RiskReason.LOW_DELIVERY_SUCCESS);
    }
    if (in.attemptCount() > 0 && in.attemptSuccessRate() < LOW_ATTEMPT_SUCCESS) {
      reasons.add(RiskReason.LOW_ATTEMPT_SUCCESS);
    }
    if (in.errorOccurrences() >= HIGH_ERROR_VOLUME) {
      reasons.add(RiskReason.HIGH_ERROR_VOLUME);
    }
    if (in.maxAttemptsObserved() >= HIGH_ATTEMPT_COUNT) {
      reasons.add(RiskReason.HIGH_ATTEMPT_COUNT);
    }
    return List.copyOf(reasons);
  }

  /**
   * Classifies a risk change; moves within {@code stableDelta} either way count as stable.
   */
  public static RiskTrend compareTrend(double riskScore, double baselineRiskScore, double stableDelta) {
    double delta = riskScore - baselineRiskScore;
    if (delta > stableDelta) {
      return RiskTrend.WORSENING;
    }
    if (delta < -stableDelta) {
      return RiskTrend.IMPROVING;
    }
    return RiskTrend.STABLE;
  }

  /**
   * Pairs each current ranking entry with the same connector's baseline entry (risk 0 when the
   * connector had no baseline), preserving the current ranking order.
   */
  public static List<TrendComparison> compareTrends(List<RankedConnector> current,
      List<RankedConnector> baseline, double stableDelta) {
    Map<String, Double> baselineRisk = new HashMap<>();
    for (RankedConnector b : baseline) {
      baselineRisk.put(b.connectorType(), b.riskScore());
    }
    List<TrendComparison> out = new ArrayList<>(current.size());
    for (RankedConnector c : current) {
      double base = baselineRisk.getOrDefault(c.connectorType(), 0.0);
      double delta = Math.round((c.riskScore() - base) * 100.0) / 100.0;
      out.add(new TrendComparison(c.connectorType(), c.riskScore(), base, delta,
          compareTrend(c.riskScore(), base, stableDelta)));
    }
    return out;
  }
}
