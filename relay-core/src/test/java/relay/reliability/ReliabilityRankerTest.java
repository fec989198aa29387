package relay.reliability;

import org.junit.jupiter.api.Test;
import relay.insights.ConnectorInsights;
import relay.insights.ErrorFrequency;
import relay.insights.StatusCounts;
import relay.model.DeliverySummary;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReliabilityRankerTest {
  private static final Instant NOW = Instant.parse("2026-02-21T12:00:00Z");

  private final ReliabilityRanker ranker = new ReliabilityRanker();

  @Test
  void idleConnectorScoresZeroAndIsHealthy() {
    RankedConnector ranked = ranker.score(input("webhook", DeliverySummary.empty("webhook"), insights(0, 0.0, 0, 0.0, 0)));

    assertEquals(0.0, ranked.riskScore());
    assertEquals(Recommendation.HEALTHY, ranked.recommendation());
    assertTrue(ranked.riskReasons().isEmpty());
  }

  @Test
  void healthyTrafficStaysNearZero() {
    DeliverySummary summary = new DeliverySummary("slack", 20, 0, 0, 20, 0, 0, null);
    RankedConnector ranked = ranker.score(input("slack", summary, insights(20, 1.0, 20, 1.0, 1)));

    assertEquals(0.0, ranked.riskScore());
    assertEquals(Recommendation.HEALTHY, ranked.recommendation());
  }

  @Test
  void deadLettersOutrankBacklog() {
    ReliabilityInput dead = input("jira", new DeliverySummary("jira", 3, 0, 0, 0, 3, 0, null),
        insights(3, 0.0, 3, 0.0, 1));
    ReliabilityInput backlog = input("webhook", new DeliverySummary("webhook", 3, 3, 0, 0, 0, 3, NOW),
        insights(3, 0.0, 0, 0.0, 0));

    List<RankedConnector> ranked = ranker.rank(List.of(backlog, dead));

    assertEquals("jira", ranked.get(0).connectorType());
    assertEquals(Recommendation.REDRIVE_DEAD_LETTERS, ranked.get(0).recommendation());
    assertEquals(Recommendation.PROCESS_QUEUE, ranked.get(1).recommendation());
    assertTrue(ranked.get(0).riskReasons().contains(RiskReason.DEAD_LETTERS));
    assertTrue(ranked.get(1).riskReasons().contains(RiskReason.DUE_NOW_BACKLOG));
  }

  @Test
  void breakdownSumsToScore() {
    DeliverySummary summary = new DeliverySummary("db", 10, 2, 3, 4, 1, 4, NOW);
    ConnectorInsights in = insights(10, 0.4, 12, 0.5, 4);

    RankedConnector ranked = ranker.score(input("db", summary, in));

    RiskBreakdown b = ranked.breakdown();
    assertEquals(10.0, b.deadLetterPressure());
    assertEquals(24.0, b.dueNowPressure());
    assertEquals(12.0, b.retryPressure());
    assertEquals(4.0, b.queuePressure());
    assertEquals(4.5, b.attemptPressure());
    assertEquals(24.0, b.deliveryFailurePressure(), 1e-9);
    assertEquals(10.0, b.attemptFailurePressure(), 1e-9);
    assertEquals(3.0, b.errorPressure());
    assertEquals(91.5, ranked.riskScore());
    assertTrue(ranked.riskReasons().containsAll(List.of(RiskReason.LOW_DELIVERY_SUCCESS,
        RiskReason.LOW_ATTEMPT_SUCCESS, RiskReason.HIGH_ERROR_VOLUME, RiskReason.HIGH_ATTEMPT_COUNT)));
  }

  @Test
  void equalScoresOrderByConnectorType() {
    ReliabilityInput b = input("webhook", DeliverySummary.empty("webhook"), insights(0, 0.0, 0, 0.0, 0));
    ReliabilityInput a = input("db", DeliverySummary.empty("db"), insights(0, 0.0, 0, 0.0, 0));

    List<RankedConnector> ranked = ranker.rank(List.of(b, a));

    assertEquals(List.of("db", "webhook"), ranked.stream().map(RankedConnector::connectorType).toList());
  }

  @Test
  void trendClassificationUsesStableBand() {
    assertEquals(RiskTrend.WORSENING, ReliabilityRanker.compareTrend(12.0, 10.0, 1.0));
    assertEquals(RiskTrend.IMPROVING, ReliabilityRanker.compareTrend(8.0, 10.0, 1.0));
    assertEquals(RiskTrend.STABLE, ReliabilityRanker.compareTrend(10.5, 10.0, 1.0));
    assertEquals(RiskTrend.STABLE, ReliabilityRanker.compareTrend(11.0, 10.0, 1.0));
  }

  @Test
  void connectorMissingFromBaselineComparesAgainstZero() {
    RankedConnector current = ranker.score(input("jira", new DeliverySummary("jira", 1, 0, 0, 0, 1, 0, null),
        insights(1, 0.0, 1, 0.0, 1)));

    List<TrendComparison> trends = ReliabilityRanker.compareTrends(List.of(current), List.of(), 1.0);

    assertEquals(1, trends.size());
    assertEquals(0.0, trends.get(0).baselineRiskScore());
    assertEquals(current.riskScore(), trends.get(0).delta());
    assertEquals(RiskTrend.WORSENING, trends.get(0).trend());
  }

  private static ReliabilityInput input(String type, DeliverySummary summary, ConnectorInsights insights) {
    return new ReliabilityInput(type, summary, insights);
  }

  private static ConnectorInsights insights(int deliveries, double deliveryRate, int attempts, double attemptRate,
      int maxAttempts) {
    List<ErrorFrequency> errors = attempts > 0 && attemptRate < 1.0
        ? List.of(new ErrorFrequency("HTTP 500", 6))
        : List.of();
    return new ConnectorInsights(NOW.minusSeconds(3600), NOW, deliveries, StatusCounts.ZERO, deliveryRate,
        attempts, attemptRate, maxAttempts, maxAttempts, errors);
  }
}
