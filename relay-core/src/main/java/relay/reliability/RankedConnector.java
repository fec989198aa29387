package relay.reliability;

import relay.insights.ConnectorInsights;
import relay.model.DeliverySummary;

import java.util.List;

/**
 * A connector's position in the risk ranking.
 */
public record RankedConnector(
    String connectorType,
    double riskScore,
    Recommendation recommendation,
    List<RiskReason> riskReasons,
    RiskBreakdown breakdown,
    DeliverySummary summary,
    ConnectorInsights insights) {

  public RankedConnector {
    riskReasons = List.copyOf(riskReasons);
  }
}
