package relay.reliability;

/**
 * A connector's current risk next to its baseline-window risk.
 */
public record TrendComparison(String connectorType, double riskScore, double baselineRiskScore, double delta, RiskTrend trend) {
}
