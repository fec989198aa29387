package relay.guardian;

import relay.reliability.Recommendation;
import relay.reliability.RiskReason;

import java.util.List;
import java.util.Objects;

/**
 * A remediation the guardian intends to run against one connector.
 */
public record GuardianAction(String connectorType, Recommendation action, double riskScore, List<RiskReason> riskReasons) {
  public GuardianAction {
    Objects.requireNonNull(connectorType, "connectorType");
    Objects.requireNonNull(action, "action");
    if (action == Recommendation.HEALTHY) {
      throw new IllegalArgumentException("healthy is not an action");
    }
    riskReasons = List.copyOf(riskReasons);
  }
}
