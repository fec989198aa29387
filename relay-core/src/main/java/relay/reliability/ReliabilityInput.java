package relay.reliability;

import relay.insights.ConnectorInsights;
import relay.model.DeliverySummary;

import java.util.Objects;

/**
 * What the ranker knows about one connector: its live queue counts and its windowed insights.
 */
public record ReliabilityInput(String connectorType, DeliverySummary summary, ConnectorInsights insights) {
  public ReliabilityInput {
    Objects.requireNonNull(connectorType, "connectorType");
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(insights, "insights");
  }
}
