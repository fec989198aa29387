package relay.backpressure;

/**
 * One connector's drain under the current and the candidate policy.
 */
public record ConnectorSimulation(String connectorType, int queueDepth, GateDecision current, GateDecision candidate) {

  /** Change in deliveries drained per tick; negative when the candidate drains less. */
  public int delta() {
    return candidate.effectiveLimit() - current.effectiveLimit();
  }
}
