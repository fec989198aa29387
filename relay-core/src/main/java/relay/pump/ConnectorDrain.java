package relay.pump;

import relay.backpressure.GateDecision;

/**
 * What one drain did for one connector.
 *
 * @param connectorType canonical connector type
 * @param decision      the backpressure decision the drain was sized by
 * @param delivered     attempts that succeeded
 * @param retried       failed attempts rescheduled with backoff
 * @param deadLettered  deliveries quarantined (exhausted or unroutable)
 * @param skipped       due rows left alone: another drain held or changed them, or no worker
 *                      picked the attempt up within its timeout
 */
public record ConnectorDrain(
    String connectorType,
    GateDecision decision,
    int delivered,
    int retried,
    int deadLettered,
    int skipped) {

  public int attempted() {
    return delivered + retried + deadLettered;
  }
}
