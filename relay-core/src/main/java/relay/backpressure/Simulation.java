package relay.backpressure;

import java.util.List;

/**
 * Preview of a candidate policy's drain effect, per connector and in total.
 *
 * @param requestedLimit  per-connector limit the pump would request
 * @param connectors      per-connector results, in the order requested
 * @param currentTotal    deliveries drained per tick under the current policy
 * @param candidateTotal  deliveries drained per tick under the candidate policy
 * @param delta           {@code candidateTotal - currentTotal}
 * @param throttledBefore connectors throttled under the current policy
 * @param throttledAfter  connectors throttled under the candidate policy
 * @param throttledDelta  {@code throttledAfter - throttledBefore}
 */
public record Simulation(
    int requestedLimit,
    List<ConnectorSimulation> connectors,
    int currentTotal,
    int candidateTotal,
    int delta,
    int throttledBefore,
    int throttledAfter,
    int throttledDelta) {

  public Simulation {
    connectors = List.copyOf(connectors);
  }
}
