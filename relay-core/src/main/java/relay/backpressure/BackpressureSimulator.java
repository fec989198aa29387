package relay.backpressure;

import relay.ValidationException;
import relay.model.ConnectorKind;
import relay.model.DeliverySummary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Previews how a candidate policy would change per-tick drain before anyone approves it.
 *
 * <p>Pure: reads only the summaries it is handed and never touches a store.
 */
public final class BackpressureSimulator {
  public static final int MAX_REQUESTED_LIMIT = 100;

  private BackpressureSimulator() {}

  /**
   * @param connectorTypes connectors to simulate; when empty, every connector in {@code summaries}
   * @param requestedLimit per-connector limit the pump would request (1..100)
   * @param summaries      queue snapshot per canonical connector type; missing ones count as empty
   * @param current        the live policy
   * @param candidate      the policy under review
   * @throws ValidationException if {@code requestedLimit} is out of range
   */
  public static Simulation simulate(Collection<String> connectorTypes, int requestedLimit,
      Map<String, DeliverySummary> summaries, BackpressurePolicy current, BackpressurePolicy candidate) {
    Objects.requireNonNull(summaries, "summaries");
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(candidate, "candidate");
    if (requestedLimit < 1 || requestedLimit > MAX_REQUESTED_LIMIT) {
      throw new ValidationException("requested_limit",
          "must be between 1 and " + MAX_REQUESTED_LIMIT + ", got " + requestedLimit);
    }

    Set<String> types = new LinkedHashSet<>();
    if (connectorTypes == null || connectorTypes.isEmpty()) {
      types.addAll(summaries.keySet());
    } else {
      for (String type : connectorTypes) {
        types.add(ConnectorKind.normalize(type));
      }
    }

    List<ConnectorSimulation> rows = new ArrayList<>(types.size());
    int currentTotal = 0;
    int candidateTotal = 0;
    int throttledBefore = 0;
    int throttledAfter = 0;
    for (String type : types) {
      DeliverySummary summary = summaries.getOrDefault(type, DeliverySummary.empty(type));
      GateDecision before = BackpressureGate.decide(requestedLimit, summary, current.settingsFor(type));
      GateDecision after = BackpressureGate.decide(requestedLimit, summary, candidate.settingsFor(type));
      rows.add(new ConnectorSimulation(type, summary.dueNow(), before, after));
      currentTotal += before.effectiveLimit();
      candidateTotal += after.effectiveLimit();
      throttledBefore += before.throttled() ? 1 : 0;
      throttledAfter += after.throttled() ? 1 : 0;
    }
    return new Simulation(requestedLimit, rows, currentTotal, candidateTotal, candidateTotal - currentTotal,
        throttledBefore, throttledAfter, throttledAfter - throttledBefore);
  }
}
