package relay.backpressure;

import relay.model.DeliverySummary;

/**
 * The drain formula shared by the pump and the simulator.
 *
 * <p>{@code effective = clamp(requested, minLimit, min(maxRetrying, maxDueNow, depth))}, never
 * more than the due-now depth, and 0 for a disabled connector.
 */
public final class BackpressureGate {

  private BackpressureGate() {}

  public static GateDecision decide(int requestedLimit, DeliverySummary summary, ResolvedSettings resolved) {
    BackpressureSettings s = resolved.settings();
    int depth = Math.max(0, summary.dueNow());
    if (!s.enabled()) {
      return new GateDecision(summary.connectorType(), requestedLimit, depth, 0, depth > 0,
          depth > 0 ? ThrottleReason.DISABLED : null, s, resolved.source());
    }
    int cap = Math.min(Math.min(s.maxRetrying(), s.maxDueNow()), depth);
    int effective = Math.min(Math.max(s.minLimit(), Math.min(requestedLimit, cap)), depth);
    boolean throttled = effective < Math.min(requestedLimit, depth);
    ThrottleReason reason = null;
    if (throttled) {
      reason = s.maxRetrying() <= s.maxDueNow() ? ThrottleReason.RETRYING_LIMIT : ThrottleReason.DUE_NOW_LIMIT;
    }
    return new GateDecision(summary.connectorType(), requestedLimit, depth, effective, throttled, reason,
        s, resolved.source());
  }
}
