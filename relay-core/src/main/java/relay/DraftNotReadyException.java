package relay;

import relay.backpressure.ActivationDecision;

import java.util.Objects;

/**
 * Raised when a backpressure draft is applied while it is still blocked by its activation time
 * or by missing approvals.
 */
public final class DraftNotReadyException extends RuntimeException {
  private final transient ActivationDecision decision;

  public DraftNotReadyException(String projectId, ActivationDecision decision) {
    super("draft for project " + projectId + " is not ready: " + decision.reason().wireName());
    this.decision = Objects.requireNonNull(decision, "decision");
  }

  public ActivationDecision decision() {
    return decision;
  }
}
