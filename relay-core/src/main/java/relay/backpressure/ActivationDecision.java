package relay.backpressure;

import java.time.Instant;

/**
 * Result of evaluating whether a draft may be applied.
 *
 * <p>When the time gate blocks, approvals are not consulted and {@code approvalCount} and
 * {@code approvalsRemaining} are {@code null}.
 *
 * @param ready              whether apply would succeed now
 * @param reason             blocking reason, {@code null} when ready
 * @param activationReady    whether the time gate is open
 * @param approvalCount      approvals recorded, if evaluated
 * @param approvalsRemaining approvals still needed, if evaluated
 * @param activateAt         the draft's activation time, if any
 */
public record ActivationDecision(
    boolean ready,
    BlockReason reason,
    boolean activationReady,
    Integer approvalCount,
    Integer approvalsRemaining,
    Instant activateAt) {

  static ActivationDecision timePending(Instant activateAt) {
    return new ActivationDecision(false, BlockReason.ACTIVATION_TIME_PENDING, false, null, null, activateAt);
  }

  static ActivationDecision approvalsPending(int count, int remaining, Instant activateAt) {
    return new ActivationDecision(false, BlockReason.APPROVALS_PENDING, true, count, remaining, activateAt);
  }

  static ActivationDecision ready(int count, Instant activateAt) {
    return new ActivationDecision(true, null, true, count, 0, activateAt);
  }
}
