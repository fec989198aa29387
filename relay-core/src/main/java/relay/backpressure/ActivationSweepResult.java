package relay.backpressure;

/**
 * One project's entry in an activation sweep.
 *
 * @param projectId project whose draft was evaluated
 * @param status    what the sweep did
 * @param decision  activation decision at sweep time
 * @param error     failure message when {@code status} is {@link SweepStatus#FAILED}
 */
public record ActivationSweepResult(String projectId, SweepStatus status, ActivationDecision decision, String error) {
}
