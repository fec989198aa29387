package relay.backpressure;

import relay.ValidationException;
import relay.model.Patch;

import java.time.Instant;
import java.util.Objects;

/**
 * Sparse update to a draft: policy fields to fold into the proposal plus optional changes to the
 * approval quorum and activation time.
 *
 * <p>{@code activateAt} present with {@code null} clears the time gate.
 */
public record DraftAmendment(PolicyPatch policy, Patch<Integer> requiredApprovals, Patch<Instant> activateAt) {

  public DraftAmendment {
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(requiredApprovals, "requiredApprovals");
    Objects.requireNonNull(activateAt, "activateAt");
    if (requiredApprovals.isPresent()) {
      if (requiredApprovals.value() == null) {
        throw new ValidationException("required_approvals", "must not be null");
      }
      BackpressureSettings.checkRange("required_approvals", requiredApprovals.value(),
          1, BackpressureDraft.MAX_REQUIRED_APPROVALS);
    }
    if (policy.isEmpty() && !requiredApprovals.isPresent() && !activateAt.isPresent()) {
      throw new ValidationException("draft", "at least one field must be supplied");
    }
  }

  public static DraftAmendment of(PolicyPatch policy) {
    return new DraftAmendment(policy, Patch.absent(), Patch.absent());
  }

  public DraftAmendment withRequiredApprovals(int requiredApprovals) {
    return new DraftAmendment(policy, Patch.of(requiredApprovals), activateAt);
  }

  public DraftAmendment withActivateAt(Instant activateAt) {
    return new DraftAmendment(policy, requiredApprovals, Patch.of(activateAt));
  }
}
