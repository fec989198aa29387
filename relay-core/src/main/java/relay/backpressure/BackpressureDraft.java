package relay.backpressure;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A proposed, not yet active amendment to a project's backpressure policy. At most one exists per
 * project.
 *
 * @param projectId         owning project
 * @param version           optimistic-concurrency version, starting at 1
 * @param proposed          sparse fields to merge into the live policy on apply
 * @param requiredApprovals distinct approvals needed before apply (1..10)
 * @param approvals         approvals in the order they were recorded
 * @param activateAt        earliest apply time, or {@code null} for no time gate
 * @param createdBy         actor who first drafted it
 * @param createdAt         creation time
 * @param updatedAt         time of the last amendment or approval
 */
public record BackpressureDraft(
    String projectId,
    long version,
    PolicyPatch proposed,
    int requiredApprovals,
    List<DraftApproval> approvals,
    Instant activateAt,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public static final int MAX_REQUIRED_APPROVALS = 10;

  public BackpressureDraft {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(proposed, "proposed");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    BackpressureSettings.checkRange("required_approvals", requiredApprovals, 1, MAX_REQUIRED_APPROVALS);
    approvals = approvals == null ? List.of() : List.copyOf(approvals);
  }

  public int approvalCount() {
    return approvals.size();
  }

  /**
   * Actor names compare case-insensitively.
   */
  public boolean hasApprovalFrom(String actor) {
    String key = actor.trim().toLowerCase(Locale.ROOT);
    return approvals.stream().anyMatch(a -> a.actor().trim().toLowerCase(Locale.ROOT).equals(key));
  }
}
