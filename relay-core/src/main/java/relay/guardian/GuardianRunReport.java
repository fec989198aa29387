package relay.guardian;

import java.time.Instant;
import java.util.List;

/**
 * What one guardian run over a project did.
 *
 * @param projectId  the project
 * @param ranAt      run time
 * @param dryRun     whether actions were only planned
 * @param enabled    {@code false} when the project's guardian policy is disabled (nothing else happens)
 * @param candidates actions selected before the cooldown
 * @param executed   results of the actions that ran (or would have run)
 * @param skipped    actions held back by the cooldown
 */
public record GuardianRunReport(
    String projectId,
    Instant ranAt,
    boolean dryRun,
    boolean enabled,
    List<GuardianAction> candidates,
    List<GuardianActionResult> executed,
    List<SkippedAction> skipped) {

  public GuardianRunReport {
    candidates = List.copyOf(candidates);
    executed = List.copyOf(executed);
    skipped = List.copyOf(skipped);
  }

  static GuardianRunReport disabled(String projectId, Instant ranAt, boolean dryRun) {
    return new GuardianRunReport(projectId, ranAt, dryRun, false, List.of(), List.of(), List.of());
  }

  public long failures() {
    return executed.stream().filter(GuardianActionResult::failed).count();
  }
}
