package relay.guardian;

import relay.ControlPlaneConfig;
import relay.ValidationException;
import relay.audit.AuditPayload;
import relay.spi.AuditLog;
import relay.spi.PolicyStore;
import relay.util.Arguments;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and updates per-project guardian policies. Projects without a stored policy get
 * {@link ControlPlaneConfig#defaultGuardianPolicy(String)}.
 */
public final class GuardianPolicies {
  private static final Logger logger = Logger.getLogger(GuardianPolicies.class.getName());

  private final PolicyStore policyStore;
  private final AuditLog auditLog;
  private final ControlPlaneConfig config;

  public GuardianPolicies(PolicyStore policyStore, AuditLog auditLog, ControlPlaneConfig config) {
    this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.config = Objects.requireNonNull(config, "config");
  }

  public GuardianPolicy policyFor(String projectId) {
    String project = Arguments.projectId(projectId);
    return policyStore.findGuardianPolicy(project).orElseGet(() -> config.defaultGuardianPolicy(project));
  }

  /**
   * Projects whose stored guardian policy is enabled.
   */
  public List<String> guardedProjects() {
    return policyStore.listGuardedProjects();
  }

  /**
   * Merges {@code patch} onto the current policy and stores the result.
   *
   * @throws ValidationException if a merged field is out of range; nothing is stored
   */
  public GuardianPolicy upsert(String projectId, String actor, GuardianPolicyPatch patch) {
    Objects.requireNonNull(patch, "patch");
    if (actor == null || actor.isBlank()) {
      throw new ValidationException("actor", "must not be blank");
    }
    GuardianPolicy updated = patch.applyTo(policyFor(projectId));
    policyStore.saveGuardianPolicy(updated);
    auditLog.appendEvent(updated.projectId(), actor.trim(), new AuditPayload.GuardianPolicyUpdated(updated));
    logger.log(Level.INFO, "Guardian policy for project {0} updated by {1} (enabled={2})",
        new Object[] {updated.projectId(), actor.trim(), updated.enabled()});
    return updated;
  }
}
