package relay.backpressure;

import relay.guardian.GuardianPolicy;
import relay.spi.PolicyStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Heap-backed {@link PolicyStore} for single-process deployments and tests.
 *
 * <p>All operations lock the store, so compare-and-set semantics hold across threads.
 */
public final class InMemoryPolicyStore implements PolicyStore {
  private final Map<String, BackpressurePolicy> policies = new TreeMap<>();
  private final Map<String, BackpressureDraft> drafts = new TreeMap<>();
  private final Map<String, GuardianPolicy> guardianPolicies = new TreeMap<>();

  @Override
  public synchronized Optional<BackpressurePolicy> findPolicy(String projectId) {
    return Optional.ofNullable(policies.get(projectId));
  }

  @Override
  public synchronized Optional<BackpressureDraft> findDraft(String projectId) {
    return Optional.ofNullable(drafts.get(projectId));
  }

  @Override
  public synchronized List<BackpressureDraft> listDrafts() {
    return new ArrayList<>(drafts.values());
  }

  @Override
  public synchronized boolean saveDraft(BackpressureDraft draft, long expectedVersion) {
    BackpressureDraft current = drafts.get(draft.projectId());
    long currentVersion = current == null ? 0L : current.version();
    if (currentVersion != expectedVersion) {
      return false;
    }
    drafts.put(draft.projectId(), draft);
    return true;
  }

  @Override
  public synchronized boolean applyDraft(String projectId, long expectedDraftVersion,
      BackpressurePolicy policy, long expectedPolicyVersion) {
    BackpressureDraft draft = drafts.get(projectId);
    if (draft == null || draft.version() != expectedDraftVersion) {
      return false;
    }
    BackpressurePolicy current = policies.get(projectId);
    long currentVersion = current == null ? 0L : current.version();
    if (currentVersion != expectedPolicyVersion) {
      return false;
    }
    policies.put(projectId, policy);
    drafts.remove(projectId);
    return true;
  }

  @Override
  public synchronized Optional<GuardianPolicy> findGuardianPolicy(String projectId) {
    return Optional.ofNullable(guardianPolicies.get(projectId));
  }

  @Override
  public synchronized void saveGuardianPolicy(GuardianPolicy policy) {
    guardianPolicies.put(policy.projectId(), policy);
  }

  @Override
  public synchronized List<String> listGuardedProjects() {
    return guardianPolicies.values().stream()
        .filter(GuardianPolicy::enabled)
        .map(GuardianPolicy::projectId)
        .toList();
  }
}
