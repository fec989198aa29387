package relay.spi;

import relay.backpressure.BackpressureDraft;
import relay.backpressure.BackpressurePolicy;
import relay.guardian.GuardianPolicy;

import java.util.List;
import java.util.Optional;

/**
 * Versioned storage for backpressure policies, their drafts and guardian policies.
 *
 * <p>Writes are compare-and-set on a version number: a write that returns {@code false} lost
 * against a concurrent writer and should be retried against fresh state.
 */
public interface PolicyStore {

    Optional<BackpressurePolicy> findPolicy(String projectId);

    Optional<BackpressureDraft> findDraft(String projectId);

    /**
     * Returns every pending draft, ordered by project id.
     */
    List<BackpressureDraft> listDrafts();

    /**
     * Stores {@code draft} if the current draft has {@code expectedVersion}
     * (0 meaning no draft exists yet).
     *
     * @return {@code true} if stored
     */
    boolean saveDraft(BackpressureDraft draft, long expectedVersion);

    /**
     * Atomically replaces the live policy with {@code policy} and deletes the draft, provided the
     * draft still has {@code expectedDraftVersion} and the live policy still has
     * {@code expectedPolicyVersion} (0 meaning none stored).
     *
     * @return {@code true} if applied
     */
    boolean applyDraft(String projectId, long expectedDraftVersion, BackpressurePolicy policy,
        long expectedPolicyVersion);

    Optional<GuardianPolicy> findGuardianPolicy(String projectId);

    void saveGuardianPolicy(GuardianPolicy policy);

    /**
     * Returns the projects with an enabled guardian policy.
     */
    List<String> listGuardedProjects();
}
