package relay.backpressure;

import org.junit.jupiter.api.Test;
import relay.ConcurrencyException;
import relay.ControlPlaneConfig;
import relay.DraftNotReadyException;
import relay.NotFoundException;
import relay.ValidationException;
import relay.audit.AuditPayload;
import relay.audit.InMemoryAuditLog;
import relay.guardian.GuardianPolicy;
import relay.model.Patch;
import relay.spi.PolicyStore;
import relay.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PolicyLifecycleTest {
  private static final Instant NOW = Instant.parse("2026-02-21T12:00:00Z");

  private final InMemoryPolicyStore store = new InMemoryPolicyStore();
  private final InMemoryAuditLog auditLog = new InMemoryAuditLog();
  private final MutableClock clock = new MutableClock(NOW);
  private final ControlPlaneConfig config = new ControlPlaneConfig();
  private final PolicyLifecycle lifecycle = new PolicyLifecycle(store, auditLog, config, clock);

  @Test
  void livePolicyDefaultsToConfig() {
    BackpressurePolicy live = lifecycle.livePolicy("p");

    assertEquals(0L, live.version());
    assertEquals(config.getDefaultBackpressure(), live.defaults());
    assertEquals(SettingsSource.CONFIG_DEFAULT, live.settingsFor("webhook").source());
  }

  @Test
  void upsertCreatesThenMergesSparseFields() {
    lifecycle.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxRetrying(20).build()));
    BackpressureDraft draft = lifecycle.upsertDraft("p", "bob",
        DraftAmendment.of(PolicyPatch.builder().minLimit(4).build()).withRequiredApprovals(2));

    assertEquals(2L, draft.version());
    assertEquals(20, draft.proposed().maxRetrying().value());
    assertEquals(4, draft.proposed().minLimit().value());
    assertFalse(draft.proposed().maxDueNow().isPresent());
    assertEquals(2, draft.requiredApprovals());
    assertEquals("alice", draft.createdBy());
  }

  @Test
  void outOfRangeValuesAreRejectedNotClamped() {
    ValidationException e = assertThrows(ValidationException.class,
        () -> PolicyPatch.builder().maxRetrying(10_001).build());
    assertEquals("max_retrying", e.field());
    assertThrows(ValidationException.class, () -> PolicyPatch.builder().minLimit(0).build());
    assertThrows(ValidationException.class,
        () -> DraftAmendment.of(PolicyPatch.empty()));
    assertTrue(lifecycle.findDraft("p").isEmpty());
  }

  @Test
  void approvalIsIdempotentPerActor() {
    lifecycle.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()));

    lifecycle.recordApproval("p", "bob");
    BackpressureDraft draft = lifecycle.recordApproval("p", " BOB ");

    assertEquals(1, draft.approvalCount());
  }

  @Test
  void amendingProposalResetsApprovals() {
    lifecycle.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()));
    lifecycle.recordApproval("p", "bob");

    BackpressureDraft amended = lifecycle.upsertDraft("p", "alice",
        DraftAmendment.of(PolicyPatch.builder().maxDueNow(12).build()));

    assertEquals(0, amended.approvalCount());
    AuditPayload.DraftUpdated event = (AuditPayload.DraftUpdated) auditLog.listEvents("p", 1).get(0).payload();
    assertTrue(event.approvalsReset());
  }

  @Test
  void changingOnlyScheduleKeepsApprovals() {
    lifecycle.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()));
    lifecycle.recordApproval("p", "bob");

    BackpressureDraft amended = lifecycle.upsertDraft("p", "alice",
        new DraftAmendment(PolicyPatch.empty(), Patch.of(3), Patch.absent()));

    assertEquals(1, amended.approvalCount());
    assertEquals(3, amended.requiredApprovals());
  }

  @Test
  void timeGateIsCheckedBeforeApprovals() {
    Instant later = NOW.plus(Duration.ofHours(1));
    lifecycle.upsertDraft("p", "alice",
        DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()).withActivateAt(later));

    ActivationDecision decision = lifecycle.evaluateActivation("p");

    assertFalse(decision.ready());
    assertEquals(BlockReason.ACTIVATION_TIME_PENDING, decision.reason());
    assertFalse(decision.activationReady());
    assertNull(decision.approvalCount());
  }

  @Test
  void approvalsPendingReportsRemaining() {
    lifecycle.upsertDraft("p", "alice",
        DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()).withRequiredApprovals(2));
    lifecycle.recordApproval("p", "bob");

    ActivationDecision decision = lifecycle.evaluateActivation("p");

    assertFalse(decision.ready());
    assertEquals(BlockReason.APPROVALS_PENDING, decision.reason());
    assertTrue(decision.activationReady());
    assertEquals(1, decision.approvalCount());
    assertEquals(1, decision.approvalsRemaining());
  }

  @Test
  void readyOnceActivationTimePassesWithQuorum() {
    lifecycle.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build())
        .withActivateAt(NOW.plusSeconds(60)));
    lifecycle.recordApproval("p", "bob");
    clock.advance(Duration.ofSeconds(60));

    ActivationDecision decision = lifecycle.evaluateActivation("p");

    assertTrue(decision.ready());
    assertNull(decision.reason());
    assertEquals(0, decision.approvalsRemaining());
  }

  @Test
  void applyMergesPresentFieldsOnlyAndClearsDraft() {
    lifecycle.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder()
        .maxDueNow(10)
        .connectorOverride("Slack_Webhook", new BackpressureSettings(true, 5, 5, 1))
        .build()));
    lifecycle.recordApproval("p", "bob");

    BackpressurePolicy applied = lifecycle.applyDraft("p", "alice");

    assertEquals(1L, applied.version());
    assertEquals(10, applied.maxDueNow());
    assertEquals(50, applied.maxRetrying());
    assertEquals(1, applied.minLimit());
    assertTrue(applied.isEnabled());
    assertEquals(new BackpressureSettings(true, 5, 5, 1), applied.connectorOverrides().get("slack"));
    assertTrue(lifecycle.findDraft("p").isEmpty());
    assertEquals(applied, lifecycle.livePolicy("p"));
    assertEquals(AuditPayload.POLICY_UPDATED, auditLog.listEvents("p", 1).get(0).eventType());
  }

  @Test
  void applyWithoutDraftIsNotFoundAndLeavesPolicyAlone() {
    BackpressurePolicy before = lifecycle.livePolicy("p");

    assertThrows(NotFoundException.class, () -> lifecycle.applyDraft("p", "alice"));

    assertEquals(before, lifecycle.livePolicy("p"));
  }

  @Test
  void applyOfUnreadyDraftIsRefused() {
    lifecycle.upsertDraft("p", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()));

    DraftNotReadyException e = assertThrows(DraftNotReadyException.class, () -> lifecycle.applyDraft("p", "alice"));

    assertEquals(BlockReason.APPROVALS_PENDING, e.decision().reason());
    assertTrue(lifecycle.findDraft("p").isPresent());
  }

  @Test
  void blankActorIsRejected() {
    assertThrows(ValidationException.class, () -> lifecycle.upsertDraft("p", " ",
        DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build())));
  }

  @Test
  void sweepAppliesReadyAndReportsBlocked() {
    lifecycle.upsertDraft("ready", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()));
    lifecycle.recordApproval("ready", "bob");
    lifecycle.upsertDraft("waiting", "alice", DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()));

    List<ActivationSweepResult> dry = lifecycle.activateReadyDrafts("scheduler", true);
    assertEquals(SweepStatus.READY, find(dry, "ready").status());
    assertTrue(lifecycle.findDraft("ready").isPresent());

    List<ActivationSweepResult> results = lifecycle.activateReadyDrafts("scheduler", false);

    assertEquals(SweepStatus.APPLIED, find(results, "ready").status());
    assertEquals(SweepStatus.BLOCKED, find(results, "waiting").status());
    assertEquals(1L, lifecycle.livePolicy("ready").version());
    assertEquals(0L, lifecycle.livePolicy("waiting").version());
  }

  @Test
  void concurrentApprovalsAreAllRecorded() throws Exception {
    config.setConcurrencyRetries(10);
    lifecycle.upsertDraft("p", "alice",
        DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build()).withRequiredApprovals(8));

    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<BackpressureDraft>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        String actor = "approver-" + i;
        futures.add(pool.submit(() -> {
          start.await();
          return lifecycle.recordApproval("p", actor);
        }));
      }
      start.countDown();
      for (Future<BackpressureDraft> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(8, lifecycle.findDraft("p").orElseThrow().approvalCount());
    assertTrue(lifecycle.evaluateActivation("p").ready());
  }

  @Test
  void exhaustedRetriesSurfaceConcurrencyError() {
    PolicyLifecycle losing = new PolicyLifecycle(new AlwaysConflictingStore(), auditLog, config, clock);

    assertThrows(ConcurrencyException.class, () -> losing.upsertDraft("p", "alice",
        DraftAmendment.of(PolicyPatch.builder().maxDueNow(10).build())));
  }

  private static ActivationSweepResult find(List<ActivationSweepResult> results, String projectId) {
    return results.stream().filter(r -> r.projectId().equals(projectId)).findFirst().orElseThrow();
  }

  /** Loses every compare-and-set. */
  private static final class AlwaysConflictingStore implements PolicyStore {
    @Override public Optional<BackpressurePolicy> findPolicy(String projectId) { return Optional.empty(); }
    @Override public Optional<BackpressureDraft> findDraft(String projectId) { return Optional.empty(); }
    @Override public List<BackpressureDraft> listDrafts() { return List.of(); }
    @Override public boolean saveDraft(BackpressureDraft draft, long expectedVersion) { return false; }
    @Override public boolean applyDraft(String projectId, long expectedDraftVersion, BackpressurePolicy policy,
        long expectedPolicyVersion) { return false; }
    @Override public Optional<GuardianPolicy> findGuardianPolicy(String projectId) { return Optional.empty(); }
    @Override public void saveGuardianPolicy(GuardianPolicy policy) {}
    @Override public List<String> listGuardedProjects() { return List.of(); }
  }
}
