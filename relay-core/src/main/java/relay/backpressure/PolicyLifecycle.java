package relay.backpressure;

import relay.ConcurrencyException;
import relay.ControlPlaneConfig;
import relay.DraftNotReadyException;
import relay.NotFoundException;
import relay.ValidationException;
import relay.audit.AuditPayload;
import relay.spi.AuditLog;
import relay.spi.PolicyStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Staged lifecycle for backpressure policy changes: draft, amend, approve, then apply once the
 * activation time has passed and the approval quorum is met.
 *
 * <p>Every mutation is a compare-and-set against the {@link PolicyStore}; a lost race is retried
 * against fresh state up to {@link ControlPlaneConfig#getConcurrencyRetries()} times before a
 * {@link ConcurrencyException} is raised, so concurrent approvals are never lost.
 *
 * <p>This class is thread-safe.
 */
public final class PolicyLifecycle {
  private static final Logger logger = Logger.getLogger(PolicyLifecycle.class.getName());

  private final PolicyStore policyStore;
  private final AuditLog auditLog;
  private final ControlPlaneConfig config;
  private final Clock clock;

  public PolicyLifecycle(PolicyStore policyStore, AuditLog auditLog, ControlPlaneConfig config, Clock clock) {
    this.policyStore = Objects.requireNonNull(policyStore, "policyStore");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the stored policy, or the configured default (version 0) if none was ever applied.
   */
  public BackpressurePolicy livePolicy(String projectId) {
    Objects.requireNonNull(projectId, "projectId");
    return policyStore.findPolicy(projectId)
        .orElseGet(() -> BackpressurePolicy.initial(projectId, config.getDefaultBackpressure()));
  }

  public Optional<BackpressureDraft> findDraft(String projectId) {
    return policyStore.findDraft(projectId);
  }

  /**
   * Creates the project's draft or folds {@code amendment} into the existing one.
   *
   * <p>Changing the proposed policy fields discards recorded approvals, since they attested to
   * the previous proposal. Changing only the quorum or activation time keeps them.
   *
   * @return the stored draft
   * @throws ValidationException  if {@code actor} is blank
   * @throws ConcurrencyException if the retry budget ran out
   */
  public BackpressureDraft upsertDraft(String projectId, String actor, DraftAmendment amendment) {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(amendment, "amendment");
    String by = requireActor(actor);
    return withRetries("upsert draft", projectId, () -> {
      Instant now = clock.instant();
      Optional<BackpressureDraft> existing = policyStore.findDraft(projectId);
      BackpressureDraft next;
      boolean approvalsReset = false;
      if (existing.isEmpty()) {
        next = new BackpressureDraft(projectId, 1L, amendment.policy(),
            amendment.requiredApprovals().applyTo(config.getDefaultRequiredApprovals()),
            List.of(), amendment.activateAt().applyTo(null), by, now, now);
      } else {
        BackpressureDraft current = existing.get();
        PolicyPatch merged = current.proposed().mergedWith(amendment.policy());
        approvalsReset = !current.approvals().isEmpty() && !merged.equals(current.proposed());
        next = new BackpressureDraft(projectId, current.version() + 1, merged,
            amendment.requiredApprovals().applyTo(current.requiredApprovals()),
            approvalsReset ? List.of() : current.approvals(),
            amendment.activateAt().applyTo(current.activateAt()),
            current.createdBy(), current.createdAt(), now);
      }
      long expected = existing.map(BackpressureDraft::version).orElse(0L);
      if (!policyStore.saveDraft(next, expected)) {
        return Optional.empty();
      }
      auditLog.appendEvent(projectId, by, new AuditPayload.DraftUpdated(next.version(), next.proposed(),
          next.requiredApprovals(), next.activateAt(), approvalsReset));
      return Optional.of(next);
    });
  }

  /**
   * Records {@code actor}'s approval. Approving twice is a no-op (actors compare
   * case-insensitively).
   *
   * @throws NotFoundException if the project has no draft
   */
  public BackpressureDraft recordApproval(String projectId, String actor) {
    Objects.requireNonNull(projectId, "projectId");
    String by = requireActor(actor);
    return withRetries("record approval", projectId, () -> {
      BackpressureDraft draft = requireDraft(projectId);
      if (draft.hasApprovalFrom(by)) {
        return Optional.of(draft);
      }
      Instant now = clock.instant();
      List<DraftApproval> approvals = new ArrayList<>(draft.approvals());
      approvals.add(new DraftApproval(by, now));
      BackpressureDraft next = new BackpressureDraft(projectId, draft.version() + 1, draft.proposed(),
          draft.requiredApprovals(), approvals, draft.activateAt(), draft.createdBy(), draft.createdAt(), now);
      if (!policyStore.saveDraft(next, draft.version())) {
        return Optional.empty();
      }
      auditLog.appendEvent(projectId, by, new AuditPayload.DraftApproved(next.version(), by,
          next.approvalCount(), next.requiredApprovals()));
      return Optional.of(next);
    });
  }

  /**
   * Decides whether {@code draft} may be applied at {@code now}.
   *
   * <p>The activation time is checked first: a future {@code activateAt} blocks with
   * {@link BlockReason#ACTIVATION_TIME_PENDING} regardless of approvals. Otherwise the draft is
   * ready once it has at least {@code requiredApprovals} approvals.
   */
  public static ActivationDecision evaluateActivation(BackpressureDraft draft, Instant now) {
    Objects.requireNonNull(draft, "draft");
    Objects.requireNonNull(now, "now");
    if (draft.activateAt() != null && now.isBefore(draft.activateAt())) {
      return ActivationDecision.timePending(draft.activateAt());
    }
    int count = draft.approvalCount();
    int remaining = Math.max(0, draft.requiredApprovals() - count);
    if (remaining > 0) {
      return ActivationDecision.approvalsPending(count, remaining, draft.activateAt());
    }
    return ActivationDecision.ready(count, draft.activateAt());
  }

  /**
   * Evaluates the project's draft at the current time.
   *
   * @throws NotFoundException if the project has no draft
   */
  public ActivationDecision evaluateActivation(String projectId) {
    return evaluateActivation(requireDraft(projectId), clock.instant());
  }

  /**
   * Merges the draft's present fields into the live policy and clears the draft, atomically.
   *
   * @return the new live policy
   * @throws NotFoundException      if the project has no draft; the live policy is untouched
   * @throws DraftNotReadyException if the draft is still time-gated or short of approvals
   */
  public BackpressurePolicy applyDraft(String projectId, String actor) {
    Objects.requireNonNull(projectId, "projectId");
    String by = requireActor(actor);
    return withRetries("apply draft", projectId, () -> {
      BackpressureDraft draft = requireDraft(projectId);
      Instant now = clock.instant();
      ActivationDecision decision = evaluateActivation(draft, now);
      if (!decision.ready()) {
        throw new DraftNotReadyException(projectId, decision);
      }
      BackpressurePolicy live = livePolicy(projectId);
      BackpressurePolicy next = draft.proposed().applyTo(live, live.version() + 1, now);
      if (!policyStore.applyDraft(projectId, draft.version(), next, live.version())) {
        return Optional.empty();
      }
      auditLog.appendEvent(projectId, by, new AuditPayload.PolicyUpdated(next.version(), draft.version(),
          draft.proposed()));
      logger.log(Level.INFO, "Applied backpressure draft v{0} for project {1} as policy v{2}",
          new Object[] {draft.version(), projectId, next.version()});
      return Optional.of(next);
    });
  }

  /**
   * Evaluates every pending draft, earliest activation first, and applies the ready ones unless
   * {@code dryRun}. A failure on one project is reported and does not stop the sweep.
   */
  public List<ActivationSweepResult> activateReadyDrafts(String actor, boolean dryRun) {
    String by = requireActor(actor);
    Instant now = clock.instant();
    List<BackpressureDraft> drafts = new ArrayList<>(policyStore.listDrafts());
    drafts.sort(Comparator.comparing(BackpressureDraft::activateAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(BackpressureDraft::projectId));
    List<ActivationSweepResult> results = new ArrayList<>(drafts.size());
    for (BackpressureDraft draft : drafts) {
      ActivationDecision decision = evaluateActivation(draft, now);
      if (!decision.ready()) {
        results.add(new ActivationSweepResult(draft.projectId(), SweepStatus.BLOCKED, decision, null));
      } else if (dryRun) {
        results.add(new ActivationSweepResult(draft.projectId(), SweepStatus.READY, decision, null));
      } else {
        try {
          applyDraft(draft.projectId(), by);
          results.add(new ActivationSweepResult(draft.projectId(), SweepStatus.APPLIED, decision, null));
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Failed to activate draft for project " + draft.projectId(), e);
          results.add(new ActivationSweepResult(draft.projectId(), SweepStatus.FAILED, decision,
              String.valueOf(e.getMessage())));
        }
      }
    }
    return results;
  }

  private BackpressureDraft requireDraft(String projectId) {
    return policyStore.findDraft(projectId)
        .orElseThrow(() -> new NotFoundException("draft not found for project " + projectId));
  }

  private <T> T withRetries(String operation, String projectId, Supplier<Optional<T>> attempt) {
    int attempts = config.getConcurrencyRetries() + 1;
    for (int i = 1; i <= attempts; i++) {
      Optional<T> result = attempt.get();
      if (result.isPresent()) {
        return result.get();
      }
      logger.log(Level.FINE, "Lost concurrent update during {0} for project {1} (attempt {2})",
          new Object[] {operation, projectId, i});
    }
    logger.log(Level.WARNING, "Giving up on {0} for project {1} after {2} conflicting updates",
        new Object[] {operation, projectId, attempts});
    throw new ConcurrencyException(operation + " for project " + projectId + " kept conflicting with concurrent updates");
  }

  static String requireActor(String actor) {
    if (actor == null || actor.isBlank()) {
      throw new ValidationException("actor", "must not be blank");
    }
    return actor.trim();
  }
}
