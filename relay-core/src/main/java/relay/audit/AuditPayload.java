package relay.audit;

import relay.backpressure.PolicyMetadata;
import relay.backpressure.PolicyPatch;
import relay.guardian.GuardianPolicy;
import relay.reliability.Recommendation;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed body of an {@link AuditEvent}, one variant per known event type.
 *
 * <p>Events written by newer or foreign producers decode to {@link Unrecognized}, which keeps the
 * raw metadata instead of failing.
 */
public sealed interface AuditPayload {
  String DELIVERY_QUEUED = "connector_delivery_queued";
  String DELIVERY_ATTEMPTED = "connector_delivery_attempted";
  String DELIVERY_DELIVERED = "connector_delivery_delivered";
  String DELIVERY_DEAD_LETTERED = "connector_delivery_dead_lettered";
  String DRAFT_UPDATED = "backpressure_draft_updated";
  String DRAFT_APPROVED = "backpressure_draft_approved";
  String POLICY_UPDATED = "backpressure_policy_updated";
  String GUARDIAN_POLICY_UPDATED = "guardian_policy_updated";
  String GUARDIAN_ACTION_EXECUTED = "guardian_action_executed";
  String GUARDIAN_ACTION_FAILED = "guardian_action_failed";

  /** Wire name of the event type. */
  String eventType();

  /** Flat encoding for persistence. */
  Map<String, String> toMetadata();

  /**
   * Decodes a stored payload. Unknown types, and known types whose metadata no longer parses,
   * become {@link Unrecognized}.
   */
  static AuditPayload decode(String eventType, Map<String, String> m) {
    Objects.requireNonNull(eventType, "eventType");
    try {
      return switch (eventType) {
        case DELIVERY_QUEUED -> new DeliveryQueued(m.get("delivery_id"), m.get("connector_type"),
            Boolean.parseBoolean(m.get("redrive")));
        case DELIVERY_ATTEMPTED -> new DeliveryAttempted(m.get("delivery_id"), m.get("connector_type"),
            Integer.parseInt(m.get("attempt_number")), intOrNull(m.get("status_code")), m.get("error"),
            Long.parseLong(m.get("latency_ms")));
        case DELIVERY_DELIVERED -> new Delivered(m.get("delivery_id"), m.get("connector_type"),
            Integer.parseInt(m.get("attempt_count")));
        case DELIVERY_DEAD_LETTERED -> new DeadLettered(m.get("delivery_id"), m.get("connector_type"),
            Integer.parseInt(m.get("attempt_count")), m.get("reason"));
        case DRAFT_UPDATED -> new DraftUpdated(Long.parseLong(m.get("draft_version")),
            PolicyMetadata.decodePatch(unprefixed(m, "proposed.")),
            Integer.parseInt(m.get("required_approvals")),
            m.get("activate_at") == null ? null : Instant.parse(m.get("activate_at")),
            Boolean.parseBoolean(m.get("approvals_reset")));
        case DRAFT_APPROVED -> new DraftApproved(Long.parseLong(m.get("draft_version")), m.get("approver"),
            Integer.parseInt(m.get("approval_count")), Integer.parseInt(m.get("required_approvals")));
        case POLICY_UPDATED -> new PolicyUpdated(Long.parseLong(m.get("policy_version")),
            Long.parseLong(m.get("draft_version")), PolicyMetadata.decodePatch(unprefixed(m, "applied.")));
        case GUARDIAN_POLICY_UPDATED -> new GuardianPolicyUpdated(
            GuardianPolicy.fromMetadata(m.get("project_id"), m));
        case GUARDIAN_ACTION_EXECUTED -> new GuardianActionExecuted(m.get("connector_type"),
            Recommendation.fromWireName(m.get("action")), Double.parseDouble(m.get("risk_score")),
            Integer.parseInt(m.get("affected")), Boolean.parseBoolean(m.get("dry_run")));
        case GUARDIAN_ACTION_FAILED -> new GuardianActionFailed(m.get("connector_type"),
            Recommendation.fromWireName(m.get("action")), m.get("error"));
        default -> new Unrecognized(eventType, m);
      };
    } catch (RuntimeException e) {
      return new Unrecognized(eventType, m);
    }
  }

  record DeliveryQueued(String deliveryId, String connectorType, boolean redrive) implements AuditPayload {
    @Override
    public String eventType() {
      return DELIVERY_QUEUED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("delivery_id", deliveryId);
      m.put("connector_type", connectorType);
      m.put("redrive", Boolean.toString(redrive));
      return m;
    }
  }

  record DeliveryAttempted(String deliveryId, String connectorType, int attemptNumber, Integer statusCode,
      String error, long latencyMs) implements AuditPayload {
    @Override
    public String eventType() {
      return DELIVERY_ATTEMPTED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("delivery_id", deliveryId);
      m.put("connector_type", connectorType);
      m.put("attempt_number", Integer.toString(attemptNumber));
      if (statusCode != null) {
        m.put("status_code", statusCode.toString());
      }
      if (error != null) {
        m.put("error", error);
      }
      m.put("latency_ms", Long.toString(latencyMs));
      return m;
    }
  }

  record Delivered(String deliveryId, String connectorType, int attemptCount) implements AuditPayload {
    @Override
    public String eventType() {
      return DELIVERY_DELIVERED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("delivery_id", deliveryId);
      m.put("connector_type", connectorType);
      m.put("attempt_count", Integer.toString(attemptCount));
      return m;
    }
  }

  record DeadLettered(String deliveryId, String connectorType, int attemptCount, String reason)
      implements AuditPayload {
    @Override
    public String eventType() {
      return DELIVERY_DEAD_LETTERED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("delivery_id", deliveryId);
      m.put("connector_type", connectorType);
      m.put("attempt_count", Integer.toString(attemptCount));
      m.put("reason", reason);
      return m;
    }
  }

  record DraftUpdated(long draftVersion, PolicyPatch proposed, int requiredApprovals, Instant activateAt,
      boolean approvalsReset) implements AuditPayload {
    @Override
    public String eventType() {
      return DRAFT_UPDATED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("draft_version", Long.toString(draftVersion));
      m.put("required_approvals", Integer.toString(requiredApprovals));
      if (activateAt != null) {
        m.put("activate_at", activateAt.toString());
      }
      m.put("approvals_reset", Boolean.toString(approvalsReset));
      PolicyMetadata.encodePatch(proposed).forEach((k, v) -> m.put("proposed." + k, v));
      return m;
    }
  }

  record DraftApproved(long draftVersion, String approver, int approvalCount, int requiredApprovals)
      implements AuditPayload {
    @Override
    public String eventType() {
      return DRAFT_APPROVED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("draft_version", Long.toString(draftVersion));
      m.put("approver", approver);
      m.put("approval_count", Integer.toString(approvalCount));
      m.put("required_approvals", Integer.toString(requiredApprovals));
      return m;
    }
  }

  record PolicyUpdated(long policyVersion, long draftVersion, PolicyPatch applied) implements AuditPayload {
    @Override
    public String eventType() {
      return POLICY_UPDATED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("policy_version", Long.toString(policyVersion));
      m.put("draft_version", Long.toString(draftVersion));
      PolicyMetadata.encodePatch(applied).forEach((k, v) -> m.put("applied." + k, v));
      return m;
    }
  }

  record GuardianPolicyUpdated(GuardianPolicy policy) implements AuditPayload {
    @Override
    public String eventType() {
      return GUARDIAN_POLICY_UPDATED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("project_id", policy.projectId());
      m.putAll(policy.toMetadata());
      return m;
    }
  }

  record GuardianActionExecuted(String connectorType, Recommendation action, double riskScore, int affected,
      boolean dryRun) implements AuditPayload {
    @Override
    public String eventType() {
      return GUARDIAN_ACTION_EXECUTED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("connector_type", connectorType);
      m.put("action", action.wireName());
      m.put("risk_score", Double.toString(riskScore));
      m.put("affected", Integer.toString(affected));
      m.put("dry_run", Boolean.toString(dryRun));
      return m;
    }
  }

  record GuardianActionFailed(String connectorType, Recommendation action, String error) implements AuditPayload {
    @Override
    public String eventType() {
      return GUARDIAN_ACTION_FAILED;
    }

    @Override
    public Map<String, String> toMetadata() {
      Map<String, String> m = new LinkedHashMap<>();
      m.put("connector_type", connectorType);
      m.put("action", action.wireName());
      m.put("error", String.valueOf(error));
      return m;
    }
  }

  record Unrecognized(String eventType, Map<String, String> metadata) implements AuditPayload {
    public Unrecognized {
      Objects.requireNonNull(eventType, "eventType");
      metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public Map<String, String> toMetadata() {
      return new LinkedHashMap<>(metadata);
    }
  }

  private static Integer intOrNull(String value) {
    return value == null ? null : Integer.valueOf(value);
  }

  private static Map<String, String> unprefixed(Map<String, String> m, String prefix) {
    Map<String, String> out = new LinkedHashMap<>();
    m.forEach((k, v) -> {
      if (k.startsWith(prefix)) {
        out.put(k.substring(prefix.length()), v);
      }
    });
    return out;
  }
}
