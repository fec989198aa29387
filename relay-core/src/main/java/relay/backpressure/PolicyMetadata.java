package relay.backpressure;

import relay.model.Patch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Flat string-map encodings of policies, drafts and patches, for audit metadata and JDBC
 * persistence through {@link relay.util.JsonCodec}.
 *
 * <p>Connector overrides are keyed {@code override.<type>.<field>}; a patch that removes an
 * override writes {@code override.<type>=removed}.
 */
public final class PolicyMetadata {
  private static final String OVERRIDE = "override.";
  private static final String PROPOSED = "proposed.";
  private static final String APPROVAL = "approval.";
  private static final String REMOVED = "removed";
  private static final String SET = "set";

  private PolicyMetadata() {}

  public static Map<String, String> encodePatch(PolicyPatch patch) {
    Map<String, String> out = new LinkedHashMap<>();
    putIfPresent(out, "is_enabled", patch.enabled());
    putIfPresent(out, "max_retrying", patch.maxRetrying());
    putIfPresent(out, "max_due_now", patch.maxDueNow());
    putIfPresent(out, "min_limit", patch.minLimit());
    patch.connectorOverrides().forEach((type, override) -> {
      if (override.value() == null) {
        out.put(OVERRIDE + type, REMOVED);
      } else {
        out.put(OVERRIDE + type, SET);
        putSettings(out, OVERRIDE + type + ".", override.value());
      }
    });
    return out;
  }

  public static PolicyPatch decodePatch(Map<String, String> in) {
    Map<String, Patch<BackpressureSettings>> overrides = new TreeMap<>();
    for (String type : overrideTypes(in)) {
      if (REMOVED.equals(in.get(OVERRIDE + type))) {
        overrides.put(type, Patch.of(null));
      } else {
        overrides.put(type, Patch.of(readSettings(in, OVERRIDE + type + ".")));
      }
    }
    return new PolicyPatch(
        Patch.ofNullable(in.containsKey("is_enabled") ? Boolean.valueOf(in.get("is_enabled")) : null),
        Patch.ofNullable(readInt(in, "max_retrying")),
        Patch.ofNullable(readInt(in, "max_due_now")),
        Patch.ofNullable(readInt(in, "min_limit")),
        overrides);
  }

  public static Map<String, String> encodePolicy(BackpressurePolicy policy) {
    Map<String, String> out = new LinkedHashMap<>();
    out.put("version", Long.toString(policy.version()));
    if (policy.updatedAt() != null) {
      out.put("updated_at", policy.updatedAt().toString());
    }
    putSettings(out, "", policy.defaults());
    policy.connectorOverrides().forEach((type, settings) -> {
      out.put(OVERRIDE + type, SET);
      putSettings(out, OVERRIDE + type + ".", settings);
    });
    return out;
  }

  public static BackpressurePolicy decodePolicy(String projectId, Map<String, String> in) {
    Map<String, BackpressureSettings> overrides = new TreeMap<>();
    for (String type : overrideTypes(in)) {
      overrides.put(type, readSettings(in, OVERRIDE + type + "."));
    }
    return new BackpressurePolicy(projectId, readSettings(in, ""), overrides,
        Long.parseLong(in.getOrDefault("version", "0")), readInstant(in, "updated_at"));
  }

  public static Map<String, String> encodeDraft(BackpressureDraft draft) {
    Map<String, String> out = new LinkedHashMap<>();
    out.put("version", Long.toString(draft.version()));
    out.put("required_approvals", Integer.toString(draft.requiredApprovals()));
    if (draft.activateAt() != null) {
      out.put("activate_at", draft.activateAt().toString());
    }
    if (draft.createdBy() != null) {
      out.put("created_by", draft.createdBy());
    }
    out.put("created_at", draft.createdAt().toString());
    out.put("updated_at", draft.updatedAt().toString());
    List<DraftApproval> approvals = draft.approvals();
    for (int i = 0; i < approvals.size(); i++) {
      out.put(APPROVAL + i + ".actor", approvals.get(i).actor());
      out.put(APPROVAL + i + ".approved_at", approvals.get(i).approvedAt().toString());
    }
    encodePatch(draft.proposed()).forEach((k, v) -> out.put(PROPOSED + k, v));
    return out;
  }

  public static BackpressureDraft decodeDraft(String projectId, Map<String, String> in) {
    List<DraftApproval> approvals = new ArrayList<>();
    for (int i = 0; in.containsKey(APPROVAL + i + ".actor"); i++) {
      approvals.add(new DraftApproval(in.get(APPROVAL + i + ".actor"),
          Instant.parse(in.get(APPROVAL + i + ".approved_at"))));
    }
    Map<String, String> proposed = new LinkedHashMap<>();
    in.forEach((k, v) -> {
      if (k.startsWith(PROPOSED)) {
        proposed.put(k.substring(PROPOSED.length()), v);
      }
    });
    return new BackpressureDraft(projectId,
        Long.parseLong(in.get("version")),
        decodePatch(proposed),
        Integer.parseInt(in.get("required_approvals")),
        approvals,
        readInstant(in, "activate_at"),
        in.get("created_by"),
        Instant.parse(in.get("created_at")),
        Instant.parse(in.get("updated_at")));
  }

  private static void putIfPresent(Map<String, String> out, String key, Patch<?> patch) {
    if (patch.isPresent()) {
      out.put(key, String.valueOf(patch.value()));
    }
  }

  private static void putSettings(Map<String, String> out, String prefix, BackpressureSettings s) {
    out.put(prefix + "is_enabled", Boolean.toString(s.enabled()));
    out.put(prefix + "max_retrying", Integer.toString(s.maxRetrying()));
    out.put(prefix + "max_due_now", Integer.toString(s.maxDueNow()));
    out.put(prefix + "min_limit", Integer.toString(s.minLimit()));
  }

  private static BackpressureSettings readSettings(Map<String, String> in, String prefix) {
    return new BackpressureSettings(
        Boolean.parseBoolean(in.get(prefix + "is_enabled")),
        Integer.parseInt(in.get(prefix + "max_retrying")),
        Integer.parseInt(in.get(prefix + "max_due_now")),
        Integer.parseInt(in.get(prefix + "min_limit")));
  }

  /** Connector types named by {@code override.<type>} marker keys. */
  private static List<String> overrideTypes(Map<String, String> in) {
    List<String> types = new ArrayList<>();
    for (String key : in.keySet()) {
      if (key.startsWith(OVERRIDE) && key.indexOf('.', OVERRIDE.length()) < 0) {
        types.add(key.substring(OVERRIDE.length()));
      }
    }
    return types;
  }

  private static Integer readInt(Map<String, String> in, String key) {
    String value = in.get(key);
    return value == null ? null : Integer.valueOf(value);
  }

  private static Instant readInstant(Map<String, String> in, String key) {
    String value = in.get(key);
    return value == null ? null : Instant.parse(value);
  }
}
