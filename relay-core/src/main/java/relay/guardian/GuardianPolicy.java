package relay.guardian;

import relay.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Governs how much autonomy the guardian has over one project.
 *
 * <p>Bounds are enforced on construction and out-of-range values are rejected:
 * lookback 1..720 h, risk threshold (0, 500], max actions 1..20, action limit 1..100,
 * cooldown 0..1440 min, minimum dead-letter age 0..10080 min.
 *
 * @param projectId               owning project
 * @param enabled                 whether the guardian acts at all
 * @param lookbackHours           insights window used for ranking
 * @param riskThreshold           minimum risk score worth acting on
 * @param maxActionsPerProject    actions per run
 * @param actionLimit             deliveries touched per action
 * @param cooldownMinutes         quiet period per connector after an action (0 disables)
 * @param minDeadLetterMinutes    dead letters younger than this are not redriven
 * @param allowProcessQueue       whether {@code process_queue} actions are permitted
 * @param allowRedriveDeadLetters whether {@code redrive_dead_letters} actions are permitted
 */
public record GuardianPolicy(
    String projectId,
    boolean enabled,
    int lookbackHours,
    double riskThreshold,
    int maxActionsPerProject,
    int actionLimit,
    int cooldownMinutes,
    int minDeadLetterMinutes,
    boolean allowProcessQueue,
    boolean allowRedriveDeadLetters) {

  public static final int MAX_LOOKBACK_HOURS = 720;
  public static final double MAX_RISK_THRESHOLD = 500.0;
  public static final int MAX_ACTIONS = 20;
  public static final int MAX_ACTION_LIMIT = 100;
  public static final int MAX_COOLDOWN_MINUTES = 1440;
  public static final int MAX_MIN_DEAD_LETTER_MINUTES = 10_080;

  public GuardianPolicy {
    Objects.requireNonNull(projectId, "projectId");
    checkRange("lookback_hours", lookbackHours, 1, MAX_LOOKBACK_HOURS);
    if (!(riskThreshold > 0 && riskThreshold <= MAX_RISK_THRESHOLD)) {
      throw new ValidationException("risk_threshold", "must be in (0, " + MAX_RISK_THRESHOLD + "], got " + riskThreshold);
    }
    checkRange("max_actions_per_project", maxActionsPerProject, 1, MAX_ACTIONS);
    checkRange("action_limit", actionLimit, 1, MAX_ACTION_LIMIT);
    checkRange("cooldown_minutes", cooldownMinutes, 0, MAX_COOLDOWN_MINUTES);
    checkRange("min_dead_letter_minutes", minDeadLetterMinutes, 0, MAX_MIN_DEAD_LETTER_MINUTES);
  }

  /**
   * Flat string encoding for audit metadata and JDBC persistence.
   */
  public Map<String, String> toMetadata() {
    Map<String, String> out = new LinkedHashMap<>();
    out.put("is_enabled", Boolean.toString(enabled));
    out.put("lookback_hours", Integer.toString(lookbackHours));
    out.put("risk_threshold", Double.toString(riskThreshold));
    out.put("max_actions_per_project", Integer.toString(maxActionsPerProject));
    out.put("action_limit", Integer.toString(actionLimit));
    out.put("cooldown_minutes", Integer.toString(cooldownMinutes));
    out.put("min_dead_letter_minutes", Integer.toString(minDeadLetterMinutes));
    out.put("allow_process_queue", Boolean.toString(allowProcessQueue));
    out.put("allow_redrive_dead_letters", Boolean.toString(allowRedriveDeadLetters));
    return out;
  }

  public static GuardianPolicy fromMetadata(String projectId, Map<String, String> in) {
    return new GuardianPolicy(projectId,
        Boolean.parseBoolean(in.get("is_enabled")),
        Integer.parseInt(in.get("lookback_hours")),
        Double.parseDouble(in.get("risk_threshold")),
        Integer.parseInt(in.get("max_actions_per_project")),
        Integer.parseInt(in.get("action_limit")),
        Integer.parseInt(in.get("cooldown_minutes")),
        Integer.parseInt(in.get("min_dead_letter_minutes")),
        Boolean.parseBoolean(in.get("allow_process_queue")),
        Boolean.parseBoolean(in.get("allow_redrive_dead_letters")));
  }

  static void checkRange(String field, int value, int min, int max) {
    if (value < min || value > max) {
      throw new ValidationException(field, "must be between " + min + " and " + max + ", got " + value);
    }
  }
}
