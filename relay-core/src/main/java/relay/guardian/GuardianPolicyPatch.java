package relay.guardian;

import relay.ValidationException;
import relay.model.Patch;

import java.util.Objects;

/**
 * Sparse update to a {@link GuardianPolicy}; absent fields keep their current value.
 */
public record GuardianPolicyPatch(
    Patch<Boolean> enabled,
    Patch<Integer> lookbackHours,
    Patch<Double> riskThreshold,
    Patch<Integer> maxActionsPerProject,
    Patch<Integer> actionLimit,
    Patch<Integer> cooldownMinutes,
    Patch<Integer> minDeadLetterMinutes,
    Patch<Boolean> allowProcessQueue,
    Patch<Boolean> allowRedriveDeadLetters) {

  public GuardianPolicyPatch {
    requireValue("is_enabled", enabled);
    requireValue("lookback_hours", lookbackHours);
    requireValue("risk_threshold", riskThreshold);
    requireValue("max_actions_per_project", maxActionsPerProject);
    requireValue("action_limit", actionLimit);
    requireValue("cooldown_minutes", cooldownMinutes);
    requireValue("min_dead_letter_minutes", minDeadLetterMinutes);
    requireValue("allow_process_queue", allowProcessQueue);
    requireValue("allow_redrive_dead_letters", allowRedriveDeadLetters);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Merges the present fields onto {@code current}; the result is re-validated.
   */
  public GuardianPolicy applyTo(GuardianPolicy current) {
    return new GuardianPolicy(current.projectId(),
        enabled.applyTo(current.enabled()),
        lookbackHours.applyTo(current.lookbackHours()),
        riskThreshold.applyTo(current.riskThreshold()),
        maxActionsPerProject.applyTo(current.maxActionsPerProject()),
        actionLimit.applyTo(current.actionLimit()),
        cooldownMinutes.applyTo(current.cooldownMinutes()),
        minDeadLetterMinutes.applyTo(current.minDeadLetterMinutes()),
        allowProcessQueue.applyTo(current.allowProcessQueue()),
        allowRedriveDeadLetters.applyTo(current.allowRedriveDeadLetters()));
  }

  private static void requireValue(String field, Patch<?> patch) {
    Objects.requireNonNull(patch, field);
    if (patch.isPresent() && patch.value() == null) {
      throw new ValidationException(field, "must not be null");
    }
  }

  public static final class Builder {
    private Patch<Boolean> enabled = Patch.absent();
    private Patch<Integer> lookbackHours = Patch.absent();
    private Patch<Double> riskThreshold = Patch.absent();
    private Patch<Integer> maxActionsPerProject = Patch.absent();
    private Patch<Integer> actionLimit = Patch.absent();
    private Patch<Integer> cooldownMinutes = Patch.absent();
    private Patch<Integer> minDeadLetterMinutes = Patch.absent();
    private Patch<Boolean> allowProcessQueue = Patch.absent();
    private Patch<Boolean> allowRedriveDeadLetters = Patch.absent();

    private Builder() {}

    public Builder enabled(boolean value) {
      this.enabled = Patch.of(value);
      return this;
    }

    public Builder lookbackHours(int value) {
      this.lookbackHours = Patch.of(value);
      return this;
    }

    public Builder riskThreshold(double value) {
      this.riskThreshold = Patch.of(value);
      return this;
    }

    public Builder maxActionsPerProject(int value) {
      this.maxActionsPerProject = Patch.of(value);
      return this;
    }

    public Builder actionLimit(int value) {
      this.actionLimit = Patch.of(value);
      return this;
    }

    public Builder cooldownMinutes(int value) {
      this.cooldownMinutes = Patch.of(value);
      return this;
    }

    public Builder minDeadLetterMinutes(int value) {
      this.minDeadLetterMinutes = Patch.of(value);
      return this;
    }

    public Builder allowProcessQueue(boolean value) {
      this.allowProcessQueue = Patch.of(value);
      return this;
    }

    public Builder allowRedriveDeadLetters(boolean value) {
      this.allowRedriveDeadLetters = Patch.of(value);
      return this;
    }

    public GuardianPolicyPatch build() {
      return new GuardianPolicyPatch(enabled, lookbackHours, riskThreshold, maxActionsPerProject,
          actionLimit, cooldownMinutes, minDeadLetterMinutes, allowProcessQueue, allowRedriveDeadLetters);
    }
  }
}
