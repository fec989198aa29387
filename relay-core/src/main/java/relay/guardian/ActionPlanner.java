package relay.guardian;

import relay.reliability.RankedConnector;
import relay.reliability.Recommendation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a reliability ranking into a bounded list of guardian actions.
 *
 * <p>Selection happens in two stages. {@link #selectActions} applies the risk threshold, the
 * permitted action kinds and the per-run quota. {@link #applyCooldown} then holds back any
 * connector the guardian acted on within the cooldown window, so a connector that was just
 * redriven is not acted on again while its effect is still settling.
 */
public final class ActionPlanner {

  private ActionPlanner() {}

  /**
   * @param ranked                  ranking in any order; re-sorted by risk descending
   * @param riskThreshold           connectors scoring below this are ignored
   * @param maxActions              maximum actions returned
   * @param allowProcessQueue       whether {@code process_queue} may be selected
   * @param allowRedriveDeadLetters whether {@code redrive_dead_letters} may be selected
   */
  public static List<GuardianAction> selectActions(Collection<RankedConnector> ranked, double riskThreshold,
      int maxActions, boolean allowProcessQueue, boolean allowRedriveDeadLetters) {
    Objects.requireNonNull(ranked, "ranked");
    if (maxActions < 1) {
      throw new IllegalArgumentException("maxActions must be >= 1");
    }
    List<RankedConnector> sorted = new ArrayList<>(ranked);
    sorted.sort(Comparator.comparingDouble(RankedConnector::riskScore).reversed());

    List<GuardianAction> selected = new ArrayList<>();
    for (RankedConnector c : sorted) {
      if (c.riskScore() < riskThreshold || c.recommendation() == Recommendation.HEALTHY) {
        continue;
      }
      if (c.recommendation() == Recommendation.PROCESS_QUEUE && !allowProcessQueue) {
        continue;
      }
      if (c.recommendation() == Recommendation.REDRIVE_DEAD_LETTERS && !allowRedriveDeadLetters) {
        continue;
      }
      selected.add(new GuardianAction(c.connectorType(), c.recommendation(), c.riskScore(), c.riskReasons()));
      if (selected.size() >= maxActions) {
        break;
      }
    }
    return selected;
  }

  /**
   * Splits {@code actions} into those that may run now and those still inside their
   * connector's cooldown. A cooldown of {@code 0} lets everything through.
   *
   * @param lastActionAtByConnector time of the guardian's latest action per connector type
   */
  public static CooldownResult applyCooldown(List<GuardianAction> actions,
      Map<String, Instant> lastActionAtByConnector, int cooldownMinutes, Instant now) {
    Objects.requireNonNull(actions, "actions");
    Objects.requireNonNull(lastActionAtByConnector, "lastActionAtByConnector");
    if (cooldownMinutes < 0) {
      throw new IllegalArgumentException("cooldownMinutes must be >= 0");
    }
    if (cooldownMinutes == 0) {
      return new CooldownResult(actions, List.of());
    }
    long cooldownMs = Duration.ofMinutes(cooldownMinutes).toMillis();
    List<GuardianAction> eligible = new ArrayList<>();
    List<SkippedAction> skipped = new ArrayList<>();
    for (GuardianAction action : actions) {
      Instant last = lastActionAtByConnector.get(action.connectorType());
      if (last == null) {
        eligible.add(action);
        continue;
      }
      long elapsedMs = Math.max(0L, Duration.between(last, now).toMillis());
      if (elapsedMs >= cooldownMs) {
        eligible.add(action);
        continue;
      }
      long retryAfter = Math.max(1L, (cooldownMs - elapsedMs + 999L) / 1000L);
      skipped.add(new SkippedAction(action, SkippedAction.COOLDOWN_ACTIVE, last, retryAfter));
    }
    return new CooldownResult(eligible, skipped);
  }
}
