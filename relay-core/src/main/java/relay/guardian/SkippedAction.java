package relay.guardian;

import java.time.Instant;

/**
 * An action held back by the cooldown.
 *
 * @param action            the held-back action
 * @param reason            always {@link #COOLDOWN_ACTIVE} today
 * @param lastActionAt      when the guardian last acted on the connector
 * @param retryAfterSeconds seconds until the cooldown expires, at least 1
 */
public record SkippedAction(GuardianAction action, String reason, Instant lastActionAt, long retryAfterSeconds) {
  public static final String COOLDOWN_ACTIVE = "cooldown_active";
}
