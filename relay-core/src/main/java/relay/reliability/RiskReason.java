package relay.reliability;

import java.util.Locale;

/**
 * Factors that contributed to a connector's risk score, for operators and guardian gating.
 */
public enum RiskReason {
  DEAD_LETTERS,
  DUE_NOW_BACKLOG,
  RETRY_BACKLOG,
  QUEUED_BACKLOG,
  LOW_DELIVERY_SUCCESS,
  LOW_ATTEMPT_SUCCESS,
  HIGH_ERROR_VOLUME,
  HIGH_ATTEMPT_COUNT;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
