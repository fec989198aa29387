package relay.backpressure;

import java.util.Locale;

/**
 * Why a draft cannot be applied yet.
 */
public enum BlockReason {
  /** The draft's {@code activateAt} lies in the future. */
  ACTIVATION_TIME_PENDING,
  /** Fewer distinct approvals than required. */
  APPROVALS_PENDING;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
