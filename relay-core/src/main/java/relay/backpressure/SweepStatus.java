package relay.backpressure;

import java.util.Locale;

/**
 * Per-project outcome of {@link PolicyLifecycle#activateReadyDrafts}.
 */
public enum SweepStatus {
  /** Ready but not applied because the sweep was a dry run. */
  READY,
  BLOCKED,
  APPLIED,
  FAILED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
