package relay.guardian;

/**
 * Outcome of one executed (or dry-run) action.
 *
 * @param action   the action
 * @param affected deliveries redriven or drained; for a dry run, the deliveries that would be touched
 * @param error    failure message, or {@code null} on success
 */
public record GuardianActionResult(GuardianAction action, int affected, String error) {
  public boolean failed() {
    return error != null;
  }
}
