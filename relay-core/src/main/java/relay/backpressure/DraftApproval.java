package relay.backpressure;

import java.time.Instant;
import java.util.Objects;

/**
 * One operator's sign-off on a draft.
 */
public record DraftApproval(String actor, Instant approvedAt) {
  public DraftApproval {
    Objects.requireNonNull(actor, "actor");
    Objects.requireNonNull(approvedAt, "approvedAt");
  }
}
