package relay.guardian;

import java.util.List;

public record CooldownResult(List<GuardianAction> eligible, List<SkippedAction> skipped) {
  public CooldownResult {
    eligible = List.copyOf(eligible);
    skipped = List.copyOf(skipped);
  }
}
