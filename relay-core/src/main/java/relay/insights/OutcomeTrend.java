package relay.insights;

/**
 * Current window, the equal-length window immediately before it, and their difference.
 */
public record OutcomeTrend(OutcomeWindow current, OutcomeWindow baseline, OutcomeDelta delta) {
}
