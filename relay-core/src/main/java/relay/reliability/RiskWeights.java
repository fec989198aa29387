package relay.reliability;

/**
 * Coefficients of the risk score. Only the relative orderings they produce are relied upon:
 * dead letters outrank backlog, backlog and low success raise risk, and a drained, fully
 * successful connector scores zero.
 */
public record RiskWeights(
    double deadLettered,
    double dueNow,
    double retrying,
    double queued,
    double excessAttempts,
    double deliveryFailure,
    double attemptFailure,
    double errorOccurrence,
    int errorOccurrenceCap) {

  public static RiskWeights defaults() {
    return new RiskWeights(10.0, 6.0, 4.0, 2.0, 1.5, 40.0, 20.0, 0.5, 50);
  }
}
