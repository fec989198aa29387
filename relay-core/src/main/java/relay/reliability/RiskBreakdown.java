package relay.reliability;

/**
 * Per-factor contributions that sum to the risk score.
 */
public record RiskBreakdown(
    double deadLetterPressure,
    double dueNowPressure,
    double retryPressure,
    double queuePressure,
    double attemptPressure,
    double deliveryFailurePressure,
    double attemptFailurePressure,
    double errorPressure) {

  public double total() {
    return deadLetterPressure + dueNowPressure + retryPressure + queuePressure + attemptPressure
        + deliveryFailurePressure + attemptFailurePressure + errorPressure;
  }
}
