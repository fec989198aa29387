package relay.insights;

/**
 * Field-by-field {@code current - baseline}; negative values mean the current window is lower.
 */
public record OutcomeDelta(
    int totalDeliveries,
    int delivered,
    int deadLettered,
    double deliverySuccessRate,
    double deadLetterRate) {

  static OutcomeDelta between(OutcomeWindow current, OutcomeWindow baseline) {
    return new OutcomeDelta(
        current.totalDeliveries() - baseline.totalDeliveries(),
        current.delivered() - baseline.delivered(),
        current.deadLettered() - baseline.deadLettered(),
        current.deliverySuccessRate() - baseline.deliverySuccessRate(),
        current.deadLetterRate() - baseline.deadLetterRate());
  }
}
