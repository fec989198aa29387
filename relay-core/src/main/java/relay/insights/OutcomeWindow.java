package relay.insights;

import java.time.Instant;

/**
 * Delivery outcomes for deliveries created within {@code [start, end)}.
 */
public record OutcomeWindow(
    Instant start,
    Instant end,
    int totalDeliveries,
    int delivered,
    int deadLettered,
    double deliverySuccessRate,
    double deadLetterRate) {
}
