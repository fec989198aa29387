package relay.insights;

import relay.model.ConnectorDelivery;
import relay.model.DeliveryAttempt;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates a connector's delivery population into health metrics over a lookback window.
 *
 * <p>Pure: the same inputs always give the same output.
 */
public final class InsightsEngine {
  static final int TOP_ERROR_LIMIT = 5;

  private InsightsEngine() {}

  /**
   * @param deliveries         candidate deliveries (any window; filtered here)
   * @param attemptsByDelivery attempts keyed by delivery id; missing entries mean no attempts
   * @param lookbackHours      window length, at least 1
   * @param now                exclusive window end
   */
  public static ConnectorInsights computeInsights(Collection<ConnectorDelivery> deliveries,
      Map<String, List<DeliveryAttempt>> attemptsByDelivery, int lookbackHours, Instant now) {
    Objects.requireNonNull(deliveries, "deliveries");
    Objects.requireNonNull(attemptsByDelivery, "attemptsByDelivery");
    Objects.requireNonNull(now, "now");
    if (lookbackHours < 1) {
      throw new IllegalArgumentException("lookbackHours must be >= 1");
    }
    Instant windowStart = now.minus(Duration.ofHours(lookbackHours));

    int queued = 0;
    int retrying = 0;
    int delivered = 0;
    int dead = 0;
    int attemptTotal = 0;
    int attemptSuccesses = 0;
    long attemptCountSum = 0;
    int maxAttempts = 0;
    Map<String, Integer> errors = new LinkedHashMap<>();
    int inWindow = 0;

    for (ConnectorDelivery d : deliveries) {
      if (d.createdAt().isBefore(windowStart) || !d.createdAt().isBefore(now)) {
        continue;
      }
      inWindow++;
      switch (d.status()) {
        case QUEUED -> queued++;
        case RETRYING -> retrying++;
        case DELIVERED -> delivered++;
        case DEAD_LETTERED -> dead++;
      }
      attemptCountSum += d.attemptCount();
      maxAttempts = Math.max(maxAttempts, d.attemptCount());

      List<DeliveryAttempt> attempts = attemptsByDelivery.getOrDefault(d.id(), List.of());
      for (DeliveryAttempt attempt : attempts) {
        attemptTotal++;
        if (attempt.success()) {
          attemptSuccesses++;
        }
        countError(errors, attempt.error());
      }
      // Without attempt rows the delivery's own last error is the only record of the failure.
      if (attempts.isEmpty()) {
        countError(errors, d.lastError());
      }
    }

    return new ConnectorInsights(windowStart, now, inWindow,
        new StatusCounts(queued, retrying, delivered, dead),
        rate(delivered, inWindow),
        attemptTotal,
        rate(attemptSuccesses, attemptTotal),
        inWindow == 0 ? 0.0 : (double) attemptCountSum / inWindow,
        maxAttempts,
        topErrors(errors));
  }

  static double rate(int numerator, int denominator) {
    return denominator == 0 ? 0.0 : (double) numerator / denominator;
  }

  private static void countError(Map<String, Integer> errors, String error) {
    if (error == null || error.isBlank()) {
      return;
    }
    errors.merge(error.trim(), 1, Integer::sum);
  }

  private static List<ErrorFrequency> topErrors(Map<String, Integer> errors) {
    List<ErrorFrequency> ranked = new ArrayList<>(errors.size());
    errors.forEach((message, count) -> ranked.add(new ErrorFrequency(message, count)));
    // List.sort is stable, so equal counts keep first-seen order.
    ranked.sort(Comparator.comparingInt(ErrorFrequency::count).reversed());
    return ranked.size() > TOP_ERROR_LIMIT ? ranked.subList(0, TOP_ERROR_LIMIT) : ranked;
  }
}
