package relay.model;

/**
 * What a single attempt produced: the response status (if any), an error message on failure,
 * and the observed latency.
 */
public record AttemptOutcome(Integer statusCode, String error, long latencyMs) {

  public AttemptOutcome {
    if (latencyMs < 0) {
      latencyMs = 0;
    }
  }

  public static AttemptOutcome succeeded(int statusCode, long latencyMs) {
    return new AttemptOutcome(statusCode, null, latencyMs);
  }

  public static AttemptOutcome failed(Integer statusCode, String error, long latencyMs) {
    return new AttemptOutcome(statusCode, error, latencyMs);
  }

  public boolean success() {
    return isSuccessStatus(statusCode) && error == null;
  }

  static boolean isSuccessStatus(Integer statusCode) {
    return statusCode != null && statusCode >= 200 && statusCode < 300;
  }
}
