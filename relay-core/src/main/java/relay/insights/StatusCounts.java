package relay.insights;

/**
 * Deliveries per status within an insights window.
 */
public record StatusCounts(int queued, int retrying, int delivered, int deadLettered) {
  public static final StatusCounts ZERO = new StatusCounts(0, 0, 0, 0);
}
