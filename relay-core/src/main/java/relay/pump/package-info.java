/**
 * Scheduled delivery pump that drains due deliveries within the backpressure limit.
 *
 * <p>{@link relay.pump.DeliveryPump} can lease rows through claim locking so several nodes can
 * share one database.
 *
 * @see relay.pump.DeliveryPump
 */
package relay.pump;
