/**
 * Connector delivery queue and its state machine.
 *
 * <p>{@link relay.delivery.DeliveryQueue} enqueues with idempotency-key and payload-hash
 * deduplication, summarizes queue health and redrives dead letters.
 * {@link relay.delivery.DeliveryStateMachine} decides the next status after each attempt.
 *
 * @see relay.delivery.DeliveryQueue
 * @see relay.delivery.DeliveryStateMachine
 */
package relay.delivery;
