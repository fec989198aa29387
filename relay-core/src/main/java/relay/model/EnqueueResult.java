package relay.model;

/**
 * Result of an enqueue: the stored delivery, and whether it already existed.
 */
public record EnqueueResult(ConnectorDelivery delivery, boolean duplicate) {
}
