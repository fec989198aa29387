package relay.spi;

import relay.DeliveryAttemptException;
import relay.model.ConnectorDelivery;

/**
 * Sends one delivery to its connector endpoint.
 *
 * <p>Implementations should not retry internally; the pump owns retry scheduling. A non-2xx
 * response may be returned rather than thrown; the pump treats both as a failed attempt.
 *
 * @see relay.transport.HttpConnectorTransport
 */
@FunctionalInterface
public interface ConnectorTransport {

    /**
     * Performs the attempt.
     *
     * @param delivery the delivery to send
     * @return the endpoint's response
     * @throws DeliveryAttemptException if the endpoint could not be reached or refused the request
     */
    TransportResponse deliver(ConnectorDelivery delivery) throws DeliveryAttemptException;

    /**
     * Endpoint response: status code plus an optional (possibly truncated) body.
     */
    record TransportResponse(int statusCode, String body) {
        public static TransportResponse of(int statusCode) {
            return new TransportResponse(statusCode, null);
        }
    }
}
