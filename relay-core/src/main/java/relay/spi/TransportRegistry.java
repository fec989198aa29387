package relay.spi;

import java.util.Optional;

/**
 * Resolves the transport responsible for a connector type.
 *
 * @see relay.transport.DefaultTransportRegistry
 */
public interface TransportRegistry {

    /**
     * @param connectorType canonical connector type
     * @return the transport, or empty if the type is unroutable
     */
    Optional<ConnectorTransport> transportFor(String connectorType);
}
