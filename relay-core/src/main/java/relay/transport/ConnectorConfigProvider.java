package relay.transport;

import java.util.Optional;

/**
 * Looks up the endpoint configuration of a project's connector at attempt time, so
 * configuration changes apply to the next attempt without a restart.
 */
@FunctionalInterface
public interface ConnectorConfigProvider {

    /**
     * @param projectId     owning project
     * @param connectorType canonical connector type
     * @return the configuration, or empty if the connector is not configured for the project
     */
    Optional<ConnectorConfig> configFor(String projectId, String connectorType);
}
