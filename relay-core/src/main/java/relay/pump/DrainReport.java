package relay.pump;

import java.util.List;

/**
 * Result of draining one project: a {@link ConnectorDrain} per connector that had due work.
 */
public record DrainReport(String projectId, List<ConnectorDrain> connectors) {
  public DrainReport {
    connectors = List.copyOf(connectors);
  }

  public int delivered() {
    return connectors.stream().mapToInt(ConnectorDrain::delivered).sum();
  }

  public int retried() {
    return connectors.stream().mapToInt(ConnectorDrain::retried).sum();
  }

  public int deadLettered() {
    return connectors.stream().mapToInt(ConnectorDrain::deadLettered).sum();
  }

  public int throttledConnectors() {
    return (int) connectors.stream().filter(c -> c.decision().throttled()).count();
  }
}
