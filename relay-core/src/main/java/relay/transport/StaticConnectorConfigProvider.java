package relay.transport;

import relay.model.ConnectorKind;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory provider: per-project configurations take precedence over configurations shared by
 * every project.
 *
 * <p>This class is thread-safe.
 */
public final class StaticConnectorConfigProvider implements ConnectorConfigProvider {
  private final Map<String, ConnectorConfig> shared = new ConcurrentHashMap<>();
  private final Map<String, ConnectorConfig> perProject = new ConcurrentHashMap<>();

  /**
   * Configures {@code config} for every project that has no project-specific configuration.
   */
  public StaticConnectorConfigProvider register(ConnectorConfig config) {
    Objects.requireNonNull(config, "config");
    shared.put(config.kind().key(), config);
    return this;
  }

  public StaticConnectorConfigProvider register(String projectId, ConnectorConfig config) {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(config, "config");
    perProject.put(key(projectId, config.kind().key()), config);
    return this;
  }

  @Override
  public Optional<ConnectorConfig> configFor(String projectId, String connectorType) {
    String type = ConnectorKind.normalize(connectorType);
    ConnectorConfig specific = perProject.get(key(projectId, type));
    return Optional.ofNullable(specific != null ? specific : shared.get(type));
  }

  private static String key(String projectId, String connectorType) {
    return projectId + '\u0000' + connectorType;
  }
}
