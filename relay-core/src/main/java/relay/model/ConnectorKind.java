package relay.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Connector kinds the platform knows how to configure, with the aliases clients may send.
 *
 * <p>Connector types outside this set are still accepted as opaque keys; they simply have no
 * typed configuration or bundled transport.
 */
public enum ConnectorKind {
  WEBHOOK("webhook", List.of()),
  SLACK("slack", List.of("slack_webhook")),
  JIRA("jira", List.of("jira_issue")),
  SQS("sqs", List.of("sink_sqs", "aws_sqs")),
  DB("db", List.of("sink_db", "database"));

  private static final String TYPE_PATTERN = "[a-z0-9_-]{1,64}";

  private final String key;
  private final List<String> aliases;

  ConnectorKind(String key, List<String> aliases) {
    this.key = key;
    this.aliases = aliases;
  }

  public String key() {
    return key;
  }

  public List<String> aliases() {
    return aliases;
  }

  public static Optional<ConnectorKind> resolve(String connectorType) {
    if (connectorType == null) {
      return Optional.empty();
    }
    String candidate = connectorType.trim().toLowerCase(Locale.ROOT);
    for (ConnectorKind kind : values()) {
      if (kind.key.equals(candidate) || kind.aliases.contains(candidate)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  /**
   * Normalizes a client-supplied connector type: aliases map to their canonical key, unknown
   * types are lower-cased and trimmed.
   *
   * @throws IllegalArgumentException if the type is blank or not of the form {@code [a-z0-9_-]{1,64}}
   */
  public static String normalize(String connectorType) {
    Objects.requireNonNull(connectorType, "connectorType");
    String trimmed = connectorType.trim().toLowerCase(Locale.ROOT);
    if (!trimmed.matches(TYPE_PATTERN)) {
      throw new IllegalArgumentException("Invalid connector type: " + connectorType);
    }
    return resolve(trimmed).map(ConnectorKind::key).orElse(trimmed);
  }
}
