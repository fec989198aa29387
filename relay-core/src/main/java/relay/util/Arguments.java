package relay.util;

import relay.ValidationException;
import relay.model.ConnectorKind;

/**
 * Request argument checks that raise {@link ValidationException} with the wire field name.
 */
public final class Arguments {
  public static final int MAX_PROJECT_ID_LENGTH = 128;
  public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

  public static String projectId(String projectId) {
    if (projectId == null || projectId.isBlank()) {
      throw new ValidationException("project_id", "must not be blank");
    }
    String trimmed = projectId.trim();
    if (trimmed.length() > MAX_PROJECT_ID_LENGTH) {
      throw new ValidationException("project_id", "must be at most " + MAX_PROJECT_ID_LENGTH + " characters");
    }
    return trimmed;
  }

  public static String connectorType(String connectorType) {
    if (connectorType == null) {
      throw new ValidationException("connector_type", "must not be blank");
    }
    try {
      return ConnectorKind.normalize(connectorType);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("connector_type", e.getMessage());
    }
  }

  /** Returns the trimmed key, or {@code null} when absent or blank. */
  public static String idempotencyKey(String key) {
    if (key == null || key.isBlank()) {
      return null;
    }
    String trimmed = key.trim();
    if (trimmed.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
      throw new ValidationException("idempotency_key",
          "must be at most " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
    }
    return trimmed;
  }

  public static int range(String field, int value, int min, int max) {
    if (value < min || value > max) {
      throw new ValidationException(field, "must be between " + min + " and " + max + ", got " + value);
    }
    return value;
  }

  private Arguments() {}
}
