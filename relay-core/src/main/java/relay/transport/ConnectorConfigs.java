package relay.transport;

import relay.ValidationException;
import relay.model.ConnectorKind;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and validates connector settings given as flat string maps, e.g. from
 * {@code relay.connectors.<type>.*} properties.
 *
 * <p>Recognised keys per connector type:
 * <ul>
 *   <li>webhook: {@code targetUrl}
 *   <li>slack: {@code webhookUrl} (or {@code targetUrl})
 *   <li>jira: {@code baseUrl}, {@code email}, {@code apiToken}, {@code projectKey}, {@code issueType}
 *   <li>sqs: {@code queueUrl}, {@code region}, {@code accessKeyId}, {@code secretAccessKey},
 *       {@code sessionToken}, {@code messageGroupId}, {@code delaySeconds}
 *   <li>db: {@code ingestUrl} (or {@code targetUrl}), {@code table}, {@code apiKey}
 * </ul>
 * Keys of the form {@code header.<Name>} add request headers for webhook, slack and db.
 */
public final class ConnectorConfigs {
  public static final String HEADER_PREFIX = "header.";
  public static final String REDACTED = "[redacted]";
  public static final int MAX_SQS_DELAY_SECONDS = 900;

  private static final Pattern SECRET_KEY = Pattern.compile("(?i).*(token|secret|password|authorization|api[_-]?key).*");
  private static final Pattern SQS_HOST_REGION = Pattern.compile("\\.sqs[.-]([a-z0-9-]+)\\.");
  private static final Pattern REGION = Pattern.compile("(?i)[a-z0-9-]+");
  private static final String DEFAULT_SQS_REGION = "us-east-1";

  private ConnectorConfigs() {}

  /**
   * Validates settings without throwing.
   *
   * @param connectorType connector type or alias
   * @param settings      flat settings; {@code null} is treated as empty
   */
  public static ConfigValidation validate(String connectorType, Map<String, String> settings) {
    Map<String, String> in = settings == null ? Map.of() : settings;
    Map<String, String> sanitized = redact(in);
    Optional<ConnectorKind> kind = connectorType == null ? Optional.empty() : ConnectorKind.resolve(connectorType);
    if (kind.isEmpty()) {
      return new ConfigValidation(null, List.of("unsupported connector type; supported: webhook, slack, jira, sqs, db"),
          sanitized, null);
    }
    List<String> errors = new ArrayList<>();
    ConnectorConfig config = build(kind.get(), in, errors);
    return new ConfigValidation(kind.get(), errors, sanitized, errors.isEmpty() ? config : null);
  }

  /**
   * @throws ValidationException listing every problem when the settings are unusable
   */
  public static ConnectorConfig parse(String connectorType, Map<String, String> settings) {
    ConfigValidation validation = validate(connectorType, settings);
    if (!validation.ok()) {
      throw new ValidationException("config", String.join("; ", validation.errors()));
    }
    return validation.config();
  }

  /**
   * Copy of {@code settings} with secret-looking values replaced by {@value #REDACTED}.
   */
  public static Map<String, String> redact(Map<String, String> settings) {
    Map<String, String> out = new LinkedHashMap<>();
    settings.forEach((k, v) -> {
      if (k != null && v != null) {
        out.put(k, SECRET_KEY.matcher(k).matches() ? REDACTED : v);
      }
    });
    return out;
  }

  private static ConnectorConfig build(ConnectorKind kind, Map<String, String> in, List<String> errors) {
    return switch (kind) {
      case WEBHOOK -> {
        URI url = requireUrl(in, errors, "targetUrl");
        yield url == null ? null : new ConnectorConfig.Webhook(url, headers(in));
      }
      case SLACK -> {
        URI url = requireUrl(in, errors, "webhookUrl", "targetUrl");
        yield url == null ? null : new ConnectorConfig.Slack(url, headers(in));
      }
      case JIRA -> {
        URI base = requireUrl(in, errors, "baseUrl");
        String email = require(in, errors, "email");
        String token = require(in, errors, "apiToken");
        String projectKey = require(in, errors, "projectKey");
        yield base == null || email == null || token == null || projectKey == null
            ? null
            : new ConnectorConfig.Jira(base, email, token, projectKey, read(in, "issueType"));
      }
      case SQS -> buildSqs(in, errors);
      case DB -> {
        URI url = requireUrl(in, errors, "ingestUrl", "targetUrl");
        yield url == null ? null : new ConnectorConfig.Db(url, read(in, "table"), read(in, "apiKey"), headers(in));
      }
    };
  }

  private static ConnectorConfig buildSqs(Map<String, String> in, List<String> errors) {
    URI queueUrl = requireUrl(in, errors, "queueUrl");
    String accessKeyId = require(in, errors, "accessKeyId");
    String secret = require(in, errors, "secretAccessKey");
    String region = read(in, "region");
    if (region == null && queueUrl != null && queueUrl.getHost() != null) {
      Matcher m = SQS_HOST_REGION.matcher(queueUrl.getHost().toLowerCase(Locale.ROOT));
      region = m.find() ? m.group(1) : null;
    }
    region = region == null ? DEFAULT_SQS_REGION : region;
    if (!REGION.matcher(region).matches()) {
      errors.add("region must contain only letters, numbers and hyphens");
    }
    Integer delay = null;
    String rawDelay = read(in, "delaySeconds");
    if (rawDelay != null) {
      try {
        delay = Integer.parseInt(rawDelay);
        if (delay < 0 || delay > MAX_SQS_DELAY_SECONDS) {
          errors.add("delaySeconds must be between 0 and " + MAX_SQS_DELAY_SECONDS);
        }
      } catch (NumberFormatException e) {
        errors.add("delaySeconds must be an integer");
      }
    }
    if (queueUrl == null || accessKeyId == null || secret == null) {
      return null;
    }
    ConnectorConfig.Sqs sqs = new ConnectorConfig.Sqs(queueUrl, region, accessKeyId, secret,
        read(in, "sessionToken"), read(in, "messageGroupId"), delay);
    if (sqs.isFifo() && sqs.messageGroupId() == null) {
      errors.add("FIFO queues require messageGroupId");
    }
    return sqs;
  }

  private static Map<String, String> headers(Map<String, String> in) {
    Map<String, String> headers = new LinkedHashMap<>();
    in.forEach((k, v) -> {
      if (k.startsWith(HEADER_PREFIX) && v != null && !v.isBlank()) {
        String name = k.substring(HEADER_PREFIX.length()).trim();
        if (!name.isEmpty()) {
          headers.put(name, v.trim());
        }
      }
    });
    return headers;
  }

  private static String read(Map<String, String> in, String key) {
    String value = in.get(key);
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  private static String require(Map<String, String> in, List<String> errors, String key) {
    String value = read(in, key);
    if (value == null) {
      errors.add("missing " + key);
    }
    return value;
  }

  private static URI requireUrl(Map<String, String> in, List<String> errors, String key, String... fallbacks) {
    String value = read(in, key);
    for (int i = 0; value == null && i < fallbacks.length; i++) {
      value = read(in, fallbacks[i]);
    }
    if (value == null) {
      errors.add("missing " + key);
      return null;
    }
    URI uri;
    try {
      uri = new URI(value);
    } catch (URISyntaxException e) {
      errors.add(key + " must be a valid http(s) URL: " + e.getReason());
      return null;
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
      errors.add(key + " must be a valid http(s) URL");
      return null;
    }
    return uri;
  }

  /**
   * Result of {@link #validate}.
   *
   * @param kind      resolved connector kind, or {@code null} if unsupported
   * @param errors    problems found; empty when valid
   * @param sanitized the input with secrets redacted, safe to log or echo back
   * @param config    the parsed configuration when valid
   */
  public record ConfigValidation(ConnectorKind kind, List<String> errors, Map<String, String> sanitized,
                                 ConnectorConfig config) {
    public ConfigValidation {
      errors = List.copyOf(errors);
      sanitized = Map.copyOf(sanitized);
    }

    public boolean ok() {
      return errors.isEmpty() && config != null;
    }
  }
}
