package relay.transport;

import relay.DeliveryAttemptException;
import relay.model.ConnectorDelivery;
import relay.model.ConnectorKind;
import relay.spi.ConnectorTransport;
import relay.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts deliveries to HTTP connector endpoints with {@link HttpClient}.
 *
 * <ul>
 *   <li>webhook: the payload as-is.
 *   <li>slack: the payload as-is when it already carries a {@code text} field, otherwise
 *       {@code {"text": <payload>}}.
 *   <li>jira: an issue-create request with basic auth; summary and description are taken from
 *       the payload's {@code summary}/{@code title} and {@code description} fields when present.
 *   <li>db: {@code {"table": ..., "record": <payload>, "inserted_at": ..., "source": ...}} with an
 *       optional bearer token.
 * </ul>
 *
 * <p>Each request carries {@code X-Relay-Delivery-Id} and, when set, {@code Idempotency-Key} so
 * receivers can drop replays. Any response is returned; only transport failures throw.
 */
public final class HttpConnectorTransport implements ConnectorTransport {
  private static final Logger logger = Logger.getLogger(HttpConnectorTransport.class.getName());

  static final Set<ConnectorKind> SUPPORTED =
      EnumSet.of(ConnectorKind.WEBHOOK, ConnectorKind.SLACK, ConnectorKind.JIRA, ConnectorKind.DB);
  static final int MAX_RESPONSE_BODY = 2_000;
  static final int MAX_JIRA_DESCRIPTION = 6_000;
  static final String DB_SOURCE = "relay.connector.db";

  private final HttpClient client;
  private final ConnectorConfigProvider configs;
  private final Duration requestTimeout;
  private final Clock clock;

  public HttpConnectorTransport(HttpClient client, ConnectorConfigProvider configs, Duration requestTimeout) {
    this(client, configs, requestTimeout, Clock.systemUTC());
  }

  /**
   * @param clock stamps {@code inserted_at} on db connector records
   */
  public HttpConnectorTransport(HttpClient client, ConnectorConfigProvider configs, Duration requestTimeout,
      Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.configs = Objects.requireNonNull(configs, "configs");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  @Override
  public TransportResponse deliver(ConnectorDelivery delivery) throws DeliveryAttemptException {
    ConnectorConfig config = configs.configFor(delivery.projectId(), delivery.connectorType())
        .orElseThrow(() -> new DeliveryAttemptException("connector " + delivery.connectorType()
            + " is not configured for project " + delivery.projectId()));
    HttpRequest request = buildRequest(config, delivery);
    try {
      HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
      logger.log(Level.FINE, "Delivery {0} to {1} answered {2}",
          new Object[] {delivery.id(), request.uri().getHost(), response.statusCode()});
      return new TransportResponse(response.statusCode(), truncate(response.body()));
    } catch (HttpTimeoutException e) {
      throw new DeliveryAttemptException("request timed out after " + requestTimeout.toMillis() + "ms", null, e);
    } catch (IOException e) {
      throw new DeliveryAttemptException("connector request failed: " + e.getMessage(), null, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeliveryAttemptException("connector request interrupted", null, e);
    }
  }

  HttpRequest buildRequest(ConnectorConfig config, ConnectorDelivery delivery) throws DeliveryAttemptException {
    String payload = delivery.payloadJson() == null ? "null" : delivery.payloadJson();
    URI target;
    String body;
    HttpRequest.Builder builder = HttpRequest.newBuilder().timeout(requestTimeout);
    if (config instanceof ConnectorConfig.Webhook webhook) {
      target = webhook.targetUrl();
      body = payload;
    } else if (config instanceof ConnectorConfig.Slack slack) {
      target = slack.webhookUrl();
      body = slackBody(payload);
    } else if (config instanceof ConnectorConfig.Jira jira) {
      target = jira.issueUrl();
      body = jiraBody(payload, jira, delivery);
      String credentials = jira.email() + ":" + jira.apiToken();
      builder.header("Authorization",
          "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
      builder.header("Accept", "application/json");
    } else if (config instanceof ConnectorConfig.Db db) {
      target = db.ingestUrl();
      body = "{\"table\":\"" + JsonCodec.escape(db.table()) + "\",\"record\":" + payload
          + ",\"inserted_at\":\"" + clock.instant() + "\",\"source\":\"" + DB_SOURCE + "\"}";
      if (db.apiKey() != null) {
        builder.header("Authorization", "Bearer " + db.apiKey());
      }
    } else {
      throw new DeliveryAttemptException("no HTTP transport for connector type " + config.kind().key());
    }

    for (Map.Entry<String, String> header : config.headers().entrySet()) {
      builder.header(header.getKey(), header.getValue());
    }
    builder.header("Content-Type", "application/json");
    builder.header("X-Relay-Delivery-Id", delivery.id());
    if (delivery.idempotencyKey() != null) {
      builder.header("Idempotency-Key", delivery.idempotencyKey());
    }
    return builder.uri(target).POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build();
  }

  static String slackBody(String payload) {
    Map<String, String> fields = flatFields(payload);
    String text = fields.get("text");
    if (text != null && !text.isBlank()) {
      return payload;
    }
    return "{\"text\":\"" + JsonCodec.escape(payload) + "\"}";
  }

  static String jiraBody(String payload, ConnectorConfig.Jira jira, ConnectorDelivery delivery) {
    Map<String, String> fields = flatFields(payload);
    String summary = firstNonBlank(fields.get("summary"), fields.get("title"));
    if (summary == null) {
      summary = "Relay delivery " + delivery.id();
    }
    String description = firstNonBlank(fields.get("description"), payload);
    if (description.length() > MAX_JIRA_DESCRIPTION) {
      int cut = MAX_JIRA_DESCRIPTION;
      // Keep surrogate pairs whole.
      if (Character.isHighSurrogate(description.charAt(cut - 1))) {
        cut--;
      }
      description = description.substring(0, cut);
    }
    return "{\"fields\":{\"project\":{\"key\":\"" + JsonCodec.escape(jira.projectKey()) + "\"},"
        + "\"summary\":\"" + JsonCodec.escape(summary) + "\","
        + "\"description\":\"" + JsonCodec.escape(description) + "\","
        + "\"issuetype\":{\"name\":\"" + JsonCodec.escape(jira.issueType()) + "\"}}}";
  }

  /**
   * String fields of a flat JSON object payload; empty for anything the codec cannot read.
   */
  private static Map<String, String> flatFields(String payload) {
    try {
      return JsonCodec.getDefault().parseObject(payload);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINEST, "Payload is not a flat JSON object; sending it wrapped", e);
      return Map.of();
    }
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first;
    }
    return second != null && !second.isBlank() ? second : null;
  }

  private static String truncate(String body) {
    if (body == null || body.isEmpty()) {
      return null;
    }
    return body.length() <= MAX_RESPONSE_BODY ? body : body.substring(0, MAX_RESPONSE_BODY) + "...[truncated]";
  }
}
