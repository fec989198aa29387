package relay.transport;

import relay.model.ConnectorKind;

import java.net.URI;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Endpoint configuration for one connector, one variant per {@link ConnectorKind}.
 *
 * <p>Instances are built from flat string settings by {@link ConnectorConfigs#parse}; the records
 * themselves only guard against nulls.
 */
public sealed interface ConnectorConfig {

    ConnectorKind kind();

    /**
     * Extra request headers sent on every attempt.
     */
    Map<String, String> headers();

    record Webhook(URI targetUrl, Map<String, String> headers) implements ConnectorConfig {
        public Webhook {
            Objects.requireNonNull(targetUrl, "targetUrl");
            headers = copy(headers);
        }

        @Override
        public ConnectorKind kind() {
            return ConnectorKind.WEBHOOK;
        }
    }

    record Slack(URI webhookUrl, Map<String, String> headers) implements ConnectorConfig {
        public Slack {
            Objects.requireNonNull(webhookUrl, "webhookUrl");
            headers = copy(headers);
        }

        @Override
        public ConnectorKind kind() {
            return ConnectorKind.SLACK;
        }
    }

    record Jira(URI baseUrl, String email, String apiToken, String projectKey, String issueType)
        implements ConnectorConfig {
        public static final String DEFAULT_ISSUE_TYPE = "Task";

        public Jira {
            Objects.requireNonNull(baseUrl, "baseUrl");
            Objects.requireNonNull(email, "email");
            Objects.requireNonNull(apiToken, "apiToken");
            Objects.requireNonNull(projectKey, "projectKey");
            issueType = issueType == null ? DEFAULT_ISSUE_TYPE : issueType;
        }

        @Override
        public ConnectorKind kind() {
            return ConnectorKind.JIRA;
        }

        @Override
        public Map<String, String> headers() {
            return Map.of();
        }

        /** Issue-create endpoint. */
        public URI issueUrl() {
            String base = baseUrl.toString().replaceAll("/+$", "");
            return URI.create(base + "/rest/api/2/issue");
        }

        @Override
        public String toString() {
            return "Jira[baseUrl=" + baseUrl + ", email=" + email + ", apiToken=[redacted], projectKey="
                + projectKey + ", issueType=" + issueType + "]";
        }
    }

    /**
     * Queue sink settings. No transport is bundled for SQS; deliveries to it are dead-lettered
     * unless the application registers its own {@link relay.spi.ConnectorTransport}.
     */
    record Sqs(URI queueUrl, String region, String accessKeyId, String secretAccessKey, String sessionToken,
               String messageGroupId, Integer delaySeconds) implements ConnectorConfig {
        public Sqs {
            Objects.requireNonNull(queueUrl, "queueUrl");
            Objects.requireNonNull(region, "region");
            Objects.requireNonNull(accessKeyId, "accessKeyId");
            Objects.requireNonNull(secretAccessKey, "secretAccessKey");
        }

        @Override
        public ConnectorKind kind() {
            return ConnectorKind.SQS;
        }

        @Override
        public Map<String, String> headers() {
            return Map.of();
        }

        public boolean isFifo() {
            return queueUrl.getPath().toLowerCase(Locale.ROOT).endsWith(".fifo");
        }

        @Override
        public String toString() {
            return "Sqs[queueUrl=" + queueUrl + ", region=" + region + ", accessKeyId=[redacted], "
                + "secretAccessKey=[redacted], messageGroupId=" + messageGroupId + ", delaySeconds=" + delaySeconds + "]";
        }
    }

    record Db(URI ingestUrl, String table, String apiKey, Map<String, String> headers) implements ConnectorConfig {
        public static final String DEFAULT_TABLE = "relay_events";

        public Db {
            Objects.requireNonNull(ingestUrl, "ingestUrl");
            table = table == null ? DEFAULT_TABLE : table;
            headers = copy(headers);
        }

        @Override
        public ConnectorKind kind() {
            return ConnectorKind.DB;
        }

        @Override
        public String toString() {
            return "Db[ingestUrl=" + ingestUrl + ", table=" + table + ", apiKey="
                + (apiKey == null ? null : "[redacted]") + ", headers=" + headers.keySet() + "]";
        }
    }

    private static Map<String, String> copy(Map<String, String> headers) {
        return headers == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(headers));
    }
}
