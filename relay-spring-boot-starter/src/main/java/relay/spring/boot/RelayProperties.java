package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the connector control plane.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * Prefix of every table the JDBC stores use.
     */
    private String tablePrefix = "relay_";

    /**
     * Endpoint settings per connector type, shared by every project, e.g.
     * {@code relay.connectors.webhook.target-url}.
     */
    private final Map<String, Map<String, String>> connectors = new LinkedHashMap<>();

    private final Pump pump = new Pump();
    private final Guardian guardian = new Guardian();
    private final Retry retry = new Retry();
    private final Backpressure backpressure = new Backpressure();
    private final ClaimLocking claimLocking = new ClaimLocking();
    private final Metrics metrics = new Metrics();

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Map<String, Map<String, String>> getConnectors() {
        return connectors;
    }

    public Pump getPump() {
        return pump;
    }

    public Guardian getGuardian() {
        return guardian;
    }

    public Retry getRetry() {
        return retry;
    }

    public Backpressure getBackpressure() {
        return backpressure;
    }

    public ClaimLocking getClaimLocking() {
        return claimLocking;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Pump {
        private boolean enabled = true;
        private long intervalMs = 5000;
        private int requestedLimit = 25;
        private int workerCount = 4;
        private long attemptTimeoutMs = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getRequestedLimit() {
            return requestedLimit;
        }

        public void setRequestedLimit(int requestedLimit) {
            this.requestedLimit = requestedLimit;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getAttemptTimeoutMs() {
            return attemptTimeoutMs;
        }

        public void setAttemptTimeoutMs(long attemptTimeoutMs) {
            this.attemptTimeoutMs = attemptTimeoutMs;
        }
    }

    /**
     * Guardian loop schedule plus the policy a project gets before it saves its own.
     */
    public static class Guardian {
        private boolean enabled = true;
        private long intervalMs = 60_000;
        private int lookbackHours = 24;
        private double riskThreshold = 20.0;
        private int maxActions = 3;
        private int actionLimit = 10;
        private int cooldownMinutes = 0;
        private int minDeadLetterMinutes = 15;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getLookbackHours() {
            return lookbackHours;
        }

        public void setLookbackHours(int lookbackHours) {
            this.lookbackHours = lookbackHours;
        }

        public double getRiskThreshold() {
            return riskThreshold;
        }

        public void setRiskThreshold(double riskThreshold) {
            this.riskThreshold = riskThreshold;
        }

        public int getMaxActions() {
            return maxActions;
        }

        public void setMaxActions(int maxActions) {
            this.maxActions = maxActions;
        }

        public int getActionLimit() {
            return actionLimit;
        }

        public void setActionLimit(int actionLimit) {
            this.actionLimit = actionLimit;
        }

        public int getCooldownMinutes() {
            return cooldownMinutes;
        }

        public void setCooldownMinutes(int cooldownMinutes) {
            this.cooldownMinutes = cooldownMinutes;
        }

        public int getMinDeadLetterMinutes() {
            return minDeadLetterMinutes;
        }

        public void setMinDeadLetterMinutes(int minDeadLetterMinutes) {
            this.minDeadLetterMinutes = minDeadLetterMinutes;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private long maxDelayMs = 3_600_000;
        private double jitter = 0.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Backpressure settings for projects that never applied a draft.
     */
    public static class Backpressure {
        private boolean enabled = true;
        private int maxRetrying = 50;
        private int maxDueNow = 100;
        private int minLimit = 1;
        private int requiredApprovals = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxRetrying() {
            return maxRetrying;
        }

        public void setMaxRetrying(int maxRetrying) {
            this.maxRetrying = maxRetrying;
        }

        public int getMaxDueNow() {
            return maxDueNow;
        }

        public void setMaxDueNow(int maxDueNow) {
            this.maxDueNow = maxDueNow;
        }

        public int getMinLimit() {
            return minLimit;
        }

        public void setMinLimit(int minLimit) {
            this.minLimit = minLimit;
        }

        public int getRequiredApprovals() {
            return requiredApprovals;
        }

        public void setRequiredApprovals(int requiredApprovals) {
            this.requiredApprovals = requiredApprovals;
        }
    }

    public static class ClaimLocking {
        private boolean enabled = false;
        private String ownerId = "";
        private Duration lockTimeout = Duration.ofMinutes(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getOwnerId() {
            return ownerId;
        }

        public void setOwnerId(String ownerId) {
            this.ownerId = ownerId;
        }

        public Duration getLockTimeout() {
            return lockTimeout;
        }

        public void setLockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
