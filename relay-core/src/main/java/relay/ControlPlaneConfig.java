package relay;

import relay.backpressure.BackpressureSettings;
import relay.guardian.GuardianPolicy;

import java.util.Objects;

/**
 * Tunables for the control plane. Passed explicitly to every component that needs a default,
 * so no component reads ambient constants.
 */
public final class ControlPlaneConfig {
  public static final int MIN_RETRY_BASE_DELAY_MS = 100;
  public static final int MAX_RETRY_BASE_DELAY_MS = 60_000;
  public static final int MAX_ATTEMPTS_UPPER_BOUND = 10;

  private BackpressureSettings defaultBackpressure = new BackpressureSettings(true, 50, 100, 1);
  private int defaultRequiredApprovals = 1;

  private int defaultMaxAttempts = 3;
  private long retryBaseDelayMs = 500L;
  private long retryMaxDelayMs = 3_600_000L;
  private double retryJitter = 0.0;
  private long attemptTimeoutMs = 10_000L;

  private long pumpIntervalMs = 5000L;
  private int pumpRequestedLimit = 25;
  private int pumpWorkers = 4;

  private long guardianIntervalMs = 60_000L;
  private int guardianLookbackHours = 24;
  private double guardianRiskThreshold = 20.0;
  private int guardianMaxActions = 3;
  private int guardianActionLimit = 10;
  private int guardianCooldownMinutes = 0;
  private int guardianMinDeadLetterMinutes = 15;

  private int analyticsSampleLimit = 200;
  private int concurrencyRetries = 3;
  private double riskStableDelta = 3.0;
  private double mediumPressureRatio = 0.4;

  public BackpressureSettings getDefaultBackpressure() {
    return defaultBackpressure;
  }

  public ControlPlaneConfig setDefaultBackpressure(BackpressureSettings defaultBackpressure) {
    this.defaultBackpressure = Objects.requireNonNull(defaultBackpressure, "defaultBackpressure");
    return this;
  }

  public int getDefaultRequiredApprovals() {
    return defaultRequiredApprovals;
  }

  public ControlPlaneConfig setDefaultRequiredApprovals(int defaultRequiredApprovals) {
    if (defaultRequiredApprovals < 1 || defaultRequiredApprovals > 10) {
      throw new IllegalArgumentException("defaultRequiredApprovals must be in 1..10");
    }
    this.defaultRequiredApprovals = defaultRequiredApprovals;
    return this;
  }

  public int getDefaultMaxAttempts() {
    return defaultMaxAttempts;
  }

  public ControlPlaneConfig setDefaultMaxAttempts(int defaultMaxAttempts) {
    if (defaultMaxAttempts < 1 || defaultMaxAttempts > MAX_ATTEMPTS_UPPER_BOUND) {
      throw new IllegalArgumentException("defaultMaxAttempts must be in 1.." + MAX_ATTEMPTS_UPPER_BOUND);
    }
    this.defaultMaxAttempts = defaultMaxAttempts;
    return this;
  }

  public long getRetryBaseDelayMs() {
    return retryBaseDelayMs;
  }

  public ControlPlaneConfig setRetryBaseDelayMs(long retryBaseDelayMs) {
    if (retryBaseDelayMs < MIN_RETRY_BASE_DELAY_MS || retryBaseDelayMs > MAX_RETRY_BASE_DELAY_MS) {
      throw new IllegalArgumentException("retryBaseDelayMs must be in "
          + MIN_RETRY_BASE_DELAY_MS + ".." + MAX_RETRY_BASE_DELAY_MS);
    }
    this.retryBaseDelayMs = retryBaseDelayMs;
    return this;
  }

  public long getRetryMaxDelayMs() {
    return retryMaxDelayMs;
  }

  public ControlPlaneConfig setRetryMaxDelayMs(long retryMaxDelayMs) {
    this.retryMaxDelayMs = retryMaxDelayMs;
    return this;
  }

  public double getRetryJitter() {
    return retryJitter;
  }

  public ControlPlaneConfig setRetryJitter(double retryJitter) {
    this.retryJitter = retryJitter;
    return this;
  }

  public long getAttemptTimeoutMs() {
    return attemptTimeoutMs;
  }

  public ControlPlaneConfig setAttemptTimeoutMs(long attemptTimeoutMs) {
    this.attemptTimeoutMs = attemptTimeoutMs;
    return this;
  }

  public long getPumpIntervalMs() {
    return pumpIntervalMs;
  }

  public ControlPlaneConfig setPumpIntervalMs(long pumpIntervalMs) {
    this.pumpIntervalMs = pumpIntervalMs;
    return this;
  }

  public int getPumpRequestedLimit() {
    return pumpRequestedLimit;
  }

  public ControlPlaneConfig setPumpRequestedLimit(int pumpRequestedLimit) {
    this.pumpRequestedLimit = pumpRequestedLimit;
    return this;
  }

  public int getPumpWorkers() {
    return pumpWorkers;
  }

  public ControlPlaneConfig setPumpWorkers(int pumpWorkers) {
    this.pumpWorkers = pumpWorkers;
    return this;
  }

  public long getGuardianIntervalMs() {
    return guardianIntervalMs;
  }

  public ControlPlaneConfig setGuardianIntervalMs(long guardianIntervalMs) {
    this.guardianIntervalMs = guardianIntervalMs;
    return this;
  }

  public int getGuardianLookbackHours() {
    return guardianLookbackHours;
  }

  public ControlPlaneConfig setGuardianLookbackHours(int guardianLookbackHours) {
    this.guardianLookbackHours = guardianLookbackHours;
    return this;
  }

  public double getGuardianRiskThreshold() {
    return guardianRiskThreshold;
  }

  public ControlPlaneConfig setGuardianRiskThreshold(double guardianRiskThreshold) {
    this.guardianRiskThreshold = guardianRiskThreshold;
    return this;
  }

  public int getGuardianMaxActions() {
    return guardianMaxActions;
  }

  public ControlPlaneConfig setGuardianMaxActions(int guardianMaxActions) {
    this.guardianMaxActions = guardianMaxActions;
    return this;
  }

  public int getGuardianActionLimit() {
    return guardianActionLimit;
  }

  public ControlPlaneConfig setGuardianActionLimit(int guardianActionLimit) {
    this.guardianActionLimit = guardianActionLimit;
    return this;
  }

  public int getGuardianCooldownMinutes() {
    return guardianCooldownMinutes;
  }

  public ControlPlaneConfig setGuardianCooldownMinutes(int guardianCooldownMinutes) {
    this.guardianCooldownMinutes = guardianCooldownMinutes;
    return this;
  }

  public int getGuardianMinDeadLetterMinutes() {
    return guardianMinDeadLetterMinutes;
  }

  public ControlPlaneConfig setGuardianMinDeadLetterMinutes(int guardianMinDeadLetterMinutes) {
    this.guardianMinDeadLetterMinutes = guardianMinDeadLetterMinutes;
    return this;
  }

  public int getAnalyticsSampleLimit() {
    return analyticsSampleLimit;
  }

  public ControlPlaneConfig setAnalyticsSampleLimit(int analyticsSampleLimit) {
    this.analyticsSampleLimit = analyticsSampleLimit;
    return this;
  }

  public int getConcurrencyRetries() {
    return concurrencyRetries;
  }

  public ControlPlaneConfig setConcurrencyRetries(int concurrencyRetries) {
    if (concurrencyRetries < 1) {
      throw new IllegalArgumentException("concurrencyRetries must be >= 1");
    }
    this.concurrencyRetries = concurrencyRetries;
    return this;
  }

  public double getRiskStableDelta() {
    return riskStableDelta;
  }

  public ControlPlaneConfig setRiskStableDelta(double riskStableDelta) {
    this.riskStableDelta = riskStableDelta;
    return this;
  }

  public double getMediumPressureRatio() {
    return mediumPressureRatio;
  }

  public ControlPlaneConfig setMediumPressureRatio(double mediumPressureRatio) {
    if (mediumPressureRatio <= 0 || mediumPressureRatio >= 1) {
      throw new IllegalArgumentException("mediumPressureRatio must be in (0, 1)");
    }
    this.mediumPressureRatio = mediumPressureRatio;
    return this;
  }

  /**
   * Guardian policy used for projects that never stored one. Disabled until an operator opts in.
   */
  public GuardianPolicy defaultGuardianPolicy(String projectId) {
    return new GuardianPolicy(projectId, false, guardianLookbackHours, guardianRiskThreshold,
        guardianMaxActions, guardianActionLimit, guardianCooldownMinutes,
        guardianMinDeadLetterMinutes, true, true);
  }
}
