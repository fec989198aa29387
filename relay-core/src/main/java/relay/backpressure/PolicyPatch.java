package relay.backpressure;

import relay.ValidationException;
import relay.model.ConnectorKind;
import relay.model.Patch;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sparse update to a {@link BackpressurePolicy}. Only present fields overwrite the live policy.
 *
 * <p>Scalar fields may not be explicitly {@code null}. A connector override that is present with
 * a {@code null} value removes that override, so the connector falls back to the project defaults.
 *
 * <p>Validated on construction: a patch that exists is a patch that can be applied.
 */
public record PolicyPatch(
    Patch<Boolean> enabled,
    Patch<Integer> maxRetrying,
    Patch<Integer> maxDueNow,
    Patch<Integer> minLimit,
    Map<String, Patch<BackpressureSettings>> connectorOverrides) {

  private static final PolicyPatch EMPTY = new PolicyPatch(
      Patch.absent(), Patch.absent(), Patch.absent(), Patch.absent(), Map.of());

  public PolicyPatch {
    Objects.requireNonNull(enabled, "enabled");
    Objects.requireNonNull(maxRetrying, "maxRetrying");
    Objects.requireNonNull(maxDueNow, "maxDueNow");
    Objects.requireNonNull(minLimit, "minLimit");
    requireNonNullValue("is_enabled", enabled);
    checkPresentRange("max_retrying", maxRetrying, 1, BackpressureSettings.MAX_CAP);
    checkPresentRange("max_due_now", maxDueNow, 1, BackpressureSettings.MAX_CAP);
    checkPresentRange("min_limit", minLimit, 1, BackpressureSettings.MAX_MIN_LIMIT);

    TreeMap<String, Patch<BackpressureSettings>> overrides = new TreeMap<>();
    if (connectorOverrides != null) {
      for (Map.Entry<String, Patch<BackpressureSettings>> entry : connectorOverrides.entrySet()) {
        Patch<BackpressureSettings> patch = Objects.requireNonNull(entry.getValue(), entry.getKey());
        if (patch.isPresent()) {
          overrides.put(normalizeConnector(entry.getKey()), patch);
        }
      }
    }
    connectorOverrides = Collections.unmodifiableMap(overrides);
  }

  public static PolicyPatch empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return !enabled.isPresent() && !maxRetrying.isPresent() && !maxDueNow.isPresent()
        && !minLimit.isPresent() && connectorOverrides.isEmpty();
  }

  /**
   * Folds a later amendment onto this one: fields present in {@code later} win, connector
   * overrides merge per connector.
   */
  public PolicyPatch mergedWith(PolicyPatch later) {
    Objects.requireNonNull(later, "later");
    Map<String, Patch<BackpressureSettings>> overrides = new TreeMap<>(connectorOverrides);
    overrides.putAll(later.connectorOverrides);
    return new PolicyPatch(
        enabled.overriddenBy(later.enabled),
        maxRetrying.overriddenBy(later.maxRetrying),
        maxDueNow.overriddenBy(later.maxDueNow),
        minLimit.overriddenBy(later.minLimit),
        overrides);
  }

  /**
   * Copies the present fields onto {@code live}, leaving every other field untouched.
   *
   * @param live       the current live policy
   * @param newVersion version to stamp on the result
   * @param now        value for {@code updatedAt}
   * @return the merged policy
   * @throws ValidationException if the merged defaults fall out of range
   */
  public BackpressurePolicy applyTo(BackpressurePolicy live, long newVersion, Instant now) {
    BackpressureSettings current = live.defaults();
    BackpressureSettings merged = new BackpressureSettings(
        enabled.applyTo(current.enabled()),
        maxRetrying.applyTo(current.maxRetrying()),
        maxDueNow.applyTo(current.maxDueNow()),
        minLimit.applyTo(current.minLimit()));
    Map<String, BackpressureSettings> overrides = new TreeMap<>(live.connectorOverrides());
    connectorOverrides.forEach((type, patch) -> {
      if (patch.value() == null) {
        overrides.remove(type);
      } else {
        overrides.put(type, patch.value());
      }
    });
    return new BackpressurePolicy(live.projectId(), merged, overrides, newVersion, now);
  }

  private static void requireNonNullValue(String field, Patch<?> patch) {
    if (patch.isPresent() && patch.value() == null) {
      throw new ValidationException(field, "must not be null");
    }
  }

  private static void checkPresentRange(String field, Patch<Integer> patch, int min, int max) {
    requireNonNullValue(field, patch);
    if (patch.isPresent()) {
      BackpressureSettings.checkRange(field, patch.value(), min, max);
    }
  }

  private static String normalizeConnector(String connectorType) {
    if (connectorType == null) {
      throw new ValidationException("connector_overrides", "connector type must not be null");
    }
    try {
      return ConnectorKind.normalize(connectorType);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("connector_overrides", "invalid connector type: " + connectorType);
    }
  }

  /**
   * Builder for {@link PolicyPatch}. Fields never set stay absent.
   */
  public static final class Builder {
    private Patch<Boolean> enabled = Patch.absent();
    private Patch<Integer> maxRetrying = Patch.absent();
    private Patch<Integer> maxDueNow = Patch.absent();
    private Patch<Integer> minLimit = Patch.absent();
    private final Map<String, Patch<BackpressureSettings>> overrides = new TreeMap<>();

    private Builder() {}

    public Builder enabled(boolean enabled) {
      this.enabled = Patch.of(enabled);
      return this;
    }

    public Builder maxRetrying(int maxRetrying) {
      this.maxRetrying = Patch.of(maxRetrying);
      return this;
    }

    public Builder maxDueNow(int maxDueNow) {
      this.maxDueNow = Patch.of(maxDueNow);
      return this;
    }

    public Builder minLimit(int minLimit) {
      this.minLimit = Patch.of(minLimit);
      return this;
    }

    /**
     * Sets (or replaces) the override for one connector.
     */
    public Builder connectorOverride(String connectorType, BackpressureSettings settings) {
      overrides.put(connectorType, Patch.of(Objects.requireNonNull(settings, "settings")));
      return this;
    }

    /**
     * Removes the override for one connector when applied.
     */
    public Builder removeConnectorOverride(String connectorType) {
      overrides.put(connectorType, Patch.of(null));
      return this;
    }

    public PolicyPatch build() {
      return new PolicyPatch(enabled, maxRetrying, maxDueNow, minLimit, overrides);
    }
  }
}
