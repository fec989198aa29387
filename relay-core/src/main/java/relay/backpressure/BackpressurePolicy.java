package relay.backpressure;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The live backpressure policy of a project: project-wide defaults plus per-connector overrides.
 *
 * <p>Never edited directly; a new version is produced only by applying an approved draft.
 * Version 0 denotes the configured default for a project that never applied a draft.
 *
 * @param projectId          owning project
 * @param defaults           settings for connectors without an override
 * @param connectorOverrides full settings per canonical connector type
 * @param version            monotonically increasing; 0 when not yet stored
 * @param updatedAt          time of the last apply, or {@code null} for the configured default
 */
public record BackpressurePolicy(
    String projectId,
    BackpressureSettings defaults,
    Map<String, BackpressureSettings> connectorOverrides,
    long version,
    Instant updatedAt) {

  public BackpressurePolicy {
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(defaults, "defaults");
    TreeMap<String, BackpressureSettings> sorted = new TreeMap<>();
    if (connectorOverrides != null) {
      connectorOverrides.forEach((type, settings) ->
          sorted.put(Objects.requireNonNull(type, "connectorType"), Objects.requireNonNull(settings, type)));
    }
    connectorOverrides = Collections.unmodifiableMap(sorted);
  }

  public static BackpressurePolicy initial(String projectId, BackpressureSettings defaults) {
    return new BackpressurePolicy(projectId, defaults, Map.of(), 0L, null);
  }

  public boolean isEnabled() {
    return defaults.enabled();
  }

  public int maxRetrying() {
    return defaults.maxRetrying();
  }

  public int maxDueNow() {
    return defaults.maxDueNow();
  }

  public int minLimit() {
    return defaults.minLimit();
  }

  /**
   * Resolves the settings for a connector: its override if one exists, otherwise the project
   * defaults.
   */
  public ResolvedSettings settingsFor(String connectorType) {
    BackpressureSettings override = connectorOverrides.get(connectorType);
    if (override != null) {
      return new ResolvedSettings(override, SettingsSource.CONNECTOR_OVERRIDE);
    }
    return new ResolvedSettings(defaults,
        version == 0L ? SettingsSource.CONFIG_DEFAULT : SettingsSource.PROJECT_POLICY);
  }
}
