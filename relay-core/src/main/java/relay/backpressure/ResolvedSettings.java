package relay.backpressure;

/**
 * Settings in effect for a connector, with their provenance.
 */
public record ResolvedSettings(BackpressureSettings settings, SettingsSource source) {
}
