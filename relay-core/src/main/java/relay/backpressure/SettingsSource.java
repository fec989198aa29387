package relay.backpressure;

import java.util.Locale;

/**
 * Where a connector's effective {@link BackpressureSettings} came from.
 */
public enum SettingsSource {
  CONNECTOR_OVERRIDE,
  PROJECT_POLICY,
  CONFIG_DEFAULT;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
