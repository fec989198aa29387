package relay.reliability;

import java.util.Locale;

/**
 * Direction of a connector's risk relative to its baseline window.
 */
public enum RiskTrend {
  IMPROVING,
  STABLE,
  WORSENING;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
