package relay.backpressure;

import java.util.List;

/**
 * Project-level recommendation plus the per-connector advice it was aggregated from, highest
 * pressure first.
 */
public record TuningSuggestion(BackpressureSettings recommendation, List<ConnectorTuning> byConnector) {
  public TuningSuggestion {
    byConnector = List.copyOf(byConnector);
  }
}
