package relay.backpressure;

/**
 * Tuning advice for one connector.
 */
public record ConnectorTuning(
    String connectorType,
    PressureTier tier,
    int retrying,
    int dueNow,
    int outstanding,
    BackpressureSettings suggested) {
}
