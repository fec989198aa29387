package relay.backpressure;

/**
 * How many due deliveries of one connector may be drained in one tick.
 *
 * @param connectorType  canonical connector type
 * @param requestedLimit what the caller asked for
 * @param queueDepth     deliveries due now
 * @param effectiveLimit deliveries the pump will attempt
 * @param throttled      whether a cap reduced the drain below {@code min(requestedLimit, queueDepth)}
 * @param reason         the binding cap when throttled, otherwise {@code null}
 * @param settings       settings the decision was made under
 * @param source         where {@code settings} came from
 */
public record GateDecision(
    String connectorType,
    int requestedLimit,
    int queueDepth,
    int effectiveLimit,
    boolean throttled,
    ThrottleReason reason,
    BackpressureSettings settings,
    SettingsSource source) {
}
