package relay.insights;

/**
 * A distinct error message and how often it was seen.
 */
public record ErrorFrequency(String message, int count) {
}
