package relay.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} metadata objects, used to persist audit payloads
 * and policy documents as JSON text.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only handles
 * objects whose values are strings. Applications with a JSON library on the classpath may plug in
 * their own implementation.
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. Returns {@code "{}"} for {@code null} or empty input.
     */
    String toJson(Map<String, String> metadata);

    /**
     * Parses a JSON object of string values. {@code null}, blank and {@code "null"} input yield
     * an empty map; {@code null} members are dropped.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);

    /**
     * Escapes a string for embedding inside a JSON string literal (without the surrounding quotes).
     */
    static String escape(String value) {
        return DefaultJsonCodec.escape(value);
    }
}
