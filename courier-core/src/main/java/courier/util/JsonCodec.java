package courier.util;

import java.util.Map;

/**
 * Codec for flat JSON objects whose values are all strings.
 *
 * <p>The core module uses it for the envelope wire format so that it needs no JSON library.
 * Applications that already ship Jackson or Gson can plug their own implementation into
 * {@link courier.codec.JsonEnvelopeCodec}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the built-in implementation.
     */
    static JsonCodec getDefault() {
        return FlatJsonCodec.INSTANCE;
    }

    /**
     * Encodes the map as a JSON object, keeping iteration order. An empty map encodes as
     * {@code {}}.
     *
     * @param fields the fields to encode; keys and values must not be null
     * @return JSON text
     * @throws IllegalArgumentException if a key or value is null
     */
    String toJson(Map<String, String> fields);

    /**
     * Parses a JSON object of string values.
     *
     * @param json JSON text
     * @return ordered map of fields
     * @throws IllegalArgumentException if the input is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);
}
