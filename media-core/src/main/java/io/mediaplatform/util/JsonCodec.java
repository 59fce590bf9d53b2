package io.mediaplatform.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} JSON objects, the shape of every
 * outbox payload.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies.
 * Applications that already ship a JSON library can plug in their own.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes the map as a JSON object, preserving iteration order.
     *
     * @param fields the fields to encode
     * @return JSON object text, {@code "{}"} for an empty map
     * @throws IllegalArgumentException if a key or value is {@code null}
     */
    String toJson(Map<String, String> fields);

    /**
     * Parses a flat JSON object whose values are strings. {@code null} values are dropped.
     *
     * @param json the JSON text
     * @return the parsed fields in document order
     * @throws IllegalArgumentException if the input is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);
}
