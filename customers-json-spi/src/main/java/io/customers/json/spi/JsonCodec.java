package io.customers.json.spi;

import java.io.InputStream;
import java.util.List;

/**
 * Minimal JSON codec used by the server core.
 * Implementations wrap a specific JSON library and are discovered through
 * {@link JsonCodecProvider}.
 */
public interface JsonCodec {

    /**
     * Serializes a value to JSON bytes.
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Deserializes JSON bytes to a typed object.
     * @throws JsonException if the bytes are not valid JSON for {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON document read from {@code input} to a typed object.
     * @throws JsonException if the input is not valid JSON for {@code type}
     */
    <T> T readValue(InputStream input, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON array to a list of typed objects.
     * @throws JsonException if the input is not a JSON array of {@code elementType}
     */
    <T> List<T> readList(InputStream input, Class<T> elementType) throws JsonException;
}
