package io.customers.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.customers.json.spi.JsonCodec;
import io.customers.json.spi.JsonException;

import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * Jackson implementation of {@link JsonCodec}.
 *
 * <p>The default mapper registers {@link CustomerModule} and rejects trailing content after the
 * first JSON value.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a codec with a custom ObjectMapper. The mapper must know how to map
     * {@link io.customers.server.spi.Customer}, e.g. by registering {@link CustomerModule}.
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new CustomerModule())
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + describe(value), e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        T value;
        try {
            value = mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getSimpleName() + ": " + reason(e), e);
        }
        return requireValue(value, type);
    }

    @Override
    public <T> T readValue(InputStream input, Class<T> type) throws JsonException {
        T value;
        try {
            value = mapper.readValue(input, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize input stream to " + type.getSimpleName() + ": " + reason(e), e);
        }
        return requireValue(value, type);
    }

    @Override
    public <T> List<T> readList(InputStream input, Class<T> elementType) throws JsonException {
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
        List<T> list;
        try {
            list = mapper.readValue(input, listType);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize input stream to List<" + elementType.getSimpleName() + ">: " + reason(e), e);
        }
        return requireValue(list, List.class);
    }

    private static <T> T requireValue(T value, Class<?> type) throws JsonException {
        if (value == null) throw new JsonException("Expected " + type.getSimpleName() + " but got JSON null");
        return value;
    }

    private static String reason(Exception e) {
        if (e instanceof com.fasterxml.jackson.core.JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getMessage();
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
