package io.github.drompincen.clawpoint.runtime.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Default serializer. Raw byte arrays are stored untouched under {@code bytes};
 * everything else is written as JSON under {@code json}.
 */
public class JacksonSerializer implements SerializerProtocol {

    public static final String TYPE_JSON = "json";
    public static final String TYPE_BYTES = "bytes";

    private final ObjectMapper objectMapper;

    public JacksonSerializer() {
        this(defaultMapper());
    }

    public JacksonSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Override
    public TypedBytes dumpsTyped(Object value) {
        if (value instanceof byte[] bytes) {
            return new TypedBytes(TYPE_BYTES, bytes.clone());
        }
        try {
            return new TypedBytes(TYPE_JSON, objectMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T loadsTyped(String type, byte[] data, Class<T> targetType) {
        if (TYPE_BYTES.equals(type)) {
            if (!targetType.isAssignableFrom(byte[].class)) {
                throw new IllegalArgumentException("Cannot read bytes payload as " + targetType.getName());
            }
            return targetType.cast(data);
        }
        if (!TYPE_JSON.equals(type)) {
            throw new IllegalArgumentException("Unknown serialization type: " + type);
        }
        if (data == null || data.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(data, targetType);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize " + targetType.getSimpleName(), e);
        }
    }
}
