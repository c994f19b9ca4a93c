package io.github.drompincen.clawpoint.runtime.serde;

/**
 * Encodes values into tagged byte payloads and back. The tag returned by
 * {@link #dumpsTyped} is stored beside the payload and handed back to
 * {@link #loadsTyped} on read.
 */
public interface SerializerProtocol {

    TypedBytes dumpsTyped(Object value);

    <T> T loadsTyped(String type, byte[] data, Class<T> targetType);

    default Object loadsTyped(String type, byte[] data) {
        return loadsTyped(type, data, Object.class);
    }
}
