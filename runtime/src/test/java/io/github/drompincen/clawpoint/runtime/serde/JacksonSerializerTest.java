package io.github.drompincen.clawpoint.runtime.serde;

import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointMetadata;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonSerializerTest {

    private final JacksonSerializer serializer = new JacksonSerializer();

    @Test
    void objectsAreTaggedAsJson() {
        TypedBytes typed = serializer.dumpsTyped(Map.of("a", 1));

        assertThat(typed.type()).isEqualTo(JacksonSerializer.TYPE_JSON);
        assertThat(typed.asText()).isEqualTo("{\"a\":1}");
    }

    @Test
    void byteArraysAreStoredRaw() {
        byte[] raw = {1, 2, 3};

        TypedBytes typed = serializer.dumpsTyped(raw);

        assertThat(typed.type()).isEqualTo(JacksonSerializer.TYPE_BYTES);
        assertThat(typed.data()).containsExactly(1, 2, 3);
        assertThat(serializer.loadsTyped(typed.type(), typed.data())).isEqualTo(raw);
    }

    @Test
    void loadsTypedReadsIntoTargetType() {
        byte[] json = "{\"source\":\"loop\",\"step\":2}".getBytes(StandardCharsets.UTF_8);

        CheckpointMetadata md = serializer.loadsTyped("json", json, CheckpointMetadata.class);

        assertThat(md.source()).isEqualTo("loop");
        assertThat(md.step()).isEqualTo(2);
    }

    @Test
    void untypedLoadReturnsPlainCollections() {
        Object value = serializer.loadsTyped("json", "[\"x\",{\"k\":true}]".getBytes(StandardCharsets.UTF_8));

        assertThat(value).isEqualTo(List.of("x", Map.of("k", true)));
    }

    @Test
    void emptyJsonPayloadLoadsAsNull() {
        assertThat(serializer.loadsTyped("json", new byte[0])).isNull();
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> serializer.loadsTyped("pickle", new byte[] {1}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pickle");
    }

    @Test
    void malformedJsonSurfacesAsUncheckedIo() {
        assertThatThrownBy(() -> serializer.loadsTyped("json", "{oops".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(UncheckedIOException.class);
    }
}
