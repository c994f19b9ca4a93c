package io.github.drompincen.clawpoint.runtime.serde;

import java.nio.charset.StandardCharsets;

/** A serialized value and the tag naming the codec that produced it. */
public record TypedBytes(String type, byte[] data) {

    public String asText() {
        return new String(data, StandardCharsets.UTF_8);
    }
}
