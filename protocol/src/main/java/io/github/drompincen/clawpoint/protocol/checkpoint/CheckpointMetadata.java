package io.github.drompincen.clawpoint.protocol.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Annotation stored next to every checkpoint. {@link #KEYS} lists the fields that
 * {@code list} may filter on and must name every component of this record.
 * {@code parents} is held sorted by namespace so its stored JSON is canonical.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointMetadata(
        String source,
        Integer step,
        Map<String, String> parents
) {
    public static final Set<String> KEYS = Set.of("source", "step", "parents");

    public static final String SOURCE_INPUT = "input";
    public static final String SOURCE_LOOP = "loop";
    public static final String SOURCE_UPDATE = "update";
    public static final String SOURCE_FORK = "fork";

    public CheckpointMetadata {
        parents = parents != null ? Collections.unmodifiableMap(new TreeMap<>(parents)) : Map.of();
    }

    public static CheckpointMetadata input() {
        return new CheckpointMetadata(SOURCE_INPUT, -1, Map.of());
    }

    public static CheckpointMetadata loop(int step) {
        return new CheckpointMetadata(SOURCE_LOOP, step, Map.of());
    }
}
