package io.github.drompincen.clawpoint.protocol.checkpoint;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Paging and filtering for checkpoint listings. {@code before} is an exclusive upper
 * bound on checkpoint id; {@code filter} matches metadata fields by equality.
 */
public record ListOptions(
        Integer limit,
        CheckpointConfig before,
        Map<String, Object> filter
) {
    public ListOptions {
        filter = filter != null ? new LinkedHashMap<>(filter) : Map.of();
    }

    public static ListOptions none() {
        return new ListOptions(null, null, Map.of());
    }

    public static ListOptions limit(int limit) {
        return new ListOptions(limit, null, Map.of());
    }

    public static ListOptions before(String checkpointId) {
        return new ListOptions(null, new CheckpointConfig(null, null, checkpointId), Map.of());
    }

    public static ListOptions filter(Map<String, Object> filter) {
        return new ListOptions(null, null, filter);
    }

    public String beforeCheckpointId() {
        return before != null ? before.checkpointId() : null;
    }
}
