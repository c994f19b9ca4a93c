package io.github.drompincen.clawpoint.protocol.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of every channel of a graph at one step. Serialized field names follow the
 * snake_case layout that checkpoint payloads have always been stored with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(
        @JsonProperty("v") int v,
        @JsonProperty("id") String id,
        @JsonProperty("ts") String ts,
        @JsonProperty("channel_values") Map<String, Object> channelValues,
        @JsonProperty("channel_versions") Map<String, Object> channelVersions,
        @JsonProperty("versions_seen") Map<String, Map<String, Object>> versionsSeen
) {
    public static final int CURRENT_VERSION = 4;

    /** Channel carrying pending sends between supersteps. */
    public static final String TASKS = "__pregel_tasks";

    public Checkpoint {
        channelValues = readOnlyCopy(channelValues);
        channelVersions = readOnlyCopy(channelVersions);
        versionsSeen = readOnlyCopy(versionsSeen);
    }

    public static Checkpoint empty(String id) {
        return new Checkpoint(CURRENT_VERSION, id, Instant.now().toString(), Map.of(), Map.of(), Map.of());
    }

    public Checkpoint withChannel(String channel, Object value, Object version) {
        Map<String, Object> values = new LinkedHashMap<>(channelValues);
        values.put(channel, value);
        Map<String, Object> versions = new LinkedHashMap<>(channelVersions);
        versions.put(channel, version);
        return new Checkpoint(v, id, ts, values, versions, versionsSeen);
    }

    public Checkpoint withVersion(int version) {
        return new Checkpoint(version, id, ts, channelValues, channelVersions, versionsSeen);
    }

    @JsonIgnore
    public boolean isLegacy() {
        return v < CURRENT_VERSION;
    }

    private static <K, V> Map<K, V> readOnlyCopy(Map<K, V> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
