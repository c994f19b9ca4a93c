package io.github.drompincen.clawpoint.runtime.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawpoint.protocol.checkpoint.Checkpoint;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointMetadata;
import io.github.drompincen.clawpoint.protocol.checkpoint.SerializationMismatchException;
import io.github.drompincen.clawpoint.protocol.checkpoint.TaskWrite;
import io.github.drompincen.clawpoint.runtime.serde.JacksonSerializer;
import io.github.drompincen.clawpoint.runtime.serde.SerializerProtocol;
import io.github.drompincen.clawpoint.runtime.serde.TypedBytes;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts between stored columns and checkpoint objects. Payload encoding is left to the
 * {@link SerializerProtocol}; this class only deals with tags, blob representations and
 * the JSON arrays that the write subqueries aggregate into.
 */
public class RecordCodec {

    static final String DEFAULT_TYPE = JacksonSerializer.TYPE_JSON;

    private static final TypeReference<List<WriteColumn>> WRITE_COLUMNS = new TypeReference<>() {};
    private static final Comparator<WriteColumn> TASK_THEN_INDEX =
            Comparator.comparing(WriteColumn::taskId, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparingInt(WriteColumn::idx);

    private final SerializerProtocol serde;
    private final ObjectMapper columnMapper = new ObjectMapper();

    public RecordCodec(SerializerProtocol serde) {
        this.serde = serde;
    }

    public EncodedCheckpoint encode(Checkpoint checkpoint, CheckpointMetadata metadata) {
        TypedBytes cp = serde.dumpsTyped(checkpoint);
        TypedBytes md = serde.dumpsTyped(metadata);
        if (!cp.type().equals(md.type())) {
            throw new SerializationMismatchException(cp.type(), md.type());
        }
        return new EncodedCheckpoint(cp.type(), cp.data(), md.data());
    }

    public Checkpoint decodeCheckpoint(String type, Object blob) {
        return serde.loadsTyped(typeOrDefault(type), toBytes(blob), Checkpoint.class);
    }

    public CheckpointMetadata decodeMetadata(String type, Object blob) {
        return serde.loadsTyped(typeOrDefault(type), toBytes(blob), CheckpointMetadata.class);
    }

    public TypedBytes encodeValue(Object value) {
        return serde.dumpsTyped(value);
    }

    public Object decodeValue(String type, Object blob) {
        return serde.loadsTyped(typeOrDefault(type), toBytes(blob));
    }

    /**
     * Canonical text a metadata filter value is compared against, produced the same way
     * the metadata payload itself is written. Map keys are sorted, matching the order
     * {@link CheckpointMetadata} keeps {@code parents} in.
     */
    public String filterValue(Object value) {
        return serde.dumpsTyped(sortedKeys(value)).asText();
    }

    private static Object sortedKeys(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return value;
        }
        Map<String, Object> sorted = new TreeMap<>();
        map.forEach((key, nested) -> sorted.put(String.valueOf(key), sortedKeys(nested)));
        return sorted;
    }

    /**
     * Decodes the JSON array built by the pending writes subquery. Values arrive
     * hex-encoded so binary payloads survive the trip through JSON.
     */
    public List<TaskWrite> decodeWriteColumns(Object aggregated) {
        byte[] json = toBytes(aggregated);
        if (json.length == 0) return List.of();
        List<WriteColumn> columns;
        try {
            columns = columnMapper.readValue(json, WRITE_COLUMNS);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed pending writes column", e);
        }
        return columns.stream()
                .sorted(TASK_THEN_INDEX)
                .map(c -> new TaskWrite(c.taskId(), c.channel(), decodeValue(c.type(), fromHex(c.value()))))
                .toList();
    }

    /** Normalizes a blob column that the driver may hand back as bytes or as text. */
    public static byte[] toBytes(Object blob) {
        if (blob == null) return new byte[0];
        if (blob instanceof byte[] bytes) return bytes;
        if (blob instanceof String text) return text.getBytes(StandardCharsets.UTF_8);
        throw new IllegalArgumentException("Unsupported blob representation: " + blob.getClass().getName());
    }

    private static byte[] fromHex(String hex) {
        if (hex == null || hex.isEmpty()) return new byte[0];
        return HexFormat.of().parseHex(hex);
    }

    private static String typeOrDefault(String type) {
        return type != null ? type : DEFAULT_TYPE;
    }

    record WriteColumn(
            @JsonProperty("task_id") String taskId,
            @JsonProperty("channel") String channel,
            @JsonProperty("type") String type,
            @JsonProperty("idx") int idx,
            @JsonProperty("value") String value
    ) {}
}
