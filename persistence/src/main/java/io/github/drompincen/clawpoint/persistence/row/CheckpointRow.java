package io.github.drompincen.clawpoint.persistence.row;

import java.util.Map;

/**
 * One row of the checkpoint read queries. Blob columns stay as the driver returned them
 * ({@code byte[]} or {@code String}); {@code pendingWrites} holds the aggregated JSON
 * array built by the correlated writes subquery.
 */
public record CheckpointRow(
        String threadId,
        String checkpointNs,
        String checkpointId,
        String parentCheckpointId,
        String type,
        Object checkpoint,
        Object metadata,
        Object pendingWrites
) {
    public static final String THREAD_ID = "thread_id";
    public static final String CHECKPOINT_NS = "checkpoint_ns";
    public static final String CHECKPOINT_ID = "checkpoint_id";
    public static final String PARENT_CHECKPOINT_ID = "parent_checkpoint_id";
    public static final String TYPE = "type";
    public static final String CHECKPOINT = "checkpoint";
    public static final String METADATA = "metadata";
    public static final String PENDING_WRITES = "pending_writes";

    public static CheckpointRow from(Map<String, Object> columns) {
        return new CheckpointRow(
                (String) columns.get(THREAD_ID),
                (String) columns.get(CHECKPOINT_NS),
                (String) columns.get(CHECKPOINT_ID),
                (String) columns.get(PARENT_CHECKPOINT_ID),
                (String) columns.get(TYPE),
                columns.get(CHECKPOINT),
                columns.get(METADATA),
                columns.get(PENDING_WRITES));
    }
}
