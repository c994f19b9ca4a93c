package io.github.drompincen.clawpoint.persistence.row;

import java.util.Map;

/** One row of the {@code writes} table; {@code value} is the raw blob column. */
public record WriteRow(
        String threadId,
        String checkpointNs,
        String checkpointId,
        String taskId,
        int idx,
        String channel,
        String type,
        Object value
) {
    public static final String TASK_ID = "task_id";
    public static final String IDX = "idx";
    public static final String CHANNEL = "channel";
    public static final String TYPE = "type";
    public static final String VALUE = "value";

    public static WriteRow from(Map<String, Object> columns) {
        Object idx = columns.get(IDX);
        return new WriteRow(
                (String) columns.get(CheckpointRow.THREAD_ID),
                (String) columns.get(CheckpointRow.CHECKPOINT_NS),
                (String) columns.get(CheckpointRow.CHECKPOINT_ID),
                (String) columns.get(TASK_ID),
                idx instanceof Number n ? n.intValue() : 0,
                (String) columns.get(CHANNEL),
                (String) columns.get(TYPE),
                columns.get(VALUE));
    }
}
