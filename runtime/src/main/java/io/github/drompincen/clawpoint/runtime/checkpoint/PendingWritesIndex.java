package io.github.drompincen.clawpoint.runtime.checkpoint;

import io.github.drompincen.clawpoint.persistence.row.WriteRow;
import io.github.drompincen.clawpoint.persistence.schema.SchemaManager;
import io.github.drompincen.clawpoint.persistence.sql.BatchMode;
import io.github.drompincen.clawpoint.persistence.sql.SqlExecutor;
import io.github.drompincen.clawpoint.persistence.sql.SqlStatement;
import io.github.drompincen.clawpoint.protocol.checkpoint.Checkpoint;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointConfig;
import io.github.drompincen.clawpoint.protocol.checkpoint.PendingWrite;
import io.github.drompincen.clawpoint.protocol.checkpoint.TaskWrite;
import io.github.drompincen.clawpoint.runtime.serde.TypedBytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes emitted by tasks, keyed by (thread, namespace, checkpoint, task, idx). Rows may
 * point at a checkpoint that has not been stored yet, so nothing here joins against
 * {@code checkpoints}.
 */
public class PendingWritesIndex {

    private static final Logger log = LoggerFactory.getLogger(PendingWritesIndex.class);

    static final String UPSERT_WRITE = """
            INSERT OR REPLACE INTO writes
              (thread_id, checkpoint_ns, checkpoint_id, task_id, idx, channel, type, value)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";

    static final String SELECT_WRITES = """
            SELECT task_id, idx, channel, type, value
            FROM writes
            WHERE thread_id = ? AND checkpoint_ns = ? AND checkpoint_id = ?
            ORDER BY task_id, idx""";

    static final String SELECT_PENDING_SENDS = """
            SELECT task_id, idx, channel, type, value
            FROM writes
            WHERE thread_id = ? AND checkpoint_ns = ? AND checkpoint_id = ? AND channel = ?
            ORDER BY idx, task_id""";

    /**
     * Correlated subquery selecting every write of the outer {@code checkpoints} row as a
     * JSON array, decoded by {@link RecordCodec#decodeWriteColumns}.
     */
    static final String PENDING_WRITES_COLUMN = """
            (
              SELECT json_group_array(
                json_object(
                  'task_id', pw.task_id,
                  'channel', pw.channel,
                  'type', pw.type,
                  'idx', pw.idx,
                  'value', hex(pw.value)
                )
              )
              FROM writes AS pw
              WHERE pw.thread_id = checkpoints.thread_id
                AND pw.checkpoint_ns = checkpoints.checkpoint_ns
                AND pw.checkpoint_id = checkpoints.checkpoint_id
            ) AS pending_writes""";

    private final SqlExecutor executor;
    private final SchemaManager schema;
    private final RecordCodec codec;

    public PendingWritesIndex(SqlExecutor executor, SchemaManager schema, RecordCodec codec) {
        this.executor = executor;
        this.schema = schema;
        this.codec = codec;
    }

    /** Stores {@code writes} at idx 0..n-1 for the task, replacing rows already in those slots. */
    public void putWrites(CheckpointConfig config, String checkpointId, String taskId, List<PendingWrite> writes) {
        schema.ensureReady();
        if (writes.isEmpty()) return;
        List<SqlStatement> statements = new ArrayList<>(writes.size());
        for (int idx = 0; idx < writes.size(); idx++) {
            PendingWrite write = writes.get(idx);
            TypedBytes encoded = codec.encodeValue(write.value());
            statements.add(SqlStatement.of(UPSERT_WRITE,
                    config.threadId(), config.namespaceOrDefault(), checkpointId,
                    taskId, idx, write.channel(), encoded.type(), encoded.data()));
        }
        executor.batch(statements, BatchMode.WRITE);
        log.debug("Stored {} writes for task {} on checkpoint {}/{}", writes.size(), taskId, config.threadId(), checkpointId);
    }

    public List<TaskWrite> getWrites(CheckpointConfig config, String checkpointId) {
        schema.ensureReady();
        return executor.execute(SqlStatement.of(SELECT_WRITES, config.threadId(), config.namespaceOrDefault(), checkpointId))
                .stream()
                .map(WriteRow::from)
                .map(row -> new TaskWrite(row.taskId(), row.channel(), codec.decodeValue(row.type(), row.value())))
                .toList();
    }

    /** Decoded values written to {@link Checkpoint#TASKS} under the given parent checkpoint, in idx order. */
    public List<Object> getPendingSends(CheckpointConfig config, String parentCheckpointId) {
        schema.ensureReady();
        List<Object> sends = new ArrayList<>();
        for (var columns : executor.execute(SqlStatement.of(SELECT_PENDING_SENDS,
                config.threadId(), config.namespaceOrDefault(), parentCheckpointId, Checkpoint.TASKS))) {
            WriteRow row = WriteRow.from(columns);
            sends.add(codec.decodeValue(row.type(), row.value()));
        }
        return sends;
    }
}
