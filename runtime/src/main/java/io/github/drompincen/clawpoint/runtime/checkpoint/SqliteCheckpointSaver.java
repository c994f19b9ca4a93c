package io.github.drompincen.clawpoint.runtime.checkpoint;

import io.github.drompincen.clawpoint.persistence.row.CheckpointRow;
import io.github.drompincen.clawpoint.persistence.schema.SchemaManager;
import io.github.drompincen.clawpoint.persistence.sql.BatchMode;
import io.github.drompincen.clawpoint.persistence.sql.JdbcSqlExecutor;
import io.github.drompincen.clawpoint.persistence.sql.SqlExecutor;
import io.github.drompincen.clawpoint.persistence.sql.SqlStatement;
import io.github.drompincen.clawpoint.protocol.checkpoint.Checkpoint;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointConfig;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointMetadata;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointTuple;
import io.github.drompincen.clawpoint.protocol.checkpoint.InvalidConfigException;
import io.github.drompincen.clawpoint.protocol.checkpoint.ListOptions;
import io.github.drompincen.clawpoint.protocol.checkpoint.PendingWrite;
import io.github.drompincen.clawpoint.protocol.checkpoint.TaskWrite;
import io.github.drompincen.clawpoint.runtime.serde.JacksonSerializer;
import io.github.drompincen.clawpoint.runtime.serde.SerializerProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link CheckpointSaver} over a SQLite-dialect store reached through a {@link SqlExecutor}.
 * Pending writes are pulled in with a correlated subquery in the same statement;
 * checkpoints written before format version 4 get their pending sends rebuilt on read.
 */
public class SqliteCheckpointSaver implements CheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(SqliteCheckpointSaver.class);

    static final String SELECT_CHECKPOINTS = """
            SELECT
              thread_id,
              checkpoint_ns,
              checkpoint_id,
              parent_checkpoint_id,
              type,
              checkpoint,
              metadata,
            """ + PendingWritesIndex.PENDING_WRITES_COLUMN + "\nFROM checkpoints\n";

    static final String UPSERT_CHECKPOINT = """
            INSERT OR REPLACE INTO checkpoints
              (thread_id, checkpoint_ns, checkpoint_id, parent_checkpoint_id, type, checkpoint, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?)""";

    static final String DELETE_THREAD_CHECKPOINTS = "DELETE FROM checkpoints WHERE thread_id = ?";
    static final String DELETE_THREAD_WRITES = "DELETE FROM writes WHERE thread_id = ?";

    private final SqlExecutor executor;
    private final SchemaManager schema;
    private final RecordCodec codec;
    private final PendingWritesIndex writesIndex;
    private final PendingSendsMigration migration;

    public SqliteCheckpointSaver(SqlExecutor executor) {
        this(executor, new JacksonSerializer(), new IncrementingVersionGenerator());
    }

    public SqliteCheckpointSaver(SqlExecutor executor, SerializerProtocol serde, VersionGenerator versionGenerator) {
        this.executor = executor;
        this.schema = new SchemaManager(executor);
        this.codec = new RecordCodec(serde);
        this.writesIndex = new PendingWritesIndex(executor, schema, codec);
        this.migration = new PendingSendsMigration(versionGenerator);
    }

    /**
     * Opens a saver on a SQLite database given as a file path or {@code jdbc:sqlite:} URL.
     * In-memory databases are pinned to one connection so every statement sees the same data.
     */
    public static SqliteCheckpointSaver fromConnString(String connStringOrLocalPath) {
        return new SqliteCheckpointSaver(new JdbcSqlExecutor(dataSource(connStringOrLocalPath)));
    }

    /**
     * SQLite data source for a file path or {@code jdbc:sqlite:} URL. In-memory databases
     * get a single shared connection.
     */
    public static DataSource dataSource(String connStringOrLocalPath) {
        String url = connStringOrLocalPath.startsWith("jdbc:")
                ? connStringOrLocalPath
                : "jdbc:sqlite:" + connStringOrLocalPath;
        if (url.contains(":memory:") || url.contains("mode=memory")) {
            return new SingleConnectionDataSource(url, true);
        }
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl(url);
        return dataSource;
    }

    @Override
    public Optional<CheckpointTuple> getTuple(CheckpointConfig config) {
        schema.ensureReady();
        String ns = config.namespaceOrDefault();
        SqlStatement query = config.hasCheckpointId()
                ? SqlStatement.of(SELECT_CHECKPOINTS + "WHERE thread_id = ? AND checkpoint_ns = ? AND checkpoint_id = ?",
                        config.threadId(), ns, config.checkpointId())
                : SqlStatement.of(SELECT_CHECKPOINTS + "WHERE thread_id = ? AND checkpoint_ns = ?\nORDER BY checkpoint_id DESC LIMIT 1",
                        config.threadId(), ns);

        List<Map<String, Object>> rows = executor.execute(query);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        CheckpointRow row = CheckpointRow.from(rows.get(0));

        CheckpointConfig resolved = config.hasCheckpointId()
                ? new CheckpointConfig(config.threadId(), ns, config.checkpointId())
                : new CheckpointConfig(row.threadId(), ns, row.checkpointId());
        if (!resolved.hasThreadId() || !resolved.hasCheckpointId()) {
            throw new InvalidConfigException("Missing thread_id or checkpoint_id");
        }
        return Optional.of(toTuple(row, resolved));
    }

    @Override
    public Stream<CheckpointTuple> list(CheckpointConfig config, ListOptions options) {
        schema.ensureReady();
        ListOptions opts = options != null ? options : ListOptions.none();
        List<String> where = new ArrayList<>();
        List<Object> args = new ArrayList<>();

        if (config != null && config.hasThreadId()) {
            where.add("thread_id = ?");
            args.add(config.threadId());
        }
        if (config != null && config.checkpointNs() != null) {
            where.add("checkpoint_ns = ?");
            args.add(config.checkpointNs());
        }
        if (opts.beforeCheckpointId() != null) {
            where.add("checkpoint_id < ?");
            args.add(opts.beforeCheckpointId());
        }
        for (Map.Entry<String, Object> entry : metadataFilter(opts.filter()).entrySet()) {
            // key is one of CheckpointMetadata.KEYS
            where.add("CAST(metadata AS TEXT) -> '$." + entry.getKey() + "' = ?");
            args.add(codec.filterValue(entry.getValue()));
        }

        StringBuilder sql = new StringBuilder(SELECT_CHECKPOINTS);
        if (!where.isEmpty()) {
            sql.append("WHERE ").append(String.join("\n  AND ", where)).append('\n');
        }
        sql.append("ORDER BY checkpoint_id DESC");
        if (opts.limit() != null && opts.limit() > 0) {
            sql.append(" LIMIT ?");
            args.add(opts.limit());
        }

        List<Map<String, Object>> rows = executor.execute(new SqlStatement(sql.toString(), args));
        log.debug("Listing {} checkpoints for thread {}", rows.size(), config != null ? config.threadId() : null);
        return rows.stream()
                .map(CheckpointRow::from)
                .map(row -> toTuple(row, new CheckpointConfig(row.threadId(), row.checkpointNs(), row.checkpointId())));
    }

    @Override
    public CheckpointConfig put(CheckpointConfig config, Checkpoint checkpoint, CheckpointMetadata metadata) {
        schema.ensureReady();
        if (config == null || !config.hasThreadId()) {
            throw new InvalidConfigException("Missing thread_id in checkpoint config");
        }
        String ns = config.namespaceOrDefault();
        EncodedCheckpoint encoded = codec.encode(checkpoint, metadata);

        executor.execute(SqlStatement.of(UPSERT_CHECKPOINT,
                config.threadId(), ns, checkpoint.id(), config.checkpointId(),
                encoded.type(), encoded.checkpoint(), encoded.metadata()));
        log.debug("Saved checkpoint {} for thread {} (ns '{}', parent {})",
                checkpoint.id(), config.threadId(), ns, config.checkpointId());
        return new CheckpointConfig(config.threadId(), ns, checkpoint.id());
    }

    @Override
    public void putWrites(CheckpointConfig config, List<PendingWrite> writes, String taskId) {
        if (config == null || !config.hasThreadId()) {
            throw new InvalidConfigException("Missing thread_id in checkpoint config");
        }
        if (!config.hasCheckpointId()) {
            throw new InvalidConfigException("Missing checkpoint_id in checkpoint config");
        }
        writesIndex.putWrites(config, config.checkpointId(), taskId, writes);
    }

    @Override
    public void deleteThread(String threadId) {
        schema.ensureReady();
        executor.batch(List.of(
                SqlStatement.of(DELETE_THREAD_CHECKPOINTS, threadId),
                SqlStatement.of(DELETE_THREAD_WRITES, threadId)), BatchMode.WRITE);
        log.debug("Deleted checkpoints and writes for thread {}", threadId);
    }

    /** Writes recorded against one checkpoint, ordered by task then idx. */
    public List<TaskWrite> getWrites(CheckpointConfig config) {
        if (config == null || !config.hasThreadId() || !config.hasCheckpointId()) {
            throw new InvalidConfigException("Missing thread_id or checkpoint_id in checkpoint config");
        }
        return writesIndex.getWrites(config, config.checkpointId());
    }

    private CheckpointTuple toTuple(CheckpointRow row, CheckpointConfig config) {
        List<TaskWrite> pendingWrites = codec.decodeWriteColumns(row.pendingWrites());
        Checkpoint checkpoint = codec.decodeCheckpoint(row.type(), row.checkpoint());
        if (migration.requiresUpgrade(checkpoint, row.parentCheckpointId())) {
            CheckpointConfig partition = new CheckpointConfig(row.threadId(), row.checkpointNs(), null);
            checkpoint = migration.upgrade(checkpoint, writesIndex.getPendingSends(partition, row.parentCheckpointId()));
        }
        CheckpointMetadata metadata = codec.decodeMetadata(row.type(), row.metadata());
        CheckpointConfig parentConfig = row.parentCheckpointId() != null
                ? new CheckpointConfig(row.threadId(), config.checkpointNs(), row.parentCheckpointId())
                : null;
        return new CheckpointTuple(config, checkpoint, metadata, parentConfig, pendingWrites);
    }

    private static Map<String, Object> metadataFilter(Map<String, Object> filter) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        filter.forEach((key, value) -> {
            if (value != null && CheckpointMetadata.KEYS.contains(key)) {
                sanitized.put(key, value);
            }
        });
        return sanitized;
    }
}
