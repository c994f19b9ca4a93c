package io.github.drompincen.clawpoint.persistence.schema;

import io.github.drompincen.clawpoint.persistence.sql.SqlExecutor;
import io.github.drompincen.clawpoint.persistence.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@code checkpoints} and {@code writes} tables on first use. State is per
 * instance; two processes racing on one database both issue the same
 * {@code CREATE TABLE IF NOT EXISTS}, which is harmless.
 */
public class SchemaManager {

    private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

    public static final String CHECKPOINTS_TABLE = "checkpoints";
    public static final String WRITES_TABLE = "writes";

    static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    static final String CREATE_CHECKPOINTS = """
            CREATE TABLE IF NOT EXISTS checkpoints (
              thread_id TEXT NOT NULL,
              checkpoint_ns TEXT NOT NULL DEFAULT '',
              checkpoint_id TEXT NOT NULL,
              parent_checkpoint_id TEXT,
              type TEXT,
              checkpoint BLOB,
              metadata BLOB,
              PRIMARY KEY (thread_id, checkpoint_ns, checkpoint_id)
            )""";

    static final String CREATE_WRITES = """
            CREATE TABLE IF NOT EXISTS writes (
              thread_id TEXT NOT NULL,
              checkpoint_ns TEXT NOT NULL DEFAULT '',
              checkpoint_id TEXT NOT NULL,
              task_id TEXT NOT NULL,
              idx INTEGER NOT NULL,
              channel TEXT NOT NULL,
              type TEXT,
              value BLOB,
              PRIMARY KEY (thread_id, checkpoint_ns, checkpoint_id, task_id, idx)
            )""";

    private final SqlExecutor executor;
    private volatile boolean ready;

    public SchemaManager(SqlExecutor executor) {
        this.executor = executor;
    }

    public void ensureReady() {
        if (ready) return;
        synchronized (this) {
            if (ready) return;
            enableWal();
            executor.execute(SqlStatement.of(CREATE_CHECKPOINTS));
            executor.execute(SqlStatement.of(CREATE_WRITES));
            ready = true;
            log.debug("Checkpoint schema ready");
        }
    }

    public boolean isReady() {
        return ready;
    }

    private void enableWal() {
        try {
            executor.execute(SqlStatement.of(ENABLE_WAL));
        } catch (RuntimeException e) {
            // not every storage mode supports WAL (in-memory databases, remote clients)
            log.debug("WAL journal mode unavailable: {}", e.getMessage());
        }
    }
}
