package io.github.drompincen.clawpoint.persistence.sql;

import java.util.List;
import java.util.Map;

/**
 * Runs statements against the backing store. Implementations decide connection handling;
 * {@link #batch} must apply all statements or none.
 */
public interface SqlExecutor {

    /**
     * Executes one statement.
     *
     * @return result rows keyed by column label, empty for statements without a result set
     */
    List<Map<String, Object>> execute(SqlStatement statement);

    void batch(List<SqlStatement> statements, BatchMode mode);
}
