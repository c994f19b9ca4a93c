package io.github.drompincen.clawpoint.persistence.sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;

/**
 * {@link SqlExecutor} over Spring JDBC. Batches run inside one transaction on a single
 * connection, so a failing statement rolls back the ones before it.
 */
public class JdbcSqlExecutor implements SqlExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcSqlExecutor.class);

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcSqlExecutor(DataSource dataSource) {
        this(new JdbcTemplate(dataSource), new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    public JdbcSqlExecutor(JdbcTemplate jdbc, TransactionTemplate transactions) {
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    @Override
    public List<Map<String, Object>> execute(SqlStatement statement) {
        return jdbc.execute(statement.sql(), (PreparedStatementCallback<List<Map<String, Object>>>) ps -> {
            new ArgumentPreparedStatementSetter(statement.args().toArray()).setValues(ps);
            if (!ps.execute()) {
                return List.of();
            }
            try (ResultSet rs = ps.getResultSet()) {
                return new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()).extractData(rs);
            }
        });
    }

    @Override
    public void batch(List<SqlStatement> statements, BatchMode mode) {
        if (statements.isEmpty()) return;
        TransactionTemplate tx = new TransactionTemplate(transactions.getTransactionManager(), transactions);
        tx.setReadOnly(mode == BatchMode.READ);
        tx.executeWithoutResult(status -> {
            for (SqlStatement statement : statements) {
                jdbc.update(statement.sql(), statement.args().toArray());
            }
        });
        log.debug("Applied batch of {} statements ({})", statements.size(), mode);
    }
}
