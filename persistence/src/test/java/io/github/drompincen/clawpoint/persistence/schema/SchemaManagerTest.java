package io.github.drompincen.clawpoint.persistence.schema;

import io.github.drompincen.clawpoint.persistence.sql.SqlExecutor;
import io.github.drompincen.clawpoint.persistence.sql.SqlStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchemaManagerTest {

    @Mock
    private SqlExecutor executor;

    private SchemaManager schemaManager;

    @BeforeEach
    void setUp() {
        schemaManager = new SchemaManager(executor);
    }

    @Test
    void ensureReadyCreatesBothTables() {
        when(executor.execute(any(SqlStatement.class))).thenReturn(List.of());

        schemaManager.ensureReady();

        ArgumentCaptor<SqlStatement> captor = ArgumentCaptor.forClass(SqlStatement.class);
        verify(executor, times(3)).execute(captor.capture());
        assertThat(captor.getAllValues()).extracting(SqlStatement::sql)
                .containsExactly(SchemaManager.ENABLE_WAL, SchemaManager.CREATE_CHECKPOINTS, SchemaManager.CREATE_WRITES);
        assertThat(schemaManager.isReady()).isTrue();
    }

    @Test
    void ensureReadyRunsOnlyOnce() {
        when(executor.execute(any(SqlStatement.class))).thenReturn(List.of());

        schemaManager.ensureReady();
        schemaManager.ensureReady();
        schemaManager.ensureReady();

        verify(executor, times(3)).execute(any(SqlStatement.class));
    }

    @Test
    void walFailureIsNotFatal() {
        when(executor.execute(any(SqlStatement.class))).thenAnswer(inv -> {
            SqlStatement statement = inv.getArgument(0);
            if (SchemaManager.ENABLE_WAL.equals(statement.sql())) {
                throw new DataAccessResourceFailureException("not supported");
            }
            return List.of();
        });

        schemaManager.ensureReady();

        assertThat(schemaManager.isReady()).isTrue();
    }

    @Test
    void failedCreationIsRetriedOnNextCall() {
        when(executor.execute(any(SqlStatement.class)))
                .thenReturn(List.of())
                .thenThrow(new DataAccessResourceFailureException("disk full"))
                .thenReturn(List.of());

        assertThatThrownBy(() -> schemaManager.ensureReady())
                .isInstanceOf(DataAccessResourceFailureException.class);
        assertThat(schemaManager.isReady()).isFalse();

        schemaManager.ensureReady();

        assertThat(schemaManager.isReady()).isTrue();
    }

    @Test
    void separateInstancesTrackReadinessIndependently() {
        when(executor.execute(any(SqlStatement.class))).thenReturn(List.of());
        SchemaManager other = new SchemaManager(executor);

        schemaManager.ensureReady();

        assertThat(other.isReady()).isFalse();
    }
}
