package io.github.drompincen.clawpoint.persistence.row;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CheckpointRowTest {

    @Test
    void fromColumnsMapsEveryColumn() {
        Map<String, Object> columns = new HashMap<>();
        columns.put("thread_id", "t1");
        columns.put("checkpoint_ns", "");
        columns.put("checkpoint_id", "c2");
        columns.put("parent_checkpoint_id", "c1");
        columns.put("type", "json");
        columns.put("checkpoint", new byte[] {'{', '}'});
        columns.put("metadata", "{}");
        columns.put("pending_writes", "[]");

        CheckpointRow row = CheckpointRow.from(columns);

        assertThat(row.threadId()).isEqualTo("t1");
        assertThat(row.checkpointNs()).isEmpty();
        assertThat(row.checkpointId()).isEqualTo("c2");
        assertThat(row.parentCheckpointId()).isEqualTo("c1");
        assertThat(row.type()).isEqualTo("json");
        assertThat(row.checkpoint()).isInstanceOf(byte[].class);
        assertThat(row.metadata()).isEqualTo("{}");
        assertThat(row.pendingWrites()).isEqualTo("[]");
    }

    @Test
    void writeRowAcceptsLongIndex() {
        Map<String, Object> columns = new HashMap<>();
        columns.put("task_id", "t1");
        columns.put("idx", 3L);
        columns.put("channel", "chanA");

        WriteRow row = WriteRow.from(columns);

        assertThat(row.idx()).isEqualTo(3);
        assertThat(row.value()).isNull();
    }
}
