package io.github.drompincen.clawpoint.protocol.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void emptyCheckpointIsCurrentVersion() {
        Checkpoint cp = Checkpoint.empty("c1");

        assertThat(cp.v()).isEqualTo(Checkpoint.CURRENT_VERSION);
        assertThat(cp.isLegacy()).isFalse();
        assertThat(cp.channelValues()).isEmpty();
        assertThat(cp.channelVersions()).isEmpty();
        assertThat(cp.ts()).isNotBlank();
    }

    @Test
    void withChannelReturnsNewInstance() {
        Checkpoint original = new Checkpoint(4, "c1", "ts", Map.of("a", 1), Map.of("a", 1), Map.of());

        Checkpoint updated = original.withChannel(Checkpoint.TASKS, List.of("s1"), 2);

        assertThat(updated).isNotSameAs(original);
        assertThat(updated.channelValues()).containsEntry(Checkpoint.TASKS, List.of("s1")).containsEntry("a", 1);
        assertThat(updated.channelVersions()).containsEntry(Checkpoint.TASKS, 2);
        assertThat(original.channelValues()).doesNotContainKey(Checkpoint.TASKS);
    }

    @Test
    void channelMapsAreReadOnly() {
        Checkpoint cp = new Checkpoint(4, "c1", "ts", Map.of("a", 1), Map.of(), Map.of());

        assertThatThrownBy(() -> cp.channelValues().put("b", 2))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void olderVersionIsLegacy() {
        Checkpoint cp = Checkpoint.empty("c1").withVersion(3);

        assertThat(cp.isLegacy()).isTrue();
    }

    @Test
    void serializesWithSnakeCaseFields() throws Exception {
        Checkpoint cp = new Checkpoint(4, "c1", "2024-01-01T00:00:00Z",
                Map.of("messages", List.of("hi")), Map.of("messages", 1), Map.of("agent", Map.of("messages", 1)));

        JsonNode json = mapper.valueToTree(cp);

        assertThat(json.has("channel_values")).isTrue();
        assertThat(json.has("channel_versions")).isTrue();
        assertThat(json.has("versions_seen")).isTrue();
        assertThat(json.has("legacy")).isFalse();
        assertThat(json.get("v").asInt()).isEqualTo(4);
    }

    @Test
    void deserializesPayloadWithUnknownFields() throws Exception {
        String json = """
                {"v":1,"id":"c0","ts":"2023-01-01T00:00:00Z","channel_values":{"x":5},
                 "channel_versions":{"x":2},"versions_seen":{},"pending_sends":[]}
                """;

        Checkpoint cp = mapper.readValue(json, Checkpoint.class);

        assertThat(cp.v()).isEqualTo(1);
        assertThat(cp.channelValues()).containsEntry("x", 5);
        assertThat(cp.isLegacy()).isTrue();
    }
}
