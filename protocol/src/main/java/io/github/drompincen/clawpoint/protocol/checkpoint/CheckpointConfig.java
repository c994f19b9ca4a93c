package io.github.drompincen.clawpoint.protocol.checkpoint;

/**
 * Partition key addressing a thread's history. A null namespace means "every namespace"
 * when listing and the default namespace everywhere else.
 */
public record CheckpointConfig(
        String threadId,
        String checkpointNs,
        String checkpointId
) {
    public static final String DEFAULT_NS = "";

    public static CheckpointConfig ofThread(String threadId) {
        return new CheckpointConfig(threadId, DEFAULT_NS, null);
    }

    public static CheckpointConfig of(String threadId, String checkpointNs, String checkpointId) {
        return new CheckpointConfig(threadId, checkpointNs, checkpointId);
    }

    public String namespaceOrDefault() {
        return checkpointNs != null ? checkpointNs : DEFAULT_NS;
    }

    public CheckpointConfig withCheckpointId(String id) {
        return new CheckpointConfig(threadId, checkpointNs, id);
    }

    public boolean hasThreadId() {
        return threadId != null && !threadId.isEmpty();
    }

    public boolean hasCheckpointId() {
        return checkpointId != null && !checkpointId.isEmpty();
    }
}
