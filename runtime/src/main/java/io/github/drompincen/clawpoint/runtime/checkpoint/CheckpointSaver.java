package io.github.drompincen.clawpoint.runtime.checkpoint;

import io.github.drompincen.clawpoint.protocol.checkpoint.Checkpoint;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointConfig;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointMetadata;
import io.github.drompincen.clawpoint.protocol.checkpoint.CheckpointTuple;
import io.github.drompincen.clawpoint.protocol.checkpoint.ListOptions;
import io.github.drompincen.clawpoint.protocol.checkpoint.PendingWrite;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores graph checkpoints and the writes recorded between them, partitioned by
 * thread id and checkpoint namespace.
 */
public interface CheckpointSaver {

    /**
     * Fetches the checkpoint named by {@code config.checkpointId()}, or the latest one in the
     * partition when no id is given, together with its pending writes.
     */
    Optional<CheckpointTuple> getTuple(CheckpointConfig config);

    /**
     * Lists checkpoints newest first. The query runs on each call; rows are decoded as the
     * stream is consumed.
     */
    Stream<CheckpointTuple> list(CheckpointConfig config, ListOptions options);

    /**
     * Stores a checkpoint. {@code config.checkpointId()}, when present, is recorded as the
     * parent of the new checkpoint.
     *
     * @return the config addressing the stored checkpoint
     */
    CheckpointConfig put(CheckpointConfig config, Checkpoint checkpoint, CheckpointMetadata metadata);

    /** Records writes for {@code taskId} against the checkpoint named by {@code config}. */
    void putWrites(CheckpointConfig config, List<PendingWrite> writes, String taskId);

    /** Removes every checkpoint and write of the thread, across all namespaces. */
    void deleteThread(String threadId);

    default Optional<Checkpoint> get(CheckpointConfig config) {
        return getTuple(config).map(CheckpointTuple::checkpoint);
    }

    default Stream<CheckpointTuple> list(CheckpointConfig config) {
        return list(config, ListOptions.none());
    }
}
