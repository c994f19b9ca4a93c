package io.github.drompincen.clawpoint.protocol.checkpoint;

import java.util.List;

public record CheckpointTuple(
        CheckpointConfig config,
        Checkpoint checkpoint,
        CheckpointMetadata metadata,
        CheckpointConfig parentConfig,
        List<TaskWrite> pendingWrites
) {
    public CheckpointTuple {
        pendingWrites = pendingWrites != null ? List.copyOf(pendingWrites) : List.of();
    }
}
