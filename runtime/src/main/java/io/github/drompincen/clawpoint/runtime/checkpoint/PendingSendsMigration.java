package io.github.drompincen.clawpoint.runtime.checkpoint;

import io.github.drompincen.clawpoint.protocol.checkpoint.ChannelVersions;
import io.github.drompincen.clawpoint.protocol.checkpoint.Checkpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-time upgrade for checkpoints written before format version 4. Those carried their
 * pending sends as writes on the parent checkpoint instead of in the {@link Checkpoint#TASKS}
 * channel. The upgraded copy is returned to callers and never stored.
 */
public class PendingSendsMigration {

    private final VersionGenerator versionGenerator;

    public PendingSendsMigration(VersionGenerator versionGenerator) {
        this.versionGenerator = versionGenerator;
    }

    public boolean requiresUpgrade(Checkpoint checkpoint, String parentCheckpointId) {
        return checkpoint.isLegacy() && parentCheckpointId != null;
    }

    public Checkpoint upgrade(Checkpoint checkpoint, List<Object> pendingSends) {
        if (pendingSends == null || pendingSends.isEmpty()) {
            return checkpoint;
        }
        // highest sibling version; a fresh one only when no channel has been versioned yet
        Object version = checkpoint.channelVersions().isEmpty()
                ? versionGenerator.nextVersion(null)
                : ChannelVersions.max(checkpoint.channelVersions().values());
        return checkpoint.withChannel(Checkpoint.TASKS, Collections.unmodifiableList(new ArrayList<>(pendingSends)), version);
    }
}
