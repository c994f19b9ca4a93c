package io.github.drompincen.clawpoint.runtime.checkpoint;

/** Checkpoint and metadata payloads sharing one serialization tag. */
public record EncodedCheckpoint(String type, byte[] checkpoint, byte[] metadata) {
}
