package io.github.drompincen.clawpoint.protocol.checkpoint;

/** A value a task emitted to a channel during a step, not yet folded into a checkpoint. */
public record PendingWrite(String channel, Object value) {

    public static PendingWrite of(String channel, Object value) {
        return new PendingWrite(channel, value);
    }
}
