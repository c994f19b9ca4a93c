package io.github.drompincen.clawpoint.protocol.checkpoint;

public record TaskWrite(String taskId, String channel, Object value) {
}
