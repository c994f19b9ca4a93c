package io.github.drompincen.clawpoint.protocol.checkpoint;

/** A required partition key field is missing. */
public class InvalidConfigException extends IllegalArgumentException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
