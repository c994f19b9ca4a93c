package io.github.drompincen.clawpoint.protocol.checkpoint;

public class SerializationMismatchException extends IllegalStateException {

    private final String checkpointType;
    private final String metadataType;

    public SerializationMismatchException(String checkpointType, String metadataType) {
        super("Failed to serialize checkpoint and metadata to the same type: "
                + checkpointType + " vs " + metadataType);
        this.checkpointType = checkpointType;
        this.metadataType = metadataType;
    }

    public String getCheckpointType() { return checkpointType; }

    public String getMetadataType() { return metadataType; }
}
