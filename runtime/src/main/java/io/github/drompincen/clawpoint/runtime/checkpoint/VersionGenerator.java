package io.github.drompincen.clawpoint.runtime.checkpoint;

/** Mints the next channel version token after {@code current}, which is null for a new channel. */
@FunctionalInterface
public interface VersionGenerator {

    Object nextVersion(Object current);
}
