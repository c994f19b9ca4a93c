package io.github.drompincen.clawpoint.runtime.checkpoint;

/** Integer versions starting at 1. String versions need a generator that understands them. */
public class IncrementingVersionGenerator implements VersionGenerator {

    @Override
    public Object nextVersion(Object current) {
        if (current == null) {
            return 1;
        }
        if (current instanceof Integer i) {
            return i + 1;
        }
        if (current instanceof Number n) {
            return n.longValue() + 1;
        }
        throw new UnsupportedOperationException(
                "String channel versions are not supported by " + getClass().getSimpleName());
    }
}
