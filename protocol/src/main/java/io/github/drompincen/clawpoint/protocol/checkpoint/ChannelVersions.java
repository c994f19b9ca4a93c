package io.github.drompincen.clawpoint.protocol.checkpoint;

import java.util.Collection;
import java.util.Comparator;

/**
 * Ordering over channel version tokens. Tokens are either numbers or strings; numbers
 * compare numerically, strings lexically, and a string always ranks above a number.
 */
public final class ChannelVersions {

    public static final Comparator<Object> ORDER = ChannelVersions::compare;

    private ChannelVersions() {}

    public static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) {
                return Long.compare(x.longValue(), y.longValue());
            }
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof Number) return -1;
        if (b instanceof Number) return 1;
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    public static Object max(Collection<?> versions) {
        if (versions == null || versions.isEmpty()) {
            throw new IllegalArgumentException("No channel versions to compare");
        }
        Object max = null;
        for (Object version : versions) {
            if (max == null || compare(version, max) > 0) {
                max = version;
            }
        }
        return max;
    }
}
