package io.kubestate.exporter.state;

/**
 * Ordering of resource versions.
 * <p>
 * Versions are opaque strings on the wire. When both sides parse as integers they are
 * compared numerically; otherwise neither is considered older.
 */
public final class ResourceVersions {

    private ResourceVersions() {
    }

    /**
     * @return true if {@code candidate} is known to precede {@code reference}
     */
    public static boolean isOlder(String candidate, String reference) {
        Long a = parse(candidate);
        Long b = parse(reference);
        return a != null && b != null && a < b;
    }

    private static Long parse(String version) {
        if (version == null || version.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(version);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
