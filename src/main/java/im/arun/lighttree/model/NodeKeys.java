package im.arun.lighttree.model;

import java.util.Comparator;

/**
 * Helpers for node keys. Siblings always share a key type, so keys of one parent are mutually
 * comparable.
 */
public final class NodeKeys {

    /**
     * Orders siblings by key: positions numerically, string keys lexically, root key first.
     */
    public static final Comparator<KeyedNode> BY_KEY = (a, b) -> compare(a.getKey(), b.getKey());

    private NodeKeys() {}

    public static int compare(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Integer && b instanceof Integer) {
            return Integer.compare((Integer) a, (Integer) b);
        }
        return a.toString().compareTo(b.toString());
    }

    /**
     * Path segment for a key.
     */
    public static String asSegment(Object key) {
        return key == null ? "" : key.toString();
    }
}
