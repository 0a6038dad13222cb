package im.arun.lighttree.model;

import lombok.Value;

/**
 * A node together with the key under which it sits in its tree: {@code null} for the root,
 * a {@link String} under a keyed parent, an {@link Integer} position under a list parent.
 */
@Value
public class KeyedNode {
    Object key;
    Node node;

    public String getIdentifier() {
        return node.getIdentifier();
    }
}
