package im.arun.lighttree.tree;

import lombok.Value;

/**
 * A tree detached from (or extracted out of) another tree, with the key its root had there.
 */
@Value
public class KeyedTree {
    Object key;
    Tree tree;
}
