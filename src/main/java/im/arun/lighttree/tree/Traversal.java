package im.arun.lighttree.tree;

import im.arun.lighttree.model.KeyedNode;
import im.arun.lighttree.model.NodeKeys;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.function.Predicate;

/**
 * Parameters of a tree walk.
 *
 * <ul>
 *     <li>{@code nid}: start node, the root when null</li>
 *     <li>{@code filter}: nodes failing it are not yielded</li>
 *     <li>{@code filterThrough}: when false an excluded node prunes its whole subtree</li>
 *     <li>{@code orderKey} / {@code reverse}: sort applied to each node's children</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class Traversal {

    public static final Traversal DEFAULT = Traversal.builder().build();

    String nid;

    @Builder.Default
    TraversalMode mode = TraversalMode.DEPTH;

    Predicate<KeyedNode> filter;

    boolean filterThrough;

    @Builder.Default
    Comparator<KeyedNode> orderKey = NodeKeys.BY_KEY;

    boolean reverse;

    boolean accepts(KeyedNode keyedNode) {
        return filter == null || filter.test(keyedNode);
    }

    Comparator<KeyedNode> sibling() {
        return reverse ? orderKey.reversed() : orderKey;
    }
}
