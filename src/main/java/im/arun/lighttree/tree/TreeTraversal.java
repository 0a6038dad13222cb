package im.arun.lighttree.tree;

import im.arun.lighttree.model.KeyedNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Iterator behind {@link Tree#expand(Traversal)}.
 *
 * <p>Work is driven by an explicit deque. A yielded node is only expanded when the caller asks for
 * the following element: its children are filtered, sorted, then pushed to the front of the deque
 * (depth mode) or to its back (width mode).
 */
final class TreeTraversal implements Iterator<KeyedNode> {

    private final Tree tree;
    private final Traversal traversal;
    private final Deque<KeyedNode> queue = new ArrayDeque<>();

    private KeyedNode next;
    private String toExpand;

    TreeTraversal(Tree tree, Traversal traversal, String startId) {
        this.tree = tree;
        this.traversal = traversal;
        if (startId != null) {
            KeyedNode start = tree.get(startId);
            boolean passes = traversal.accepts(start);
            if (passes) {
                next = start;
            }
            if (passes || traversal.isFilterThrough()) {
                toExpand = startId;
            }
        }
    }

    @Override
    public boolean hasNext() {
        while (next == null) {
            if (toExpand != null) {
                enqueueChildren(toExpand);
                toExpand = null;
            }
            KeyedNode current = queue.pollFirst();
            if (current == null) {
                return false;
            }
            toExpand = current.getIdentifier();
            if (traversal.accepts(current)) {
                next = current;
            }
        }
        return true;
    }

    @Override
    public KeyedNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        KeyedNode current = next;
        next = null;
        return current;
    }

    private void enqueueChildren(String nid) {
        List<KeyedNode> expansion = tree.children(nid).stream()
            .filter(child -> traversal.isFilterThrough() || traversal.accepts(child))
            .sorted(traversal.sibling())
            .collect(Collectors.toList());
        if (traversal.getMode() == TraversalMode.DEPTH) {
            for (int i = expansion.size() - 1; i >= 0; i--) {
                queue.addFirst(expansion.get(i));
            }
        } else {
            queue.addAll(expansion);
        }
    }
}
