package im.arun.lighttree.tree;

import im.arun.lighttree.exception.InvalidArgumentException;
import im.arun.lighttree.model.KeyedNode;
import im.arun.lighttree.model.LineRepr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree one line per node, in depth-first pre-order.
 *
 * <pre>
 * {}
 * ├── a: {}
 * │   └── b: []
 * └── c: []
 *     └── C0
 * </pre>
 *
 * A filtered-out node hides its whole subtree.
 */
public class TreeRenderer {

    private final Tree tree;
    private final ShowOptions options;
    private final StringBuilder output = new StringBuilder();
    private int printed;
    private boolean truncated;

    public TreeRenderer(Tree tree, ShowOptions options) {
        if (options == null) {
            throw new InvalidArgumentException("Show options must not be null");
        }
        if (options.getLimit() != null && options.getLimit() < 1) {
            throw new InvalidArgumentException(String.format("Limit must be positive, got %d", options.getLimit()));
        }
        if (options.getLineMaxLength() < 4) {
            throw new InvalidArgumentException(String.format("Line max length too small: %d", options.getLineMaxLength()));
        }
        this.tree = tree;
        this.options = options;
    }

    public String render() {
        String start = options.getNid() == null ? tree.getRoot() : tree.ensurePresent(options.getNid());
        if (start == null) {
            return "";
        }
        KeyedNode keyedNode = tree.get(start);
        if (!accepts(keyedNode)) {
            return "";
        }
        // flags of the path to the node being drawn, truncated to each frame's depth
        List<Boolean> isLastList = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(keyedNode, 0, false));
        while (!stack.isEmpty() && !truncated) {
            Frame frame = stack.pop();
            while (isLastList.size() > Math.max(frame.depth - 1, 0)) {
                isLastList.remove(isLastList.size() - 1);
            }
            if (frame.depth > 0) {
                isLastList.add(frame.isLast);
            }
            appendLine(frame.keyedNode, isLastList);

            List<KeyedNode> children = tree.children(frame.keyedNode.getIdentifier()).stream()
                .filter(this::accepts)
                .sorted(options.isReverse() ? options.getOrderKey().reversed() : options.getOrderKey())
                .collect(Collectors.toList());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), frame.depth + 1, i == children.size() - 1));
            }
        }
        return output.toString();
    }

    private void appendLine(KeyedNode keyedNode, List<Boolean> isLastList) {
        // the starting node is drawn as a root, without key
        boolean keyDisplayed = options.isDisplayKey() && !isLastList.isEmpty()
            && keyedNode.getKey() instanceof String;
        String prefix = linePrefix(options.getLineStyle(), isLastList);
        if (keyDisplayed) {
            prefix += keyedNode.getKey();
        }
        LineRepr repr = keyedNode.getNode().lineRepr(isLastList.size());
        output.append(line(prefix, keyDisplayed, options.getKeyDelimiter(), repr.getStart(), repr.getEnd(),
            options.getLineMaxLength())).append('\n');

        printed++;
        if (options.getLimit() != null && printed == options.getLimit()) {
            output.append(String.format("...\n(truncated, total number of nodes: %d)\n", tree.size()));
            truncated = true;
        }
    }

    private boolean accepts(KeyedNode keyedNode) {
        return options.getFilter() == null || options.getFilter().test(keyedNode);
    }

    /**
     * Tree drawing prefix of a line, one flag per depth telling whether the node at that depth is
     * the last of its siblings.
     */
    public static String linePrefix(LineStyle style, List<Boolean> isLastList) {
        if (isLastList.isEmpty()) {
            return "";
        }
        StringBuilder prefix = new StringBuilder();
        for (boolean isLast : isLastList.subList(0, isLastList.size() - 1)) {
            prefix.append(isLast ? "    " : style.getVertical() + "   ");
        }
        prefix.append(isLastList.get(isLastList.size() - 1) ? style.getCorner() : style.getBox());
        return prefix.toString();
    }

    /**
     * Lays out one line. Without an end part the line is left as is; with one, the end part is
     * right-aligned on {@code lineMaxLength} columns. A line too long is cut and ends with "...".
     */
    public static String line(String prefix, boolean keyDisplayed, String keyDelimiter,
                              String start, String end, int lineMaxLength) {
        String left = prefix + (keyDisplayed ? keyDelimiter : "") + start;
        if (end == null || end.isEmpty()) {
            if (left.length() <= lineMaxLength) {
                return left;
            }
            return left.substring(0, lineMaxLength - 3) + "...";
        }
        int padding = lineMaxLength - left.length() - end.length();
        if (padding >= 1) {
            return left + " ".repeat(padding) + end;
        }
        String joined = left + " " + end;
        return joined.substring(0, lineMaxLength - 3) + "...";
    }

    private static final class Frame {
        private final KeyedNode keyedNode;
        private final int depth;
        private final boolean isLast;

        private Frame(KeyedNode keyedNode, int depth, boolean isLast) {
            this.keyedNode = keyedNode;
            this.depth = depth;
            this.isLast = isLast;
        }
    }
}
