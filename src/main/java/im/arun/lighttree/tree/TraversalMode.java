package im.arun.lighttree.tree;

import im.arun.lighttree.exception.InvalidArgumentException;

/**
 * Order in which a walk expands nodes.
 */
public enum TraversalMode {
    /** Pre-order depth-first: expanded children go to the front of the work queue. */
    DEPTH("depth"),
    /** Breadth-first: expanded children go to the back of the work queue. */
    WIDTH("width");

    private final String label;

    TraversalMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static TraversalMode of(String label) {
        for (TraversalMode mode : values()) {
            if (mode.label.equalsIgnoreCase(label)) {
                return mode;
            }
        }
        throw new InvalidArgumentException(String.format("Traversal mode '%s' is not supported", label));
    }
}
