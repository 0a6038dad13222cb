package im.arun.lighttree.exception;

/**
 * Node identifier already exists in the tree.
 */
public final class DuplicatedNodeException extends TreeException {
    public DuplicatedNodeException(String message) { super(message); }
}
