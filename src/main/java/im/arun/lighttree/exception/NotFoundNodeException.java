package im.arun.lighttree.exception;

/**
 * Requested node identifier (or path segment) is not present in the tree.
 */
public final class NotFoundNodeException extends TreeException {
    public NotFoundNodeException(String message) { super(message); }
}
