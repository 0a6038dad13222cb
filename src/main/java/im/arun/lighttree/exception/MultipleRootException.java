package im.arun.lighttree.exception;

/**
 * Operation would leave the tree with more than one parentless node.
 */
public final class MultipleRootException extends TreeException {
    public MultipleRootException(String message) { super(message); }
}
