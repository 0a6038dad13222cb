package im.arun.lighttree.exception;

/**
 * Tree inserted above a node has several leaves and no target leaf was named.
 */
public final class AmbiguousInsertionException extends TreeException {
    public AmbiguousInsertionException(String message) { super(message); }
}
