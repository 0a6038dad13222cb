package im.arun.lighttree.exception;

/**
 * A keyed parent already holds a child under the requested key.
 */
public final class DuplicateKeyException extends TreeException {
    public DuplicateKeyException(String message) { super(message); }
}
