package im.arun.lighttree.exception;

/**
 * Operation would break a structural invariant (leaf parent, keyed/list mismatch, wrong key type).
 */
public final class InvalidOperationException extends TreeException {
    public InvalidOperationException(String message) { super(message); }
}
