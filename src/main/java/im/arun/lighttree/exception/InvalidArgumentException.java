package im.arun.lighttree.exception;

/**
 * Malformed argument: unknown traversal mode, blank separator, conflicting locators.
 */
public final class InvalidArgumentException extends TreeException {
    public InvalidArgumentException(String message) { super(message); }
}
