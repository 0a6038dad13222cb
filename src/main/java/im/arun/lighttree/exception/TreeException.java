package im.arun.lighttree.exception;

/**
 * Base type for every structural error raised by a tree.
 * These signal contract violations by the caller, never transient conditions.
 */
public class TreeException extends RuntimeException {
    public TreeException(String message) { super(message); }
    public TreeException(String message, Throwable cause) { super(message, cause); }
}
