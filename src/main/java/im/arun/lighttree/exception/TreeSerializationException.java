package im.arun.lighttree.exception;

public final class TreeSerializationException extends TreeException {
    public TreeSerializationException(String message, Throwable cause) { super(message, cause); }
}
