package io.depkit.sdk;

/**
 * Base exception thrown by the DepKit SDK.
 */
public class DepException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public DepException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DepException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
