package io.depkit.sdk;

/**
 * The server answered with a success status but the body did not match the expected shape.
 */
public final class DepProtocolException extends DepException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public DepProtocolException(int statusCode, String message, Throwable cause) {
        super(ErrorKind.PROTOCOL, message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
