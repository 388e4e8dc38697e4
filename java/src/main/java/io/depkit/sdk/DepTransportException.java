package io.depkit.sdk;

/**
 * Network level failure: connection refused, timeout, interruption. No response was received.
 */
public final class DepTransportException extends DepException {

    private static final long serialVersionUID = 1L;

    public DepTransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
