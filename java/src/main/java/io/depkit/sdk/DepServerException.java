package io.depkit.sdk;

/**
 * The DEP service failed with a 5xx status. Never retried by the SDK.
 */
public final class DepServerException extends DepApiException {

    private static final long serialVersionUID = 1L;

    public DepServerException(int statusCode, String code, String body) {
        super(ErrorKind.SERVER, statusCode, code, body);
    }
}
