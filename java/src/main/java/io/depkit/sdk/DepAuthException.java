package io.depkit.sdk;

/**
 * Session or credentials were rejected by the DEP service, including after the single re-authentication retry.
 */
public final class DepAuthException extends DepApiException {

    private static final long serialVersionUID = 1L;

    public DepAuthException(int statusCode, String code, String body) {
        super(ErrorKind.AUTH, statusCode, code, body);
    }

    public DepAuthException(String message) {
        super(ErrorKind.AUTH, message);
    }
}
