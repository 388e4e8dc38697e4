package io.depkit.sdk;

/**
 * The DEP service rejected the request as malformed or invalid (4xx other than 404).
 */
public final class DepValidationException extends DepApiException {

    private static final long serialVersionUID = 1L;

    public DepValidationException(int statusCode, String code, String body) {
        super(ErrorKind.VALIDATION, statusCode, code, body);
    }
}
