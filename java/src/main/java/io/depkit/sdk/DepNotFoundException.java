package io.depkit.sdk;

public final class DepNotFoundException extends DepApiException {

    private static final long serialVersionUID = 1L;

    public DepNotFoundException(int statusCode, String code, String body) {
        super(ErrorKind.NOT_FOUND, statusCode, code, body);
    }
}
