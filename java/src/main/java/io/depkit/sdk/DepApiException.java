package io.depkit.sdk;

/**
 * Exception representing a non-2xx response from the DEP service. The HTTP status, the server error code (when
 * one could be extracted) and the raw response body are kept verbatim so callers can diagnose failures without a
 * network capture.
 */
public class DepApiException extends DepException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;
    private final String body;

    public DepApiException(int statusCode, String code, String body) {
        this(ErrorKind.UNKNOWN, statusCode, code, body);
    }

    protected DepApiException(ErrorKind kind, int statusCode, String code, String body) {
        super(kind, defaultMessage(statusCode, code, body));
        this.statusCode = statusCode;
        this.code = code;
        this.body = body;
    }

    protected DepApiException(ErrorKind kind, String message) {
        super(kind, message);
        this.statusCode = 0;
        this.code = null;
        this.body = null;
    }

    /**
     * @return HTTP status code returned by the DEP service, or {@code 0} when the failure was detected locally.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return DEP error code such as {@code INVALID_PROFILE} (nullable when the body did not carry one).
     */
    public String getCode() {
        return code;
    }

    /**
     * @return response body exactly as received (nullable when the response had none).
     */
    public String getBody() {
        return body;
    }

    private static String defaultMessage(int status, String code, String body) {
        StringBuilder message = new StringBuilder("DEP request failed with status ").append(status);
        if (code != null && !code.isBlank()) {
            message.append(" (").append(code).append(')');
        }
        if (body != null && !body.isBlank() && !body.trim().equals(code)) {
            message.append(": ").append(body.trim());
        }
        return message.toString();
    }
}
