package io.depkit.sdk.internal;

import com.fasterxml.jackson.databind.JavaType;
import io.depkit.sdk.DepApiException;
import io.depkit.sdk.DepAuthException;
import io.depkit.sdk.DepException;
import io.depkit.sdk.DepNotFoundException;
import io.depkit.sdk.DepProtocolException;
import io.depkit.sdk.DepServerException;
import io.depkit.sdk.DepValidationException;
import io.depkit.sdk.ExpiryMarker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps DEP responses to typed values or to the matching {@link DepException} subclass.
 *
 * <p>
 * DEP reports most errors as a bare token in the body ({@code INVALID_PROFILE}, {@code FORBIDDEN}); the session
 * endpoint and some proxies answer with a JSON object carrying {@code code}/{@code message}. Both forms are
 * understood and the raw body is always preserved on the exception.
 * </p>
 */
public final class ResponseDecoder {

    private static final Pattern BARE_CODE = Pattern.compile("[A-Z][A-Z0-9_]*");

    private final List<ExpiryMarker> expiryMarkers;

    public ResponseDecoder(List<ExpiryMarker> expiryMarkers) {
        this.expiryMarkers = List.copyOf(Objects.requireNonNull(expiryMarkers, "expiryMarkers"));
    }

    /**
     * @return {@code true} when the response says the presented session token is no longer valid.
     */
    public boolean isSessionExpired(int statusCode, byte[] body) {
        if (statusCode < 400 || statusCode > 499) {
            return false;
        }
        String code = errorCode(body);
        for (ExpiryMarker marker : expiryMarkers) {
            if (marker.matches(statusCode, code)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Decodes a response. A {@code Void} type accepts any success body and yields {@code null}.
     */
    public <T> T decode(int statusCode, byte[] body, JavaType type) throws DepException {
        if (statusCode < 200 || statusCode > 299) {
            throw error(statusCode, body);
        }
        if (type.hasRawClass(Void.class)) {
            return null;
        }
        if (body == null || body.length == 0) {
            throw new DepProtocolException(statusCode, "empty response body, expected " + type.getRawClass().getSimpleName(), null);
        }
        try {
            T value = Json.mapper().readValue(body, type);
            if (value == null) {
                throw new DepProtocolException(statusCode, "null response body, expected " + type.getRawClass().getSimpleName(), null);
            }
            return value;
        } catch (IOException ex) {
            throw new DepProtocolException(statusCode, "decode " + type.getRawClass().getSimpleName() + " response: " + ex.getMessage(), ex);
        }
    }

    /**
     * Classifies a non-2xx response.
     */
    public DepApiException error(int statusCode, byte[] body) {
        String raw = body == null || body.length == 0 ? null : new String(body, StandardCharsets.UTF_8);
        String code = errorCode(body);
        if (statusCode >= 400 && statusCode <= 499) {
            for (ExpiryMarker marker : expiryMarkers) {
                if (marker.matches(statusCode, code)) {
                    return new DepAuthException(statusCode, code, raw);
                }
            }
            if (statusCode == 404) {
                return new DepNotFoundException(statusCode, code, raw);
            }
            return new DepValidationException(statusCode, code, raw);
        }
        if (statusCode >= 500 && statusCode <= 599) {
            return new DepServerException(statusCode, code, raw);
        }
        return new DepApiException(statusCode, code, raw);
    }

    static String errorCode(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        String text = new String(body, StandardCharsets.UTF_8).trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.startsWith("{")) {
            try {
                return Json.text(body, "code", "error").orElse(null);
            } catch (IOException ex) {
                // not JSON after all; the raw body stays on the exception
                return null;
            }
        }
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1);
        }
        return BARE_CODE.matcher(text).matches() ? text : null;
    }
}
