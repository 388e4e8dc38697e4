package io.depkit.sdk;

import java.util.List;

/**
 * Describes a response that means "the presented session token is no longer valid". A {@code null} code matches any
 * body for the given status.
 */
public record ExpiryMarker(int status, String code) {

    public static final List<ExpiryMarker> DEFAULTS = List.of(
        new ExpiryMarker(401, null),
        new ExpiryMarker(403, "FORBIDDEN")
    );

    public ExpiryMarker {
        if (status < 400 || status > 499) {
            throw new IllegalArgumentException("expiry marker status must be 4xx: " + status);
        }
        code = code == null || code.isBlank() ? null : code.trim();
    }

    public boolean matches(int responseStatus, String responseCode) {
        if (responseStatus != status) {
            return false;
        }
        return code == null || code.equals(responseCode);
    }
}
