package io.depkit.sdk;

import java.util.Locale;
import java.util.Objects;

/**
 * HTTP verb and path pairing used to reach one DEP endpoint. The path is relative to the configuration's base URL.
 */
public record Route(String method, String path) {

    public Route {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        method = method.trim().toUpperCase(Locale.ROOT);
        if (method.isEmpty()) {
            throw new IllegalArgumentException("method must be non-empty");
        }
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
    }

    public static Route of(String method, String path) {
        return new Route(method, path);
    }
}
