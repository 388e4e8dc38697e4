package io.depkit.sdk;

import io.depkit.sdk.auth.CredentialStore;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link DepClient} instances.
 */
public final class Config {

    public static final String DEFAULT_BASE_URL = "https://mdmenrollment.apple.com";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "depkit-sdk/1.0";
    public static final String DEFAULT_SERVER_PROTOCOL_VERSION = "3";

    private final CredentialStore credentialStore;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final String userAgent;
    private final String serverProtocolVersion;
    private final Map<Endpoint, Route> routes;
    private final List<ExpiryMarker> expiryMarkers;

    private Config(Builder builder) {
        this.credentialStore = builder.credentialStore;
        this.baseUrl = builder.baseUrl;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.userAgent = builder.userAgent;
        this.serverProtocolVersion = builder.serverProtocolVersion;
        this.routes = builder.routes.isEmpty() ? new EnumMap<>(Endpoint.class) : new EnumMap<>(builder.routes);
        this.expiryMarkers = builder.expiryMarkers == null ? null : new ArrayList<>(builder.expiryMarkers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        if (credentialStore == null) {
            throw new IllegalArgumentException("CredentialStore is required");
        }

        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(DEFAULT_BASE_URL));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        String resolvedUserAgent = Optional.ofNullable(userAgent)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_USER_AGENT);

        String resolvedProtocolVersion = Optional.ofNullable(serverProtocolVersion)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_SERVER_PROTOCOL_VERSION);

        Map<Endpoint, Route> resolvedRoutes = new EnumMap<>(Endpoint.class);
        for (Endpoint endpoint : Endpoint.values()) {
            resolvedRoutes.put(endpoint, routes.getOrDefault(endpoint, endpoint.defaultRoute()));
        }

        List<ExpiryMarker> resolvedMarkers;
        if (expiryMarkers == null) {
            resolvedMarkers = ExpiryMarker.DEFAULTS;
        } else {
            resolvedMarkers = expiryMarkers.stream()
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        Builder resolved = new Builder()
            .credentialStore(credentialStore)
            .baseUrl(resolvedBaseUrl)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .userAgent(resolvedUserAgent)
            .serverProtocolVersion(resolvedProtocolVersion)
            .expiryMarkers(resolvedMarkers);
        resolvedRoutes.forEach(resolved::route);
        return resolved.buildInternal();
    }

    /**
     * Normalises a base URL: requires scheme and host and strips a trailing slash.
     */
    public static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public CredentialStore getCredentialStore() {
        return credentialStore;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getServerProtocolVersion() {
        return serverProtocolVersion;
    }

    /**
     * @return the route in effect for the endpoint, taking per-deployment overrides into account.
     */
    public Route route(Endpoint endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        return routes.getOrDefault(endpoint, endpoint.defaultRoute());
    }

    public List<ExpiryMarker> getExpiryMarkers() {
        return Collections.unmodifiableList(expiryMarkers);
    }

    public static final class Builder {
        private CredentialStore credentialStore;
        private String baseUrl;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private String userAgent;
        private String serverProtocolVersion;
        private final Map<Endpoint, Route> routes = new EnumMap<>(Endpoint.class);
        private List<ExpiryMarker> expiryMarkers;

        public Builder credentialStore(CredentialStore credentialStore) {
            this.credentialStore = credentialStore;
            return this;
        }

        /**
         * Base URL used for configuration names whose store entry does not carry one.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder serverProtocolVersion(String serverProtocolVersion) {
            this.serverProtocolVersion = serverProtocolVersion;
            return this;
        }

        public Builder route(Endpoint endpoint, Route route) {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(route, "route");
            this.routes.put(endpoint, route);
            return this;
        }

        public Builder expiryMarkers(List<ExpiryMarker> expiryMarkers) {
            this.expiryMarkers = expiryMarkers == null ? null : new ArrayList<>(expiryMarkers);
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
