package io.depkit.sdk.internal;

import com.fasterxml.jackson.databind.JavaType;
import io.depkit.sdk.DepApiException;
import io.depkit.sdk.DepAuthException;
import io.depkit.sdk.DepException;
import io.depkit.sdk.DepTransportException;
import io.depkit.sdk.auth.SessionManager;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Sends one logical DEP request on behalf of a configuration name.
 *
 * <p>
 * Every attempt carries the session token from {@link SessionManager}. When the server answers with an expiry signal
 * the token is invalidated and the request is reissued once with a fresh session; a second expiry signal surfaces as
 * {@link DepAuthException}. No other failure is retried.
 * </p>
 *
 * <p>
 * A session token handed back on a successful response replaces the cached one and is written to the credential
 * store before the result is returned; if the store rejects it, the call fails with that
 * {@link io.depkit.sdk.CredentialStoreException}.
 * </p>
 */
public final class RequestExecutor {

    private static final Logger LOGGER = Logger.getLogger(RequestExecutor.class.getName());

    static final int MAX_ATTEMPTS = 2;

    private final HttpClient httpClient;
    private final SessionManager sessions;
    private final ResponseDecoder decoder;
    private final Duration requestTimeout;
    private final Map<String, String> staticHeaders;

    public RequestExecutor(
        HttpClient httpClient,
        SessionManager sessions,
        ResponseDecoder decoder,
        Duration requestTimeout,
        String userAgent,
        String serverProtocolVersion
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        Map<String, String> headers = new LinkedHashMap<>();
        if (userAgent != null) {
            headers.put("User-Agent", userAgent);
        }
        if (serverProtocolVersion != null) {
            headers.put(HttpUtil.PROTOCOL_VERSION_HEADER, serverProtocolVersion);
        }
        this.staticHeaders = Map.copyOf(headers);
    }

    /**
     * Executes a request and decodes the response.
     *
     * @param name         configuration name selecting credentials, session and server.
     * @param method       HTTP verb, sent verbatim.
     * @param path         path (and query) relative to the configuration's base URL.
     * @param body         request payload serialised as JSON, or {@code null} to send no body.
     * @param responseType expected success shape.
     * @return the decoded response.
     * @throws DepException the classified failure; see {@link io.depkit.sdk.ErrorKind}.
     */
    public <T> T execute(String name, String method, String path, Object body, JavaType responseType)
        throws DepException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(responseType, "responseType");

        for (int attempt = 1; ; attempt++) {
            String token = sessions.ensureSession(name);
            URI uri = URI.create(sessions.baseUrl(name) + path);

            Map<String, String> headers = new LinkedHashMap<>(staticHeaders);
            headers.put(HttpUtil.SESSION_HEADER, token);

            HttpResponse<byte[]> response;
            try {
                response = HttpUtil.sendJson(httpClient, method, uri, body, headers, requestTimeout);
            } catch (IOException | InterruptedException ex) {
                if (ex instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    throw new DepTransportException(method + " " + path + " interrupted", ex);
                }
                throw new DepTransportException(method + " " + path + ": " + ex.getMessage(), ex);
            }

            int status = response.statusCode();
            byte[] responseBody = response.body();

            if (decoder.isSessionExpired(status, responseBody)) {
                sessions.invalidate(name);
                if (attempt >= MAX_ATTEMPTS) {
                    DepApiException error = decoder.error(status, responseBody);
                    throw new DepAuthException(status, error.getCode(), error.getBody());
                }
                LOGGER.fine(() -> "[depkit] session for " + name + " expired on " + method + " " + path + "; re-authenticating");
                continue;
            }

            if (status >= 200 && status <= 299) {
                Optional<String> rotated = response.headers().firstValue(HttpUtil.SESSION_HEADER);
                if (rotated.isPresent()) {
                    sessions.rotate(name, rotated.get());
                }
            }
            return decoder.decode(status, responseBody, responseType);
        }
    }
}
