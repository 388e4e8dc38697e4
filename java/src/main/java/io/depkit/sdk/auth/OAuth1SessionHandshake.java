package io.depkit.sdk.auth;

import io.depkit.sdk.DepApiException;
import io.depkit.sdk.DepAuthException;
import io.depkit.sdk.DepException;
import io.depkit.sdk.DepProtocolException;
import io.depkit.sdk.DepTransportException;
import io.depkit.sdk.Route;
import io.depkit.sdk.internal.Json;
import io.depkit.sdk.internal.ResponseDecoder;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * SessionHandshake performing the DEP OAuth 1.0a session request ({@code GET /session} by default).
 */
public final class OAuth1SessionHandshake implements SessionHandshake {

    private final HttpClient httpClient;
    private final Route route;
    private final OAuth1Signer signer;
    private final ResponseDecoder decoder;
    private final String userAgent;
    private final Duration requestTimeout;

    public OAuth1SessionHandshake(
        HttpClient httpClient,
        Route route,
        OAuth1Signer signer,
        ResponseDecoder decoder,
        String userAgent,
        Duration requestTimeout
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.route = Objects.requireNonNull(route, "route");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.userAgent = userAgent;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    @Override
    public String authenticate(String name, Credentials credentials, String baseUrl) throws DepException {
        if (credentials == null || !credentials.isComplete()) {
            throw new DepAuthException("credentials for " + name + " are missing consumer or access secrets");
        }

        URI uri = URI.create(baseUrl + route.path());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .method(route.method(), HttpRequest.BodyPublishers.noBody())
            .header("Authorization", signer.authorizationHeader(credentials, route.method(), uri))
            .header("Accept", "application/json")
            .timeout(requestTimeout);
        if (userAgent != null && !userAgent.isBlank()) {
            builder.header("User-Agent", userAgent);
        }

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DepTransportException("request session for " + name + " interrupted", ex);
        } catch (IOException ex) {
            throw new DepTransportException("request session for " + name + ": " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        byte[] body = response.body();
        if (status >= 400 && status <= 499) {
            DepApiException error = decoder.error(status, body);
            throw new DepAuthException(status, error.getCode(), error.getBody());
        }
        if (status < 200 || status > 299) {
            throw decoder.error(status, body);
        }

        String token;
        try {
            token = Json.text(body, "auth_session_token").orElse(null);
        } catch (IOException ex) {
            throw new DepProtocolException(status, "decode session response: " + ex.getMessage(), ex);
        }
        if (token == null || token.isBlank()) {
            throw new DepProtocolException(status, "session response missing auth_session_token", null);
        }
        return token;
    }
}
