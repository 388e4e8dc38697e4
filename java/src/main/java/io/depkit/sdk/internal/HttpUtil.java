package io.depkit.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for issuing HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    public static final String SESSION_HEADER = "X-ADM-Auth-Session";
    public static final String PROTOCOL_VERSION_HEADER = "X-Server-Protocol-Version";
    static final String JSON_CONTENT_TYPE = "application/json;charset=UTF8";

    private HttpUtil() {
    }

    /**
     * Sends {@code payload} as JSON using exactly the given verb. A {@code null} payload sends no body at all, which
     * some DEP endpoints require.
     */
    public static HttpResponse<byte[]> sendJson(
        HttpClient client,
        String method,
        URI uri,
        Object payload,
        Map<String, String> headers,
        Duration timeout
    ) throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout);

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", JSON_CONTENT_TYPE);
        }

        headers.forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                builder.header(name, value);
            }
        });

        builder.header("Accept", "application/json");

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    }
}
