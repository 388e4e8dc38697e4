package io.depkit.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import io.depkit.sdk.auth.CredentialStore;
import io.depkit.sdk.auth.Credentials;
import io.depkit.sdk.auth.InMemoryCredentialStore;
import io.depkit.sdk.internal.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import static org.junit.jupiter.api.Assertions.*;

class DepClientTest {

    private static final Credentials ACME = new Credentials("ck_acme", "cs_acme", "at_acme", "as_acme");

    private HttpServer server;
    private URI baseUri;
    private InMemoryCredentialStore store;

    private final AtomicInteger sessionCalls = new AtomicInteger();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<RecordedRequest> requests = Collections.synchronizedList(new ArrayList<>());

    private final DelegatingHandler sessionHandler = new DelegatingHandler();
    private final DelegatingHandler accountHandler = new DelegatingHandler();
    private final DelegatingHandler profileHandler = new DelegatingHandler();
    private final DelegatingHandler profileDevicesHandler = new DelegatingHandler();
    private final DelegatingHandler serverDevicesHandler = new DelegatingHandler();
    private final DelegatingHandler syncHandler = new DelegatingHandler();
    private final DelegatingHandler devicesHandler = new DelegatingHandler();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        sessionHandler.delegate = new SessionHandler();
        accountHandler.delegate = recording(exchange -> respond(exchange, 200,
            "{\"server_name\":\"acme-mdm\",\"server_uuid\":\"u-1\",\"org_name\":\"Acme\"}"));
        profileHandler.delegate = recording(exchange -> respond(exchange, 200,
            "{\"profile_uuid\":\"P1\",\"devices\":[]}"));
        profileDevicesHandler.delegate = recording(exchange -> respond(exchange, 200,
            "{\"profile_uuid\":\"P1\",\"devices\":{\"S1\":\"SUCCESS\",\"S2\":\"NOT_ACCESSIBLE\"}}"));
        serverDevicesHandler.delegate = recording(exchange -> respond(exchange, 200,
            "{\"devices\":[{\"serial_number\":\"S1\",\"model\":\"iPad\",\"profile_status\":\"empty\","
                + "\"device_assigned_date\":\"2024-01-02T03:04:05Z\"}],"
                + "\"cursor\":\"c-1\",\"fetched_until\":\"2024-01-03T00:00:00Z\",\"more_to_follow\":false}"));
        syncHandler.delegate = recording(exchange -> respond(exchange, 200,
            "{\"devices\":[{\"serial_number\":\"S1\",\"op_type\":\"modified\",\"op_date\":\"2024-02-01T00:00:00Z\"}],"
                + "\"cursor\":\"c-2\",\"more_to_follow\":true}"));
        devicesHandler.delegate = recording(exchange -> respond(exchange, 200,
            "{\"devices\":{\"S1\":{\"serial_number\":\"S1\",\"response_status\":\"SUCCESS\"},"
                + "\"S9\":{\"response_status\":\"NOT_FOUND\"}}}"));

        server.createContext("/session", sessionHandler);
        server.createContext("/account", accountHandler);
        server.createContext("/profile", profileHandler);
        server.createContext("/profile/devices", profileDevicesHandler);
        server.createContext("/server/devices", serverDevicesHandler);
        server.createContext("/devices/sync", syncHandler);
        server.createContext("/devices", devicesHandler);
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());

        store = new InMemoryCredentialStore().putCredentials("acme", ACME);
        sessionCalls.set(0);
        calls.clear();
        requests.clear();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void assignProfileReturnsPerDeviceStatusesVerbatim() throws Exception {
        DepClient client = newClient(Config.builder());

        ProfileResponse response = client.assignProfile("acme", "P1", "S1", "S2");

        assertEquals("P1", response.profileUuid());
        assertEquals(Map.of("S1", "SUCCESS", "S2", "NOT_ACCESSIBLE"), response.devices());
        assertEquals(List.of("GET /session", "PUT /profile/devices"), calls);

        RecordedRequest assign = requests.get(0);
        assertEquals("session-1", assign.sessionHeader);
        assertEquals("3", assign.protocolVersion);
        assertTrue(assign.contentType.startsWith("application/json"));
        JsonNode body = Json.mapper().readTree(assign.body);
        assertEquals("P1", body.path("profile_uuid").asText());
        assertEquals("S1", body.path("devices").get(0).asText());
        assertEquals("S2", body.path("devices").get(1).asText());

        client.close();
    }

    @Test
    void firstCallAuthenticatesOnceAndLaterCallsReuseSession() throws Exception {
        DepClient client = newClient(Config.builder());

        client.account("acme");
        client.account("acme");
        client.assignProfile("acme", "P1", "S1");

        assertEquals(1, sessionCalls.get());
        assertEquals("GET /session", calls.get(0));
        assertEquals(4, calls.size());
    }

    @Test
    void sessionRequestIsOAuthSigned() throws Exception {
        List<String> authorizations = Collections.synchronizedList(new ArrayList<>());
        sessionHandler.delegate = exchange -> {
            authorizations.add(exchange.getRequestHeaders().getFirst("Authorization"));
            new SessionHandler().handle(exchange);
        };
        DepClient client = newClient(Config.builder());

        client.account("acme");

        String header = authorizations.get(0);
        assertTrue(header.startsWith("OAuth realm=\"ADM\""), header);
        assertTrue(header.contains("oauth_consumer_key=\"ck_acme\""), header);
        assertTrue(header.contains("oauth_token=\"at_acme\""), header);
        assertTrue(header.contains("oauth_signature_method=\"HMAC-SHA1\""), header);
        assertTrue(header.contains("oauth_signature=\""), header);
    }

    @Test
    void expiredSessionIsRenewedAndRequestRetriedOnce() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        profileDevicesHandler.delegate = recording(exchange -> {
            if (attempts.incrementAndGet() == 1) {
                respond(exchange, 401, "UNAUTHORIZED");
            } else {
                respond(exchange, 200, "{\"profile_uuid\":\"P1\",\"devices\":{\"S1\":\"SUCCESS\"}}");
            }
        });
        DepClient client = newClient(Config.builder());

        ProfileResponse response = client.assignProfile("acme", "P1", "S1");

        assertEquals(Map.of("S1", "SUCCESS"), response.devices());
        assertEquals(2, attempts.get());
        assertEquals(2, sessionCalls.get());
        assertEquals("session-1", requests.get(0).sessionHeader);
        assertEquals("session-2", requests.get(1).sessionHeader);
        assertEquals(List.of("GET /session", "PUT /profile/devices", "GET /session", "PUT /profile/devices"), calls);
    }

    @Test
    void secondExpirySignalSurfacesAuthErrorWithoutThirdAttempt() throws Exception {
        profileDevicesHandler.delegate = recording(exchange -> respond(exchange, 401, "UNAUTHORIZED"));
        DepClient client = newClient(Config.builder());

        DepAuthException ex = assertThrows(DepAuthException.class, () -> client.assignProfile("acme", "P1", "S1"));

        assertEquals(ErrorKind.AUTH, ex.getKind());
        assertEquals(401, ex.getStatusCode());
        assertEquals("UNAUTHORIZED", ex.getCode());
        assertEquals(2, requests.size());
        assertEquals(2, sessionCalls.get());
    }

    @Test
    void forbiddenMarkerAlsoTriggersRenewal() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        accountHandler.delegate = recording(exchange -> {
            if (attempts.incrementAndGet() == 1) {
                respond(exchange, 403, "FORBIDDEN");
            } else {
                respond(exchange, 200, "{\"server_name\":\"acme-mdm\"}");
            }
        });
        DepClient client = newClient(Config.builder());

        assertEquals("acme-mdm", client.account("acme").serverName());
        assertEquals(2, attempts.get());
    }

    @Test
    void otherForbiddenResponsesAreValidationErrors() {
        accountHandler.delegate = recording(exchange -> respond(exchange, 403, "ACCESS_DENIED"));
        DepClient client = newClient(Config.builder());

        DepValidationException ex = assertThrows(DepValidationException.class, () -> client.account("acme"));
        assertEquals("ACCESS_DENIED", ex.getCode());
        assertEquals(1, requests.size());
        assertEquals(1, sessionCalls.get());
    }

    @Test
    void expiryMarkersAreConfigurable() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        accountHandler.delegate = recording(exchange -> {
            if (attempts.incrementAndGet() == 1) {
                respond(exchange, 400, "{\"code\":\"EXPIRED_TOKEN\",\"message\":\"session expired\"}");
            } else {
                respond(exchange, 401, "UNAUTHORIZED");
            }
        });
        DepClient client = newClient(Config.builder().expiryMarkers(List.of(new ExpiryMarker(400, "EXPIRED_TOKEN"))));

        DepValidationException ex = assertThrows(DepValidationException.class, () -> client.account("acme"));
        assertEquals(401, ex.getStatusCode());
        assertEquals(2, attempts.get());
        assertEquals(2, sessionCalls.get());
    }

    @Test
    void routeOverrideChangesVerb() throws Exception {
        DepClient client = newClient(Config.builder()
            .route(Endpoint.ASSIGN_PROFILE, Route.of("POST", "/profile/devices")));

        client.assignProfile("acme", "P1", "S1");

        assertEquals("POST /profile/devices", calls.get(1));
    }

    @Test
    void removeProfileSendsDeleteWithDevicesBody() throws Exception {
        profileDevicesHandler.delegate = recording(exchange -> respond(exchange, 200,
            "{\"devices\":{\"S1\":\"SUCCESS\",\"S2\":\"NOT_ACCESSIBLE\"}}"));
        DepClient client = newClient(Config.builder());

        ClearProfileResponse response = client.removeProfile("acme", List.of("S1", "S2"));

        assertEquals("DELETE /profile/devices", calls.get(1));
        assertEquals(Map.of("S1", "SUCCESS", "S2", "NOT_ACCESSIBLE"), response.devices());
        JsonNode body = Json.mapper().readTree(requests.get(0).body);
        assertEquals(2, body.path("devices").size());
        assertFalse(body.has("profile_uuid"));
    }

    @Test
    void defineProfileSendsProfileAndReturnsUuid() throws Exception {
        DepClient client = newClient(Config.builder());
        Profile profile = Profile.builder()
            .profileName("Staff iPads")
            .url("https://mdm.example.test/enroll")
            .supervised(true)
            .department("IT")
            .skipSetupItems(List.of("Siri", "Location"))
            .build();

        DefineProfileResponse response = client.defineProfile("acme", profile);

        assertEquals("P1", response.profileUuid());
        assertEquals("POST /profile", calls.get(1));
        JsonNode body = Json.mapper().readTree(requests.get(0).body);
        assertEquals("Staff iPads", body.path("profile_name").asText());
        assertTrue(body.path("is_supervised").asBoolean());
        assertTrue(body.path("is_mdm_removable").asBoolean());
        assertTrue(body.has("org_magic"));
        assertFalse(body.has("profile_uuid"));
        assertFalse(body.has("support_phone_number"));
    }

    @Test
    void fetchProfileSendsUuidAsQueryWithoutBody() throws Exception {
        profileHandler.delegate = recording(exchange -> {
            String query = exchange.getRequestURI().getQuery();
            respond(exchange, 200, "{\"profile_name\":\"Staff\",\"url\":\"https://mdm\",\"profile_uuid\":\""
                + query.substring(query.indexOf('=') + 1) + "\"}");
        });
        DepClient client = newClient(Config.builder());

        Profile profile = client.fetchProfile("acme", "P1");

        assertEquals("P1", profile.profileUuid());
        assertEquals("Staff", profile.profileName());
        RecordedRequest request = requests.get(0);
        assertEquals("GET", request.method);
        assertEquals(0, request.body.length);
        assertNull(request.contentType);
    }

    @Test
    void fetchProfileAppendsUuidToOverriddenRouteQuery() throws Exception {
        List<String> queries = Collections.synchronizedList(new ArrayList<>());
        profileHandler.delegate = recording(exchange -> {
            queries.add(exchange.getRequestURI().getRawQuery());
            respond(exchange, 200, "{\"profile_name\":\"Staff\",\"url\":\"https://mdm\",\"profile_uuid\":\"P 1\"}");
        });
        DepClient client = newClient(Config.builder()
            .route(Endpoint.FETCH_PROFILE, Route.of("GET", "/profile?version=2")));

        assertEquals("P 1", client.fetchProfile("acme", "P 1").profileUuid());

        assertEquals(List.of("version=2&profile_uuid=P+1"), queries);
    }

    @Test
    void queryIsJoinedWithAmpersandWhenPathAlreadyHasOne() {
        assertEquals("/profile?profile_uuid=P1", DepClient.withQuery("/profile", "profile_uuid=P1"));
        assertEquals("/profile?v=2&profile_uuid=P1", DepClient.withQuery("/profile?v=2", "profile_uuid=P1"));
        assertEquals("/account", DepClient.withQuery("/account", ""));
    }

    @Test
    void fetchAndSyncDevicesPageThroughCursor() throws Exception {
        DepClient client = newClient(Config.builder());

        DeviceListResponse fetched = client.fetchDevices("acme", null, 100);
        DeviceListResponse synced = client.syncDevices("acme", fetched.cursor(), null);

        assertEquals("S1", fetched.devices().get(0).serialNumber());
        assertEquals("c-1", fetched.cursor());
        assertFalse(fetched.moreToFollow());
        assertEquals("2024-01-02T03:04:05Z", fetched.devices().get(0).deviceAssignedDate().toString());
        assertEquals("modified", synced.devices().get(0).opType());
        assertTrue(synced.moreToFollow());

        JsonNode fetchBody = Json.mapper().readTree(requests.get(0).body);
        assertEquals(100, fetchBody.path("limit").asInt());
        assertFalse(fetchBody.has("cursor"));
        JsonNode syncBody = Json.mapper().readTree(requests.get(1).body);
        assertEquals("c-1", syncBody.path("cursor").asText());
        assertEquals(List.of("GET /session", "POST /server/devices", "POST /devices/sync"), calls);
    }

    @Test
    void deviceDetailsPassesPerDeviceNotFoundThrough() throws Exception {
        DepClient client = newClient(Config.builder());

        DeviceDetailsResponse response = client.deviceDetails("acme", List.of("S1", "S9"));

        assertEquals("SUCCESS", response.devices().get("S1").responseStatus());
        assertEquals("NOT_FOUND", response.devices().get("S9").responseStatus());
    }

    @Test
    void unparseableSuccessBodyIsProtocolError() {
        accountHandler.delegate = recording(exchange -> respond(exchange, 200, "<html>maintenance</html>"));
        DepClient client = newClient(Config.builder());

        DepProtocolException ex = assertThrows(DepProtocolException.class, () -> client.account("acme"));
        assertEquals(ErrorKind.PROTOCOL, ex.getKind());
        assertEquals(1, requests.size());
    }

    @Test
    void badRequestCarriesServerMessageVerbatim() {
        profileHandler.delegate = recording(exchange -> respond(exchange, 400, "INVALID_PROFILE"));
        DepClient client = newClient(Config.builder());
        Profile profile = Profile.builder().profileName("x").url("https://mdm").build();

        DepValidationException ex = assertThrows(DepValidationException.class, () -> client.defineProfile("acme", profile));
        assertEquals(400, ex.getStatusCode());
        assertEquals("INVALID_PROFILE", ex.getCode());
        assertEquals("INVALID_PROFILE", ex.getBody());
    }

    @Test
    void notFoundAndServerErrorsAreClassifiedAndNotRetried() {
        profileHandler.delegate = recording(exchange -> respond(exchange, 404, "NOT_FOUND"));
        accountHandler.delegate = recording(exchange -> respond(exchange, 503, "{\"code\":\"SERVICE_UNAVAILABLE\"}"));
        DepClient client = newClient(Config.builder());

        DepNotFoundException notFound = assertThrows(DepNotFoundException.class, () -> client.fetchProfile("acme", "nope"));
        assertEquals(ErrorKind.NOT_FOUND, notFound.getKind());

        DepServerException serverError = assertThrows(DepServerException.class, () -> client.account("acme"));
        assertEquals(503, serverError.getStatusCode());
        assertEquals("SERVICE_UNAVAILABLE", serverError.getCode());
        assertEquals(2, requests.size());
        assertEquals(1, sessionCalls.get());
    }

    @Test
    void unknownConfigurationFailsBeforeAnyRequest() {
        DepClient client = newClient(Config.builder());

        ConfigNotFoundException ex = assertThrows(ConfigNotFoundException.class, () -> client.account("globex"));
        assertEquals("globex", ex.getName());
        assertEquals(ErrorKind.CONFIG_NOT_FOUND, ex.getKind());
        assertTrue(calls.isEmpty());
    }

    @Test
    void blankConfigurationNameIsRejected() {
        DepClient client = newClient(Config.builder());

        assertThrows(IllegalArgumentException.class, () -> client.account(" "));
        assertTrue(calls.isEmpty());
    }

    @Test
    void rejectedHandshakeIsAuthErrorAndNoOperationIsSent() {
        sessionHandler.delegate = exchange -> {
            sessionCalls.incrementAndGet();
            respond(exchange, 401, "{\"code\":\"UNAUTHORIZED\",\"message\":\"oauth_problem_adv=token_rejected\"}");
        };
        DepClient client = newClient(Config.builder());

        DepAuthException ex = assertThrows(DepAuthException.class, () -> client.account("acme"));
        assertEquals(401, ex.getStatusCode());
        assertTrue(ex.getBody().contains("token_rejected"));
        assertTrue(requests.isEmpty());
        assertEquals(1, sessionCalls.get());
    }

    @Test
    void incompleteCredentialsAreAuthErrors() {
        store.putCredentials("broken", new Credentials("ck", "", "at", "as"));
        DepClient client = newClient(Config.builder());

        DepAuthException ex = assertThrows(DepAuthException.class, () -> client.account("broken"));
        assertEquals(0, ex.getStatusCode());
        assertEquals(0, sessionCalls.get());
    }

    @Test
    void transportFailureIsReportedWithoutRetry() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        store.storeSession("acme", "persisted-session");
        DepClient client = new DepClient(Config.builder()
            .credentialStore(store)
            .baseUrl("http://localhost:" + closedPort)
            .httpClient(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build())
            .build());

        DepTransportException ex = assertThrows(DepTransportException.class, () -> client.account("acme"));
        assertEquals(ErrorKind.TRANSPORT, ex.getKind());
    }

    @Test
    void perConfigurationBaseUrlOverridesDefault() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        store.putBaseUrl("acme", baseUri.toString() + "/");
        DepClient client = new DepClient(Config.builder()
            .credentialStore(store)
            .baseUrl("http://localhost:" + closedPort)
            .httpClient(HttpClient.newHttpClient())
            .build());

        assertEquals("acme-mdm", client.account("acme").serverName());
        assertEquals(1, sessionCalls.get());
    }

    @Test
    void storedSessionIsReusedWithoutHandshake() throws Exception {
        store.storeSession("acme", "persisted-session");
        DepClient client = newClient(Config.builder());

        client.account("acme");

        assertEquals(0, sessionCalls.get());
        assertEquals("persisted-session", requests.get(0).sessionHeader);
    }

    @Test
    void rejectedStoredSessionIsReplacedAndPersisted() throws Exception {
        store.storeSession("acme", "stale-session");
        AtomicInteger attempts = new AtomicInteger();
        accountHandler.delegate = recording(exchange -> {
            if (attempts.incrementAndGet() == 1) {
                respond(exchange, 401, "UNAUTHORIZED");
            } else {
                respond(exchange, 200, "{\"server_name\":\"acme-mdm\"}");
            }
        });
        DepClient client = newClient(Config.builder());

        client.account("acme");

        assertEquals("stale-session", requests.get(0).sessionHeader);
        assertEquals("session-1", requests.get(1).sessionHeader);
        assertEquals(1, sessionCalls.get());
        assertEquals("session-1", store.session("acme").orElseThrow());
    }

    @Test
    void rotatedSessionHeaderReplacesCachedToken() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        accountHandler.delegate = recording(exchange -> {
            if (attempts.incrementAndGet() == 1) {
                exchange.getResponseHeaders().add("X-ADM-Auth-Session", "session-rotated");
            }
            respond(exchange, 200, "{\"server_name\":\"acme-mdm\"}");
        });
        DepClient client = newClient(Config.builder());

        client.account("acme");
        client.account("acme");

        assertEquals("session-1", requests.get(0).sessionHeader);
        assertEquals("session-rotated", requests.get(1).sessionHeader);
        assertEquals("session-rotated", store.session("acme").orElseThrow());
        assertEquals(1, sessionCalls.get());
    }

    @Test
    void rotatedSessionThatCannotBePersistedFailsTheCall() throws Exception {
        AtomicInteger storeWrites = new AtomicInteger();
        CredentialStore failingOnRotation = new CredentialStore() {
            @Override
            public Credentials credentials(String name) throws ConfigNotFoundException {
                return store.credentials(name);
            }

            @Override
            public Optional<String> session(String name) {
                return store.session(name);
            }

            @Override
            public void storeSession(String name, String sessionToken) throws CredentialStoreException {
                if (storeWrites.incrementAndGet() > 1) {
                    throw new CredentialStoreException("disk full");
                }
                store.storeSession(name, sessionToken);
            }
        };
        accountHandler.delegate = recording(exchange -> {
            exchange.getResponseHeaders().add("X-ADM-Auth-Session", "session-rotated");
            respond(exchange, 200, "{\"server_name\":\"acme-mdm\"}");
        });
        DepClient client = new DepClient(Config.builder()
            .credentialStore(failingOnRotation)
            .baseUrl(baseUri.toString())
            .httpClient(HttpClient.newHttpClient())
            .build());

        CredentialStoreException ex = assertThrows(CredentialStoreException.class, () -> client.account("acme"));

        assertEquals("disk full", ex.getMessage());
        assertEquals(ErrorKind.STORE, ex.getKind());
        assertEquals(2, storeWrites.get());
        assertEquals("session-1", store.session("acme").orElseThrow());
    }

    @Test
    void configurationsKeepSeparateSessions() throws Exception {
        store.putCredentials("globex", new Credentials("ck_g", "cs_g", "at_g", "as_g"));
        DepClient client = newClient(Config.builder());

        client.account("acme");
        client.account("globex");
        client.account("acme");

        assertEquals(2, sessionCalls.get());
        assertEquals("session-1", requests.get(0).sessionHeader);
        assertEquals("session-2", requests.get(1).sessionHeader);
        assertEquals("session-1", requests.get(2).sessionHeader);
    }

    @Test
    void resetSessionForcesNewHandshake() throws Exception {
        DepClient client = newClient(Config.builder());

        client.account("acme");
        client.resetSession("acme");
        client.account("acme");

        assertEquals(2, sessionCalls.get());
        assertEquals("session-2", requests.get(1).sessionHeader);
    }

    private DepClient newClient(Config.Builder builder) {
        return new DepClient(builder
            .credentialStore(store)
            .baseUrl(baseUri.toString())
            .httpClient(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build())
            .build());
    }

    private HttpHandler recording(HttpHandler delegate) {
        return exchange -> {
            byte[] body = exchange.getRequestBody().readAllBytes();
            calls.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            requests.add(new RecordedRequest(
                exchange.getRequestMethod(),
                exchange.getRequestHeaders().getFirst("X-ADM-Auth-Session"),
                exchange.getRequestHeaders().getFirst("X-Server-Protocol-Version"),
                exchange.getRequestHeaders().getFirst("Content-Type"),
                body
            ));
            delegate.handle(exchange);
        };
    }

    private class SessionHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            int call = sessionCalls.incrementAndGet();
            calls.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            respond(exchange, 200, "{\"auth_session_token\":\"session-" + call + "\"}");
        }
    }

    private record RecordedRequest(String method, String sessionHeader, String protocolVersion, String contentType, byte[] body) {
    }

    private static class DelegatingHandler implements HttpHandler {
        volatile HttpHandler delegate;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (delegate == null) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            } else {
                delegate.handle(exchange);
            }
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
