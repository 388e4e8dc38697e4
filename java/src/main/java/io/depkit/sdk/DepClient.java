package io.depkit.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JavaType;
import io.depkit.sdk.auth.OAuth1SessionHandshake;
import io.depkit.sdk.auth.OAuth1Signer;
import io.depkit.sdk.auth.SessionManager;
import io.depkit.sdk.internal.Json;
import io.depkit.sdk.internal.RequestExecutor;
import io.depkit.sdk.internal.ResponseDecoder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for the device enrollment (DEP) API. A single instance serves any number of configuration
 * names: each call names the configuration whose credentials, session and server it should use. The client is
 * thread-safe; create one per process and share it.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Sessions are established lazily on the first call for a configuration and cached until the server rejects
 *       them. Concurrent first calls for the same configuration share one handshake.</li>
 *   <li>A request rejected because its session expired is retried exactly once with a new session.</li>
 *   <li>Verb/path pairs come from {@link Config#route(Endpoint)} and can be overridden per deployment. Assign Profile
 *       defaults to {@code PUT} for compatibility with older servers.</li>
 *   <li>Per-device results inside a successful response are returned as data, never raised as errors.</li>
 * </ul>
 */
public final class DepClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(DepClient.class.getName());

    private final Config config;
    private final SessionManager sessions;
    private final RequestExecutor executor;

    /**
     * Constructs a new client.
     *
     * @param config caller-supplied configuration; only the credential store is mandatory.
     */
    public DepClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        ResponseDecoder decoder = new ResponseDecoder(this.config.getExpiryMarkers());
        OAuth1SessionHandshake handshake = new OAuth1SessionHandshake(
            this.config.getHttpClient(),
            this.config.route(Endpoint.SESSION),
            new OAuth1Signer(),
            decoder,
            this.config.getUserAgent(),
            this.config.getHttpTimeout()
        );
        this.sessions = new SessionManager(this.config.getCredentialStore(), handshake, this.config.getBaseUrl());
        this.executor = new RequestExecutor(
            this.config.getHttpClient(),
            this.sessions,
            decoder,
            this.config.getHttpTimeout(),
            this.config.getUserAgent(),
            this.config.getServerProtocolVersion()
        );
    }

    /**
     * Fetches organisation and server details for the configuration.
     */
    public AccountDetail account(String name) throws DepException {
        return call(name, Endpoint.ACCOUNT, "", null, AccountDetail.class);
    }

    /**
     * Defines a new profile with the DEP service. Serial numbers listed in {@link Profile#devices()} are assigned
     * in the same step.
     */
    public DefineProfileResponse defineProfile(String name, Profile profile) throws DepException {
        Objects.requireNonNull(profile, "profile");
        return call(name, Endpoint.DEFINE_PROFILE, "", profile, DefineProfileResponse.class);
    }

    /**
     * Fetches a previously defined profile, including its {@code profile_uuid}.
     */
    public Profile fetchProfile(String name, String profileUuid) throws DepException {
        String uuid = requireValue(profileUuid, "profileUuid");
        String query = "profile_uuid=" + URLEncoder.encode(uuid, StandardCharsets.UTF_8);
        return call(name, Endpoint.FETCH_PROFILE, query, null, Profile.class);
    }

    /**
     * Assigns a profile to a list of serial numbers. The response reports a status per serial number; a device that
     * could not be assigned does not make the call fail.
     */
    public ProfileResponse assignProfile(String name, String profileUuid, String... serials) throws DepException {
        String uuid = requireValue(profileUuid, "profileUuid");
        List<String> devices = serials == null ? List.of() : Arrays.asList(serials);
        return call(name, Endpoint.ASSIGN_PROFILE, "", new AssignProfileRequest(uuid, devices), ProfileResponse.class);
    }

    /**
     * Removes any assigned profile from the given serial numbers.
     */
    public ClearProfileResponse removeProfile(String name, List<String> serials) throws DepException {
        List<String> devices = serials == null ? List.of() : List.copyOf(serials);
        return call(name, Endpoint.REMOVE_PROFILE, "", new DeviceListRequest(devices), ClearProfileResponse.class);
    }

    /**
     * Lists all devices assigned to the server, one page at a time.
     *
     * @param cursor cursor from the previous page, or {@code null} for the first page.
     * @param limit  page size, or {@code null} for the server default.
     */
    public DeviceListResponse fetchDevices(String name, String cursor, Integer limit) throws DepException {
        return call(name, Endpoint.FETCH_DEVICES, "", new CursorRequest(cursor, limit), DeviceListResponse.class);
    }

    /**
     * Lists devices changed since the fetch or sync that returned {@code cursor}.
     */
    public DeviceListResponse syncDevices(String name, String cursor, Integer limit) throws DepException {
        String value = requireValue(cursor, "cursor");
        return call(name, Endpoint.SYNC_DEVICES, "", new CursorRequest(value, limit), DeviceListResponse.class);
    }

    /**
     * Fetches details for specific serial numbers.
     */
    public DeviceDetailsResponse deviceDetails(String name, List<String> serials) throws DepException {
        List<String> devices = serials == null ? List.of() : List.copyOf(serials);
        return call(name, Endpoint.DEVICE_DETAILS, "", new DeviceListRequest(devices), DeviceDetailsResponse.class);
    }

    /**
     * Drops the cached session for a configuration, forcing a handshake on its next call (for example after the
     * server token was renewed out of band).
     */
    public void resetSession(String name) {
        sessions.invalidate(name);
    }

    /**
     * Closes the client. The underlying {@link java.net.http.HttpClient} is owned by the caller or by the JVM, so
     * nothing is released here.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    private <T> T call(String name, Endpoint endpoint, String query, Object body, Class<T> type) throws DepException {
        Route route = config.route(endpoint);
        LOGGER.fine(() -> "[depkit] " + endpoint + " for " + name + " via " + route.method() + " " + route.path());
        JavaType javaType = Json.type(type);
        return executor.execute(name, route.method(), withQuery(route.path(), query), body, javaType);
    }

    static String withQuery(String path, String query) {
        if (query.isEmpty()) {
            return path;
        }
        // route overrides may already carry their own query
        return path + (path.indexOf('?') >= 0 ? "&" : "?") + query;
    }

    private static String requireValue(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }

    record AssignProfileRequest(
        @JsonProperty("profile_uuid") String profileUuid,
        @JsonProperty("devices") List<String> devices
    ) {
    }

    record DeviceListRequest(@JsonProperty("devices") List<String> devices) {
    }

    record CursorRequest(
        @JsonProperty("cursor") String cursor,
        @JsonProperty("limit") Integer limit
    ) {
    }
}
