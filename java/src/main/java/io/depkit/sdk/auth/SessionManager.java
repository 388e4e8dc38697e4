package io.depkit.sdk.auth;

import io.depkit.sdk.Config;
import io.depkit.sdk.CredentialStoreException;
import io.depkit.sdk.DepException;
import io.depkit.sdk.DepTransportException;
import io.depkit.sdk.ErrorKind;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * Owns the per-configuration session tokens.
 *
 * <p>
 * Tokens are cached until the server rejects them; the DEP service publishes no lifetime, so nothing here expires a
 * token on its own. When several threads need a session for the same configuration at once, the first one performs
 * the handshake and the others wait on its {@link CompletableFuture}, so a burst of callers costs one handshake.
 * Configurations never share a lock.
 * </p>
 */
public final class SessionManager {

    private static final Logger LOGGER = Logger.getLogger(SessionManager.class.getName());

    private final CredentialStore store;
    private final SessionHandshake handshake;
    private final String defaultBaseUrl;

    private final Map<String, String> sessions = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, String> rejected = new ConcurrentHashMap<>();

    public SessionManager(CredentialStore store, SessionHandshake handshake, String defaultBaseUrl) {
        this.store = Objects.requireNonNull(store, "store");
        this.handshake = Objects.requireNonNull(handshake, "handshake");
        this.defaultBaseUrl = Config.sanitizeUrl(defaultBaseUrl);
    }

    /**
     * Returns the session token for {@code name}, authenticating first when none is cached.
     *
     * @throws DepException when credentials cannot be loaded or the handshake fails. Every caller waiting on the same
     *                      handshake receives the same failure.
     */
    public String ensureSession(String name) throws DepException {
        requireName(name);
        String cached = sessions.get(name);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<String> attempt = new CompletableFuture<>();
        CompletableFuture<String> existing = inFlight.putIfAbsent(name, attempt);
        if (existing != null) {
            return await(name, existing);
        }

        try {
            String token = sessions.get(name);
            if (token == null) {
                token = loadOrAuthenticate(name);
                sessions.put(name, token);
            }
            attempt.complete(token);
            return token;
        } catch (DepException | RuntimeException ex) {
            attempt.completeExceptionally(ex);
            throw ex;
        } finally {
            if (!attempt.isDone()) {
                attempt.completeExceptionally(new IllegalStateException("session attempt for " + name + " aborted"));
            }
            inFlight.remove(name, attempt);
        }
    }

    /**
     * Drops the cached token for {@code name}. The next {@link #ensureSession(String)} performs a handshake; a copy of
     * the dropped token still sitting in the credential store is not reused.
     */
    public void invalidate(String name) {
        requireName(name);
        String dropped = sessions.remove(name);
        if (dropped != null) {
            rejected.put(name, dropped);
        }
        LOGGER.fine(() -> "[depkit] session for " + name + " invalidated");
    }

    /**
     * Replaces the cached token with one the server handed back on a regular response.
     */
    public void rotate(String name, String token) throws CredentialStoreException {
        requireName(name);
        if (token == null || token.isBlank()) {
            return;
        }
        String previous = sessions.get(name);
        if (previous == null || token.equals(previous)) {
            return;
        }
        if (sessions.replace(name, previous, token)) {
            LOGGER.fine(() -> "[depkit] server rotated session for " + name);
            store.storeSession(name, token);
        }
    }

    /**
     * @return the server URL for {@code name}: the store's value when present, otherwise the client default.
     * @throws CredentialStoreException when the store cannot be read or holds a URL without scheme and host.
     */
    public String baseUrl(String name) throws CredentialStoreException {
        requireName(name);
        Optional<String> stored = store.baseUrl(name);
        if (stored.isEmpty()) {
            return defaultBaseUrl;
        }
        try {
            return Config.sanitizeUrl(stored.get());
        } catch (IllegalArgumentException ex) {
            throw new CredentialStoreException("stored base URL for " + name + " is unusable: " + ex.getMessage(), ex);
        }
    }

    private String loadOrAuthenticate(String name) throws DepException {
        Optional<String> persisted = store.session(name);
        String stale = rejected.get(name);
        if (persisted.isPresent() && !persisted.get().isBlank() && !persisted.get().equals(stale)) {
            LOGGER.fine(() -> "[depkit] reusing stored session for " + name);
            return persisted.get();
        }

        Credentials credentials = store.credentials(name);
        String baseUrl = baseUrl(name);
        LOGGER.fine(() -> "[depkit] authenticating " + name + " against " + baseUrl);
        String token = handshake.authenticate(name, credentials, baseUrl);
        store.storeSession(name, token);
        rejected.remove(name);
        return token;
    }

    private static String await(String name, CompletableFuture<String> attempt) throws DepException {
        try {
            return attempt.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DepTransportException("waiting for session " + name + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof DepException) {
                throw (DepException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new DepException(ErrorKind.UNKNOWN, "session for " + name + " failed: " + cause, cause);
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("configuration name is required");
        }
    }
}
