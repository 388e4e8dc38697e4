package io.depkit.sdk.auth;

import io.depkit.sdk.ConfigNotFoundException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process credential store. Contents are lost when the JVM exits.
 */
public final class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, Credentials> credentials = new ConcurrentHashMap<>();
    private final Map<String, String> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> baseUrls = new ConcurrentHashMap<>();

    public InMemoryCredentialStore putCredentials(String name, Credentials value) {
        credentials.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "credentials"));
        return this;
    }

    public InMemoryCredentialStore putBaseUrl(String name, String baseUrl) {
        baseUrls.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(baseUrl, "baseUrl"));
        return this;
    }

    @Override
    public Credentials credentials(String name) throws ConfigNotFoundException {
        Credentials value = credentials.get(name);
        if (value == null) {
            throw new ConfigNotFoundException(name);
        }
        return value;
    }

    @Override
    public Optional<String> session(String name) {
        return Optional.ofNullable(sessions.get(name));
    }

    @Override
    public void storeSession(String name, String sessionToken) {
        Objects.requireNonNull(name, "name");
        if (sessionToken == null) {
            sessions.remove(name);
        } else {
            sessions.put(name, sessionToken);
        }
    }

    @Override
    public Optional<String> baseUrl(String name) {
        return Optional.ofNullable(baseUrls.get(name));
    }
}
