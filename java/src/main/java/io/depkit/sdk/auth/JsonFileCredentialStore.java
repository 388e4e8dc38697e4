package io.depkit.sdk.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.depkit.sdk.ConfigNotFoundException;
import io.depkit.sdk.CredentialStoreException;
import io.depkit.sdk.internal.Json;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Credential store keeping one JSON document per configuration name ({@code <dir>/<name>.json}).
 *
 * <p>
 * Reads and writes for the same name are serialised on a per-name monitor, and writes go through a temporary file
 * followed by a move so readers never observe a half-written document.
 * </p>
 */
public final class JsonFileCredentialStore implements CredentialStore {

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public JsonFileCredentialStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public Credentials credentials(String name) throws ConfigNotFoundException, CredentialStoreException {
        Credentials credentials = read(name).map(Entry::credentials).orElse(null);
        if (credentials == null) {
            throw new ConfigNotFoundException(name);
        }
        return credentials;
    }

    @Override
    public Optional<String> session(String name) throws CredentialStoreException {
        return read(name).map(Entry::sessionToken).filter(token -> !token.isBlank());
    }

    @Override
    public void storeSession(String name, String sessionToken) throws CredentialStoreException {
        synchronized (lockFor(name)) {
            Entry current = read(name).orElse(new Entry(null, null, null));
            write(name, new Entry(current.credentials(), sessionToken, current.baseUrl()));
        }
    }

    @Override
    public Optional<String> baseUrl(String name) throws CredentialStoreException {
        return read(name).map(Entry::baseUrl).filter(url -> !url.isBlank());
    }

    /**
     * Stores credentials (and optionally a server URL) for {@code name}, keeping any cached session token.
     */
    public void putCredentials(String name, Credentials credentials, String baseUrl) throws CredentialStoreException {
        Objects.requireNonNull(credentials, "credentials");
        synchronized (lockFor(name)) {
            Entry current = read(name).orElse(new Entry(null, null, null));
            write(name, new Entry(credentials, current.sessionToken(), baseUrl));
        }
    }

    private Optional<Entry> read(String name) throws CredentialStoreException {
        Path file = fileFor(name);
        synchronized (lockFor(name)) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try {
                return Optional.of(Json.mapper().readValue(file.toFile(), Entry.class));
            } catch (IOException ex) {
                throw new CredentialStoreException("read " + file + ": " + ex.getMessage(), ex);
            }
        }
    }

    private void write(String name, Entry entry) throws CredentialStoreException {
        Path file = fileFor(name);
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, name, ".tmp");
            Json.mapper().writeValue(temp.toFile(), entry);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new CredentialStoreException("write " + file + ": " + ex.getMessage(), ex);
        }
    }

    private Path fileFor(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("configuration name not usable as a file name: " + name);
        }
        return directory.resolve(name + ".json");
    }

    private Object lockFor(String name) {
        return locks.computeIfAbsent(name, key -> new Object());
    }

    record Entry(
        @JsonProperty("credentials") Credentials credentials,
        @JsonProperty("session_token") String sessionToken,
        @JsonProperty("base_url") String baseUrl
    ) {
    }
}
