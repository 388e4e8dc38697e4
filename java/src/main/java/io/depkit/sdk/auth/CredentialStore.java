package io.depkit.sdk.auth;

import io.depkit.sdk.ConfigNotFoundException;
import io.depkit.sdk.CredentialStoreException;

import java.util.Optional;

/**
 * Storage contract for per-configuration credentials and session tokens. Implementations must be linearizable per
 * configuration name; the SDK performs no locking around these calls beyond its own session cache.
 */
public interface CredentialStore {

    /**
     * @throws ConfigNotFoundException when nothing is stored under {@code name}.
     * @throws CredentialStoreException when the backend cannot be read.
     */
    Credentials credentials(String name) throws ConfigNotFoundException, CredentialStoreException;

    Optional<String> session(String name) throws CredentialStoreException;

    void storeSession(String name, String sessionToken) throws CredentialStoreException;

    /**
     * Per-configuration server URL. Empty means the client's default base URL applies.
     */
    default Optional<String> baseUrl(String name) throws CredentialStoreException {
        return Optional.empty();
    }
}
