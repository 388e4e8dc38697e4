package io.depkit.sdk.auth;

import io.depkit.sdk.DepException;

/**
 * Exchanges long-lived credentials for a DEP session token.
 */
public interface SessionHandshake {

    String authenticate(String name, Credentials credentials, String baseUrl) throws DepException;
}
