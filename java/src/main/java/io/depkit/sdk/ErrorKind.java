package io.depkit.sdk;

/**
 * Classification carried by every {@link DepException} so callers can branch without instanceof chains.
 */
public enum ErrorKind {
    CONFIG_NOT_FOUND,
    STORE,
    AUTH,
    TRANSPORT,
    PROTOCOL,
    VALIDATION,
    NOT_FOUND,
    SERVER,
    UNKNOWN
}
