package io.depkit.sdk;

/**
 * Raised when the credential store backend cannot be read or written.
 */
public final class CredentialStoreException extends DepException {

    private static final long serialVersionUID = 1L;

    public CredentialStoreException(String message) {
        super(ErrorKind.STORE, message);
    }

    public CredentialStoreException(String message, Throwable cause) {
        super(ErrorKind.STORE, message, cause);
    }
}
