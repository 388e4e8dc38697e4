package io.depkit.sdk;

/**
 * Raised when the credential store holds no credentials for a configuration name.
 */
public final class ConfigNotFoundException extends DepException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public ConfigNotFoundException(String name) {
        super(ErrorKind.CONFIG_NOT_FOUND, "no DEP configuration named " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
