package com.hashicorp.vault.broker.auth;

import com.hashicorp.vault.broker.VaultConfigurationException;

/**
 * Supported Vault authentication methods.
 *
 * <p>Selects the {@link VaultAuthenticator} built from configuration.
 */
public enum AuthMethod {

    /**
     * Pre-issued token passed through as-is.
     */
    TOKEN("token", "token"),

    /**
     * AppRole login with a role ID and secret ID.
     */
    APPROLE("approle", "approle"),

    /**
     * AWS IAM login with a signed STS {@code GetCallerIdentity} request.
     */
    IAM("iam", "aws");

    private final String value;
    private final String defaultMount;

    AuthMethod(String value, String defaultMount) {
        this.value = value;
        this.defaultMount = defaultMount;
    }

    /**
     * Returns the string value used in configuration.
     *
     * @return the configuration value (e.g., "token", "approle", "iam")
     */
    public String getValue() {
        return value;
    }

    /**
     * Returns the path the auth backend is mounted at when none is configured.
     */
    public String getDefaultMount() {
        return defaultMount;
    }

    /**
     * Parses a configuration string to an AuthMethod.
     *
     * @param value the configuration value (case-insensitive)
     * @return the corresponding AuthMethod
     * @throws VaultConfigurationException if the value is not recognized
     */
    public static AuthMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new VaultConfigurationException("Auth method cannot be null or blank");
        }
        for (AuthMethod method : values()) {
            if (method.value.equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        throw new VaultConfigurationException(
                "Invalid auth-method: '" + value + "'. Supported values: token, approle, iam");
    }

    @Override
    public String toString() {
        return value;
    }
}
