package com.hashicorp.vault.broker;

/**
 * Argument checks shared by the configuration and authenticator builders.
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class
    }

    /**
     * Validates that a string is neither null nor blank.
     *
     * @param value the value to check
     * @param name  the setting name for the error message
     * @return the value, for chaining in constructors
     * @throws VaultConfigurationException if the value is null or blank
     */
    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new VaultConfigurationException(name + " cannot be null or blank");
        }
        return value;
    }

    /**
     * Returns the value, or null when it is null or blank.
     */
    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
