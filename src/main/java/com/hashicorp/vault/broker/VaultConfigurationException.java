package com.hashicorp.vault.broker;

/**
 * Invalid or missing client configuration, detected when a client or authenticator is
 * built. Never retried.
 */
public class VaultConfigurationException extends IllegalArgumentException {

    public VaultConfigurationException(String message) {
        super(message);
    }

    public VaultConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
