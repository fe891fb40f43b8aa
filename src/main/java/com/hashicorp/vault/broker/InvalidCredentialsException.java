package com.hashicorp.vault.broker;

/**
 * Explicit AWS credentials in the IAM auth configuration are incomplete or have the
 * wrong shape.
 */
public class InvalidCredentialsException extends VaultConfigurationException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
