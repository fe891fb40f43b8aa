package com.hashicorp.vault.broker;

/**
 * A Vault response was not JSON or lacked a field the client depends on.
 */
public class MalformedResponseException extends VaultException {

    public MalformedResponseException(String message) {
        super(message, 0);
    }

    public MalformedResponseException(String message, int httpStatusCode) {
        super(message, httpStatusCode);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, 0, cause);
    }
}
