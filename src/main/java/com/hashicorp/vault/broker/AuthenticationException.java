package com.hashicorp.vault.broker;

/**
 * Obtaining a Vault token failed.
 *
 * <p>Raised to every caller waiting on the same token refresh. The cause holds the
 * underlying failure (rejected credentials, transport error, malformed login
 * response). The token manager does not cache anything after this error, so the next
 * request starts a fresh login.
 */
public class AuthenticationException extends VaultException {

    public AuthenticationException(String message, Throwable cause) {
        super(message, statusOf(cause), cause);
    }

    private static int statusOf(Throwable cause) {
        return cause instanceof VaultException ? ((VaultException) cause).getHttpStatusCode() : 0;
    }
}
