package com.hashicorp.vault.broker.auth;

import java.util.concurrent.CompletableFuture;

/**
 * Strategy for obtaining a Vault token with one auth method.
 *
 * <p>Implementations perform a single login (or lookup) per call and never cache the
 * result: caching, expiry checks and coordination of concurrent callers belong to
 * {@link VaultTokenManager}, which calls {@link #authenticate()} whenever it needs a
 * fresh token.
 *
 * <p>Configuration is validated when the authenticator is constructed. Failures
 * discovered later (rejected credentials, network errors, malformed responses) complete
 * the returned future exceptionally.
 *
 * <h2>Implementing New Auth Methods</h2>
 * <ol>
 *   <li>Add a constant to {@link AuthMethod}</li>
 *   <li>Create a class implementing this interface that posts to
 *       {@code /auth/{mount}/login} and parses the result with
 *       {@link VaultToken#fromAuth}</li>
 *   <li>Wire it in {@code VaultClientFactory}</li>
 * </ol>
 *
 * @see TokenAuthenticator
 * @see AppRoleAuthenticator
 * @see AwsIamAuthenticator
 */
public interface VaultAuthenticator {

    /**
     * Returns the authentication method used by this authenticator.
     *
     * <p>Used for logging and configuration matching.
     *
     * @return the auth method
     */
    AuthMethod getAuthMethod();

    /**
     * Obtains a new token.
     *
     * @return a future completed with the token, or exceptionally with a
     *         {@link com.hashicorp.vault.broker.VaultException} or
     *         {@link com.hashicorp.vault.broker.VaultConfigurationException}
     */
    CompletableFuture<VaultToken> authenticate();
}
