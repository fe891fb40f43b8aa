package com.hashicorp.vault.broker;

import com.hashicorp.vault.broker.auth.VaultToken;
import com.hashicorp.vault.broker.auth.VaultTokenManager;
import com.hashicorp.vault.broker.transport.VaultTransport;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes Vault secrets with a token from a {@link VaultTokenManager}.
 *
 * <p>Every call fetches a token (usually a cache hit) and then issues exactly one
 * request. The request is sent only after the token is available; an authentication
 * failure completes the call with an {@link AuthenticationException} and nothing is
 * sent. Transport failures are returned as they are, without retries.
 *
 * <p>Paths are relative to the API version prefix, e.g. {@code secret/app} or
 * {@code database/creds/readonly}.
 */
public class VaultSecretClient {

    private static final Logger logger = LoggerFactory.getLogger(VaultSecretClient.class);

    private final VaultTokenManager tokenManager;
    private final VaultTransport transport;

    public VaultSecretClient(VaultTokenManager tokenManager, VaultTransport transport) {
        if (tokenManager == null || transport == null) {
            throw new IllegalArgumentException("Token manager and transport are required");
        }
        this.tokenManager = tokenManager;
        this.transport = transport;
    }

    /**
     * Reads a secret.
     *
     * @param path secret path
     * @return a future completed with the secret and its lease metadata
     */
    public CompletableFuture<Lease> read(String path) {
        requirePath(path);
        return tokenManager.getAuthToken()
                .thenCompose(token -> {
                    logger.debug("Reading secret at {}", path);
                    return transport.request("GET", path, null, authorization(token));
                })
                .thenApply(Lease::fromResponse);
    }

    /**
     * Writes a secret. The response body, if any, is discarded.
     *
     * @param path secret path
     * @param data secret payload, sent as the JSON request body
     * @return a future completed with null once Vault accepted the write
     */
    public CompletableFuture<Void> write(String path, Map<String, Object> data) {
        requirePath(path);
        Map<String, Object> body = data != null ? data : Map.of();
        return tokenManager.getAuthToken()
                .thenCompose(token -> {
                    logger.debug("Writing secret at {}", path);
                    return transport.request("POST", path, body, authorization(token));
                })
                .thenApply(response -> null);
    }

    private static Map<String, String> authorization(VaultToken token) {
        return Map.of(VaultTransport.HEADER_VAULT_TOKEN, token.getId());
    }

    private static void requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Secret path cannot be null or blank");
        }
    }

    public VaultTokenManager getTokenManager() {
        return tokenManager;
    }
}
