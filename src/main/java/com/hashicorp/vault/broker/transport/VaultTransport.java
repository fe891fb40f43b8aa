package com.hashicorp.vault.broker.transport;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Request primitive used by authenticators and the secret client to reach Vault.
 *
 * <p>Paths are relative to the API version prefix, for example
 * {@code /auth/approle/login} or {@code secret/app}. Implementations own TLS,
 * timeouts and connection handling; callers never retry.
 *
 * <p>The returned future completes exceptionally with a
 * {@link com.hashicorp.vault.broker.TransportException} when the request fails or the
 * server answers with an error status, and with a
 * {@link com.hashicorp.vault.broker.MalformedResponseException} when a successful
 * response body cannot be parsed.
 */
public interface VaultTransport {

    String HEADER_VAULT_TOKEN = "X-Vault-Token";
    String HEADER_VAULT_NAMESPACE = "X-Vault-Namespace";

    /**
     * Sends one request to Vault.
     *
     * @param method  HTTP method, e.g. {@code GET} or {@code POST}
     * @param path    API path relative to the version prefix
     * @param body    JSON body, or null for none
     * @param headers extra request headers (token, namespace), never null
     * @return the parsed response
     */
    CompletableFuture<VaultResponse> request(String method, String path,
                                             Map<String, Object> body, Map<String, String> headers);
}
