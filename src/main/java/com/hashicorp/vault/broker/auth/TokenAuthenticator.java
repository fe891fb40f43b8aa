package com.hashicorp.vault.broker.auth;

import com.hashicorp.vault.broker.MalformedResponseException;
import com.hashicorp.vault.broker.Preconditions;
import com.hashicorp.vault.broker.VaultConfigurationException;
import com.hashicorp.vault.broker.transport.VaultResponse;
import com.hashicorp.vault.broker.transport.VaultTransport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticator for a pre-issued Vault token.
 *
 * <p>The token itself never changes. What {@link #authenticate()} produces is the token
 * with current lease metadata, obtained in one of three ways:
 * <ul>
 *   <li>a fixed TTL is configured: the metadata is synthesized and no request is made</li>
 *   <li>{@code renewSelf} is enabled: {@code POST /auth/{mount}/renew-self} extends the
 *       lease and returns the new one</li>
 *   <li>otherwise: {@code GET /auth/{mount}/lookup-self} reports the remaining TTL</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@code VAULT_TOKEN} - Environment variable containing the token</li>
 *   <li>{@code VAULT_TOKEN_FILE} or {@code token-path} - Path to file containing token</li>
 * </ul>
 *
 * @see VaultAuthenticator
 * @see AppRoleAuthenticator
 */
public class TokenAuthenticator implements VaultAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(TokenAuthenticator.class);

    private final VaultTransport transport;
    private final String token;
    private final String tokenSource;
    private final String mount;
    private final Duration fixedTtl;
    private final boolean renewable;
    private final boolean renewSelf;
    private final Clock clock;

    /**
     * Creates a TokenAuthenticator that looks up lease metadata from Vault.
     *
     * @param transport   the Vault transport
     * @param token       the Vault token
     * @param tokenSource description of where the token came from (for logging)
     */
    public TokenAuthenticator(VaultTransport transport, String token, String tokenSource) {
        this(transport, token, tokenSource, null, null, false, false, Clock.systemUTC());
    }

    /**
     * @param transport   the Vault transport
     * @param token       the Vault token
     * @param tokenSource description of where the token came from (for logging)
     * @param mount       token auth mount, or null for {@code token}
     * @param fixedTtl    known TTL (zero for non-expiring), or null to ask Vault
     * @param renewable   whether a token with a fixed TTL is renewable
     * @param renewSelf   renew the token instead of only looking it up
     * @param clock       time source for the token issue time
     */
    public TokenAuthenticator(VaultTransport transport, String token, String tokenSource,
                              String mount, Duration fixedTtl, boolean renewable,
                              boolean renewSelf, Clock clock) {
        Preconditions.requireNonBlank(token, "Token");
        if (fixedTtl != null && fixedTtl.isNegative()) {
            throw new VaultConfigurationException("Token TTL cannot be negative: " + fixedTtl);
        }
        if (fixedTtl == null && transport == null) {
            throw new VaultConfigurationException("Transport is required unless a fixed token TTL is set");
        }
        this.transport = transport;
        this.token = token;
        this.tokenSource = tokenSource;
        this.mount = mount != null && !mount.isBlank() ? mount : AuthMethod.TOKEN.getDefaultMount();
        this.fixedTtl = fixedTtl;
        this.renewable = renewable;
        this.renewSelf = renewSelf;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Resolves the token from an environment variable or file.
     *
     * <p>Resolution order:
     * <ol>
     *   <li>Environment variable (if envVarName is provided and set)</li>
     *   <li>Token file at specified path</li>
     * </ol>
     *
     * @param envVarName    environment variable name (e.g., "VAULT_TOKEN"), or null to skip env check
     * @param tokenFilePath fallback token file path, or null
     * @param environment   environment lookup, usually {@code System::getenv}
     * @return the token and a description of its source
     * @throws VaultConfigurationException if no token source is available
     */
    public static ResolvedToken resolve(String envVarName, String tokenFilePath,
                                        Function<String, String> environment) {
        if (envVarName != null && !envVarName.isBlank()) {
            String envToken = environment.apply(envVarName);
            if (envToken != null && !envToken.isBlank()) {
                return new ResolvedToken(envToken.trim(), envVarName + " environment variable");
            }
        }

        if (tokenFilePath != null && !tokenFilePath.isBlank()) {
            String fileToken;
            try {
                fileToken = Files.readString(Path.of(tokenFilePath)).trim();
            } catch (IOException e) {
                throw new VaultConfigurationException("Cannot read token file: " + tokenFilePath, e);
            }
            if (fileToken.isBlank()) {
                throw new VaultConfigurationException("Token file is empty: " + tokenFilePath);
            }
            return new ResolvedToken(fileToken, "token file: " + tokenFilePath);
        }

        if (envVarName != null && !envVarName.isBlank()) {
            throw new VaultConfigurationException(
                    "No Vault token found. Set " + envVarName + " environment variable " +
                            "or provide a token file path.");
        }
        throw new VaultConfigurationException("No Vault token found. Provide a token file path.");
    }

    @Override
    public AuthMethod getAuthMethod() {
        return AuthMethod.TOKEN;
    }

    @Override
    public CompletableFuture<VaultToken> authenticate() {
        if (fixedTtl != null) {
            logger.debug("Using token from {} with configured TTL of {}s", tokenSource, fixedTtl.getSeconds());
            return CompletableFuture.completedFuture(
                    new VaultToken(token, fixedTtl, renewable, clock.instant()));
        }

        Map<String, String> headers = Map.of(VaultTransport.HEADER_VAULT_TOKEN, token);
        if (renewSelf) {
            logger.debug("Renewing token from {}", tokenSource);
            return transport.request("POST", "/auth/" + mount + "/renew-self", Map.of(), headers)
                    .thenApply(response -> VaultToken.fromAuth(response, clock));
        }

        logger.debug("Looking up token from {}", tokenSource);
        return transport.request("GET", "/auth/" + mount + "/lookup-self", null, headers)
                .thenApply(this::fromLookup);
    }

    private VaultToken fromLookup(VaultResponse response) {
        Map<String, Object> data = response.getData();
        if (data == null) {
            throw new MalformedResponseException("Token lookup response missing 'data' field",
                    response.getStatus());
        }
        long ttl = response.getDataLong("ttl", 0L);
        if (ttl < 0) {
            throw new MalformedResponseException("Token lookup response has negative 'ttl': " + ttl,
                    response.getStatus());
        }
        return new VaultToken(token, Duration.ofSeconds(ttl),
                Boolean.TRUE.equals(data.get("renewable")), clock.instant());
    }

    /**
     * Returns a description of the token source (for logging).
     *
     * @return the token source description
     */
    public String getTokenSource() {
        return tokenSource;
    }

    public String getMount() {
        return mount;
    }

    /**
     * A token read from the environment or a file, with where it came from.
     */
    public static final class ResolvedToken {
        private final String token;
        private final String source;

        ResolvedToken(String token, String source) {
            this.token = token;
            this.source = source;
        }

        public String getToken() {
            return token;
        }

        public String getSource() {
            return source;
        }
    }
}
