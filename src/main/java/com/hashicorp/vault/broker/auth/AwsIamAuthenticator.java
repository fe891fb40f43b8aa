package com.hashicorp.vault.broker.auth;

import com.hashicorp.vault.broker.VaultConfigurationException;
import com.hashicorp.vault.broker.transport.Json;
import com.hashicorp.vault.broker.transport.VaultTransport;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentials;

/**
 * Authenticator for the Vault AWS auth backend, IAM method.
 *
 * <p>Each login resolves AWS credentials, signs an STS {@code GetCallerIdentity} request
 * with them and posts the request, base64 encoded, to {@code /auth/{mount}/login}. Vault
 * replays it against STS to learn the caller's IAM principal and checks it against the
 * configured role.
 *
 * <p>Vault setup:
 * <pre>{@code
 * vault write auth/aws/config/client iam_server_id_header_value=VAULT_ADDR
 * vault write auth/aws/role/my-role auth_type=iam bound_iam_principal_arn=arn:aws:iam::...
 * }</pre>
 *
 * @see <a href="https://developer.hashicorp.com/vault/docs/auth/aws#iam-auth-method">IAM auth method</a>
 */
public class AwsIamAuthenticator implements VaultAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(AwsIamAuthenticator.class);

    private final VaultTransport transport;
    private final AwsIamConfig config;
    private final StsRequestSigner signer;
    private final Executor credentialsExecutor;
    private final Clock clock;

    public AwsIamAuthenticator(VaultTransport transport, AwsIamConfig config) {
        this(transport, config, new StsRequestSigner(), ForkJoinPool.commonPool(), Clock.systemUTC());
    }

    public AwsIamAuthenticator(VaultTransport transport, AwsIamConfig config, Clock clock) {
        this(transport, config, new StsRequestSigner(), ForkJoinPool.commonPool(), clock);
    }

    /**
     * @param transport           the Vault transport
     * @param config              validated IAM settings
     * @param signer              STS request signer
     * @param credentialsExecutor runs credential resolution, which may block on instance metadata
     * @param clock               time source for the token issue time
     */
    AwsIamAuthenticator(VaultTransport transport, AwsIamConfig config, StsRequestSigner signer,
                        Executor credentialsExecutor, Clock clock) {
        if (transport == null) {
            throw new VaultConfigurationException("Transport cannot be null");
        }
        if (config == null) {
            throw new VaultConfigurationException("IAM auth configuration cannot be null");
        }
        this.transport = transport;
        this.config = config;
        this.signer = signer;
        this.credentialsExecutor = credentialsExecutor;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public AuthMethod getAuthMethod() {
        return AuthMethod.IAM;
    }

    @Override
    public CompletableFuture<VaultToken> authenticate() {
        logger.info("Making IAM authentication request: role={}", config.getRole());

        Map<String, String> headers = config.getNamespace() != null
                ? Map.of(VaultTransport.HEADER_VAULT_NAMESPACE, config.getNamespace())
                : Map.of();

        return CompletableFuture
                .supplyAsync(() -> config.getCredentialsProvider().resolveCredentials(), credentialsExecutor)
                .thenCompose(credentials -> transport.request("POST",
                        "/auth/" + config.getMount() + "/login", loginBody(credentials), headers))
                .thenApply(response -> VaultToken.fromAuth(response, clock));
    }

    /**
     * Builds the login payload.
     *
     * @see <a href="https://developer.hashicorp.com/vault/api-docs/auth/aws#login">AWS auth login API</a>
     */
    Map<String, Object> loginBody(AwsCredentials credentials) {
        StsRequestSigner.SignedStsRequest request = signer.sign(credentials, config.getStsEndpoint(),
                config.getSigningRegion(), config.getServerIdHeaderValue());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("iam_http_request_method", request.getMethod());
        body.put("iam_request_headers", base64(Json.write(headersAsLists(request.getHeaders()))));
        body.put("iam_request_body", base64(request.getBody()));
        body.put("iam_request_url", base64(request.getUrl()));
        body.put("role", config.getRole());
        return body;
    }

    /**
     * Vault decodes the headers into Go's {@code http.Header}, a map of string lists.
     *
     * @see <a href="https://github.com/hashicorp/vault/issues/2810">vault#2810</a>
     */
    static Map<String, List<String>> headersAsLists(Map<String, String> headers) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        headers.forEach((name, value) -> result.put(name, List.of(value)));
        return result;
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    public AwsIamConfig getConfig() {
        return config;
    }
}
