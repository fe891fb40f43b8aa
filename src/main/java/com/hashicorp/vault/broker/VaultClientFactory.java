package com.hashicorp.vault.broker;

import com.hashicorp.vault.broker.auth.AppRoleAuthenticator;
import com.hashicorp.vault.broker.auth.AwsIamAuthenticator;
import com.hashicorp.vault.broker.auth.AwsIamConfig;
import com.hashicorp.vault.broker.auth.TokenAuthenticator;
import com.hashicorp.vault.broker.auth.VaultAuthenticator;
import com.hashicorp.vault.broker.auth.VaultTokenManager;
import com.hashicorp.vault.broker.transport.HttpVaultTransport;
import com.hashicorp.vault.broker.transport.VaultTransport;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link VaultSecretClient} with its transport, authenticator and token manager.
 *
 * <p>Every call returns a new client that owns its token cache; nothing is shared
 * between clients.
 */
public final class VaultClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(VaultClientFactory.class);

    private VaultClientFactory() {
        // Utility class
    }

    /**
     * Creates a client talking to the configured Vault server.
     *
     * @throws VaultConfigurationException if the token or secret source cannot be resolved
     */
    public static VaultSecretClient create(VaultClientConfig config) {
        VaultTransport transport = new HttpVaultTransport(config.getVaultAddr(), config.getApiVersion(),
                config.getNamespace(), null, config.getRequestTimeout());
        return create(config, transport, Clock.systemUTC());
    }

    /**
     * Creates a client over an existing transport.
     *
     * @param config    resolved configuration
     * @param transport transport to Vault
     * @param clock     time source shared by the authenticator and the token manager
     */
    public static VaultSecretClient create(VaultClientConfig config, VaultTransport transport, Clock clock) {
        VaultAuthenticator authenticator = createAuthenticator(config, transport, clock);
        VaultTokenManager tokenManager = new VaultTokenManager(authenticator, clock, config.getSafetyMargin());

        logger.info("Vault client created. Vault: {}, NS: {}, Auth: {}, Mount: {}",
                config.getVaultAddr(), config.getNamespace() != null ? config.getNamespace() : "(root)",
                config.getAuthMethod(), config.getAuthMount());
        return new VaultSecretClient(tokenManager, transport);
    }

    /**
     * Builds the authenticator selected by {@link VaultClientConfig#getAuthMethod()}.
     */
    public static VaultAuthenticator createAuthenticator(VaultClientConfig config, VaultTransport transport,
                                                         Clock clock) {
        switch (config.getAuthMethod()) {
            case TOKEN:
                return createTokenAuthenticator(config, transport, clock);
            case APPROLE:
                return AppRoleAuthenticator.builder(transport)
                        .environment(config.getEnvironment())
                        .roleId(config.getAppRoleId())
                        .secretFromFileOrEnvironment(config.getAppRoleSecretFile(),
                                VaultClientConfig.ENV_VAULT_SECRET_ID)
                        .mount(config.getAuthMount())
                        .namespace(config.getNamespace())
                        .clock(clock)
                        .build();
            case IAM:
                AwsIamConfig iamConfig = AwsIamConfig.builder()
                        .role(config.getIamRole())
                        .mount(config.getAuthMount())
                        .namespace(config.getNamespace())
                        .serverIdHeaderValue(config.getIamServerIdHeaderValue())
                        .region(config.getAwsRegion())
                        .stsEndpoint(config.getStsEndpoint())
                        .credentials(config.getAwsCredentials())
                        .build();
                return new AwsIamAuthenticator(transport, iamConfig, clock);
            default:
                throw new VaultConfigurationException("Unsupported auth method: " + config.getAuthMethod());
        }
    }

    private static TokenAuthenticator createTokenAuthenticator(VaultClientConfig config, VaultTransport transport,
                                                               Clock clock) {
        String token = config.getToken();
        String tokenSource = VaultClientConfig.PARAM_TOKEN + " parameter";
        if (token == null) {
            TokenAuthenticator.ResolvedToken resolved = TokenAuthenticator.resolve(
                    VaultClientConfig.ENV_VAULT_TOKEN, config.getTokenPath(), config.getEnvironment());
            token = resolved.getToken();
            tokenSource = resolved.getSource();
        }
        return new TokenAuthenticator(transport, token, tokenSource, config.getAuthMount(),
                config.getTokenTtl(), false, config.isTokenRenewSelf(), clock);
    }
}
