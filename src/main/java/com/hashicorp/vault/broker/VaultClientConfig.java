package com.hashicorp.vault.broker;

import com.hashicorp.vault.broker.auth.AuthMethod;
import com.hashicorp.vault.broker.auth.AwsIamConfig;
import com.hashicorp.vault.broker.auth.VaultTokenManager;
import com.hashicorp.vault.broker.transport.HttpVaultTransport;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentials;

/**
 * Client settings resolved from parameters and the environment.
 *
 * <p>Each setting is resolved in order: parameter, environment variable, default. The
 * standard Vault environment variables are honoured:
 * <ul>
 *   <li>{@code VAULT_ADDR} - Vault server address (required)</li>
 *   <li>{@code VAULT_NAMESPACE} - Vault namespace (Vault Enterprise only)</li>
 *   <li>{@code VAULT_TOKEN} - Vault token for token authentication</li>
 *   <li>{@code VAULT_TOKEN_FILE} - Path to file containing Vault token</li>
 *   <li>{@code VAULT_ROLE_ID} - AppRole role ID</li>
 *   <li>{@code VAULT_SECRET_ID} - AppRole secret ID</li>
 *   <li>{@code VAULT_SECRET_ID_FILE} - Path to file containing AppRole secret ID</li>
 *   <li>{@code AWS_REGION} - STS signing region for IAM authentication</li>
 * </ul>
 *
 * <p>Validation happens here; a config that builds is one the factory can turn into a
 * client without further checks, apart from the presence of the token or secret
 * sources themselves.
 */
public final class VaultClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(VaultClientConfig.class);

    // Environment variable names (standard Vault naming)
    public static final String ENV_VAULT_ADDR = "VAULT_ADDR";
    public static final String ENV_VAULT_NAMESPACE = "VAULT_NAMESPACE";
    public static final String ENV_VAULT_TOKEN = "VAULT_TOKEN";
    public static final String ENV_VAULT_TOKEN_FILE = "VAULT_TOKEN_FILE";
    public static final String ENV_VAULT_ROLE_ID = "VAULT_ROLE_ID";
    public static final String ENV_VAULT_SECRET_ID = "VAULT_SECRET_ID";
    public static final String ENV_VAULT_SECRET_ID_FILE = "VAULT_SECRET_ID_FILE";
    public static final String ENV_AWS_REGION = "AWS_REGION";

    // Parameter names
    public static final String PARAM_VAULT_ADDR = "vault-addr";
    public static final String PARAM_API_VERSION = "api-version";
    public static final String PARAM_NAMESPACE = "namespace";
    public static final String PARAM_REQUEST_TIMEOUT_SECONDS = "request-timeout-seconds";
    public static final String PARAM_AUTH_METHOD = "auth-method";
    public static final String PARAM_AUTH_MOUNT = "auth-mount";
    public static final String PARAM_SAFETY_MARGIN_SECONDS = "token-safety-margin-seconds";
    public static final String PARAM_TOKEN = "token";
    public static final String PARAM_TOKEN_PATH = "token-path";
    public static final String PARAM_TOKEN_TTL_SECONDS = "token-ttl-seconds";
    public static final String PARAM_TOKEN_RENEW_SELF = "token-renew-self";
    public static final String PARAM_APPROLE_ID = "approle-id";
    public static final String PARAM_APPROLE_SECRET_FILE = "approle-secret-file";
    public static final String PARAM_IAM_ROLE = "iam-role";
    public static final String PARAM_IAM_SERVER_ID_HEADER_VALUE = "iam-server-id-header-value";
    public static final String PARAM_AWS_CREDENTIALS = "aws-credentials";
    public static final String PARAM_AWS_REGION = "aws-region";
    public static final String PARAM_STS_ENDPOINT = "sts-endpoint";

    private static final String DEFAULT_AUTH_METHOD = "token";
    private static final long DEFAULT_REQUEST_TIMEOUT_SECONDS =
            HttpVaultTransport.DEFAULT_REQUEST_TIMEOUT.getSeconds();
    private static final long DEFAULT_SAFETY_MARGIN_SECONDS =
            VaultTokenManager.DEFAULT_SAFETY_MARGIN.getSeconds();

    private final String vaultAddr;
    private final String apiVersion;
    private final String namespace;
    private final Duration requestTimeout;
    private final AuthMethod authMethod;
    private final String authMount;
    private final Duration safetyMargin;
    private final String token;
    private final String tokenPath;
    private final Duration tokenTtl;
    private final boolean tokenRenewSelf;
    private final String appRoleId;
    private final String appRoleSecretFile;
    private final String iamRole;
    private final String iamServerIdHeaderValue;
    private final AwsCredentials awsCredentials;
    private final String awsRegion;
    private final String stsEndpoint;
    private final Function<String, String> environment;

    private VaultClientConfig(Map<String, ?> params, Function<String, String> environment) {
        this.environment = environment;

        vaultAddr = getConfig(params, PARAM_VAULT_ADDR, ENV_VAULT_ADDR, null);
        if (vaultAddr == null) {
            throw new VaultConfigurationException(
                    "Missing required configuration: Vault address. "
                            + "Set " + ENV_VAULT_ADDR + " environment variable or "
                            + PARAM_VAULT_ADDR + " parameter.");
        }
        apiVersion = getConfig(params, PARAM_API_VERSION, null, HttpVaultTransport.DEFAULT_API_VERSION);

        namespace = getConfig(params, PARAM_NAMESPACE, ENV_VAULT_NAMESPACE, null);
        if (namespace != null) {
            logger.debug("Using Vault namespace: {}", namespace);
        }

        requestTimeout = Duration.ofSeconds(parseSeconds(params, PARAM_REQUEST_TIMEOUT_SECONDS,
                DEFAULT_REQUEST_TIMEOUT_SECONDS, false));
        safetyMargin = Duration.ofSeconds(parseSeconds(params, PARAM_SAFETY_MARGIN_SECONDS,
                DEFAULT_SAFETY_MARGIN_SECONDS, true));

        authMethod = AuthMethod.fromValue(getConfig(params, PARAM_AUTH_METHOD, null, DEFAULT_AUTH_METHOD));
        authMount = getConfig(params, PARAM_AUTH_MOUNT, null, authMethod.getDefaultMount());

        // Token auth
        token = getConfig(params, PARAM_TOKEN, null, null);
        tokenPath = getConfig(params, PARAM_TOKEN_PATH, ENV_VAULT_TOKEN_FILE, null);
        // Blank counts as unset, so the lease comes from lookup-self
        tokenTtl = getConfig(params, PARAM_TOKEN_TTL_SECONDS, null, null) != null
                ? Duration.ofSeconds(parseSeconds(params, PARAM_TOKEN_TTL_SECONDS, 0, true))
                : null;
        tokenRenewSelf = Boolean.parseBoolean(getConfig(params, PARAM_TOKEN_RENEW_SELF, null, "false"));

        // AppRole auth
        appRoleId = getConfig(params, PARAM_APPROLE_ID, ENV_VAULT_ROLE_ID, null);
        appRoleSecretFile = getConfig(params, PARAM_APPROLE_SECRET_FILE, ENV_VAULT_SECRET_ID_FILE, null);

        // IAM auth
        iamRole = getConfig(params, PARAM_IAM_ROLE, null, null);
        iamServerIdHeaderValue = getConfig(params, PARAM_IAM_SERVER_ID_HEADER_VALUE, null, null);
        awsCredentials = AwsIamConfig.parseCredentials(params.get(PARAM_AWS_CREDENTIALS));
        awsRegion = getConfig(params, PARAM_AWS_REGION, ENV_AWS_REGION, AwsIamConfig.DEFAULT_REGION);
        stsEndpoint = getConfig(params, PARAM_STS_ENDPOINT, null, null);

        validateAuthSettings();
    }

    /**
     * Resolves configuration from parameters and the process environment.
     *
     * @param params configuration parameters; values are strings except
     *               {@code aws-credentials}, which is a map
     * @return the validated configuration
     * @throws VaultConfigurationException if a setting is missing or invalid
     */
    public static VaultClientConfig fromParams(Map<String, ?> params) {
        return fromParams(params, System::getenv);
    }

    /**
     * Resolves configuration from parameters and the given environment lookup.
     */
    public static VaultClientConfig fromParams(Map<String, ?> params, Function<String, String> environment) {
        return new VaultClientConfig(params != null ? params : Map.of(), environment);
    }

    private void validateAuthSettings() {
        switch (authMethod) {
            case TOKEN:
                if (token == null && tokenPath == null && environment.apply(ENV_VAULT_TOKEN) == null) {
                    throw new VaultConfigurationException(
                            "Token authentication requires a token. Set " + ENV_VAULT_TOKEN + " or "
                                    + ENV_VAULT_TOKEN_FILE + " environment variable, or the "
                                    + PARAM_TOKEN + " or " + PARAM_TOKEN_PATH + " parameter.");
                }
                break;
            case APPROLE:
                if (appRoleId == null) {
                    throw new VaultConfigurationException(
                            "AppRole authentication requires a role ID. Set " + ENV_VAULT_ROLE_ID
                                    + " environment variable or " + PARAM_APPROLE_ID + " parameter.");
                }
                break;
            case IAM:
                if (iamRole == null) {
                    throw new VaultConfigurationException(
                            "IAM authentication requires the " + PARAM_IAM_ROLE + " parameter.");
                }
                break;
            default:
                throw new VaultConfigurationException("Unsupported auth method: " + authMethod);
        }
    }

    private String getConfig(Map<String, ?> params, String paramName, String envName, String defaultValue) {
        Object value = params.get(paramName);
        if (value != null && !value.toString().isBlank()) {
            return value.toString().trim();
        }
        if (envName != null) {
            String envValue = environment.apply(envName);
            if (envValue != null && !envValue.isBlank()) {
                return envValue.trim();
            }
        }
        return defaultValue;
    }

    private long parseSeconds(Map<String, ?> params, String paramName, long defaultValue, boolean zeroAllowed) {
        String raw = getConfig(params, paramName, null, String.valueOf(defaultValue));
        long value;
        try {
            value = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new VaultConfigurationException(
                    "Invalid " + paramName + " value: '" + raw + "'. Must be a non-negative integer.", e);
        }
        if (value < 0 || (!zeroAllowed && value == 0)) {
            throw new VaultConfigurationException("Invalid " + paramName + " value: '" + raw + "'. Must be "
                    + (zeroAllowed ? "a non-negative integer." : "a positive integer."));
        }
        return value;
    }

    public String getVaultAddr() {
        return vaultAddr;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getNamespace() {
        return namespace;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public AuthMethod getAuthMethod() {
        return authMethod;
    }

    public String getAuthMount() {
        return authMount;
    }

    public Duration getSafetyMargin() {
        return safetyMargin;
    }

    /** Token given directly as a parameter, or null. */
    public String getToken() {
        return token;
    }

    public String getTokenPath() {
        return tokenPath;
    }

    /** Fixed token TTL, or null to look the token up in Vault. */
    public Duration getTokenTtl() {
        return tokenTtl;
    }

    public boolean isTokenRenewSelf() {
        return tokenRenewSelf;
    }

    public String getAppRoleId() {
        return appRoleId;
    }

    public String getAppRoleSecretFile() {
        return appRoleSecretFile;
    }

    public String getIamRole() {
        return iamRole;
    }

    public String getIamServerIdHeaderValue() {
        return iamServerIdHeaderValue;
    }

    /** Explicit AWS credentials, or null to use the default provider chain. */
    public AwsCredentials getAwsCredentials() {
        return awsCredentials;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    /** Configured STS endpoint, or null to derive it from the region. */
    public String getStsEndpoint() {
        return stsEndpoint;
    }

    /** Environment lookup used for resolution and for re-reading secret sources. */
    public Function<String, String> getEnvironment() {
        return environment;
    }
}
