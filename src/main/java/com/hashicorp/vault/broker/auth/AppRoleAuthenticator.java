package com.hashicorp.vault.broker.auth;

import com.hashicorp.vault.broker.Preconditions;
import com.hashicorp.vault.broker.VaultConfigurationException;
import com.hashicorp.vault.broker.transport.VaultTransport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticator for Vault AppRole logins.
 *
 * <p>AppRole is a machine-oriented auth method that uses a role ID and secret ID. The
 * secret ID can come from:
 * <ul>
 *   <li>a file path (re-read on each authentication attempt)</li>
 *   <li>an environment variable (re-read on each authentication attempt)</li>
 *   <li>a direct value</li>
 * </ul>
 *
 * <p>Re-reading the file or variable on every login lets a sidecar or Vault Agent rotate
 * the secret ID without restarting the application.
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@code VAULT_ROLE_ID} or {@code approle-id} - The AppRole role ID</li>
 *   <li>{@code VAULT_SECRET_ID} - Environment variable containing secret ID</li>
 *   <li>{@code VAULT_SECRET_ID_FILE} or {@code approle-secret-file} - Path to secret file</li>
 * </ul>
 *
 * @see VaultAuthenticator
 * @see TokenAuthenticator
 */
public class AppRoleAuthenticator implements VaultAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(AppRoleAuthenticator.class);

    private final VaultTransport transport;
    private final String roleId;
    private final String staticSecretId;
    private final String secretFilePath;
    private final String secretEnvVarName;
    private final Function<String, String> environment;
    private final String secretSource;
    private final String mount;
    private final String namespace;
    private final Clock clock;

    private AppRoleAuthenticator(Builder builder) {
        this.transport = builder.transport;
        this.roleId = builder.roleId;
        this.staticSecretId = builder.secretId;
        this.secretFilePath = builder.secretFilePath;
        this.secretEnvVarName = builder.secretEnvVarName;
        this.environment = builder.environment;
        this.secretSource = builder.secretSource;
        this.mount = builder.mount;
        this.namespace = builder.namespace;
        this.clock = builder.clock;
    }

    public static Builder builder(VaultTransport transport) {
        return new Builder(transport);
    }

    @Override
    public AuthMethod getAuthMethod() {
        return AuthMethod.APPROLE;
    }

    @Override
    public CompletableFuture<VaultToken> authenticate() {
        String currentSecretId;
        try {
            currentSecretId = resolveSecretId();
        } catch (VaultConfigurationException e) {
            return CompletableFuture.failedFuture(e);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("role_id", roleId);
        body.put("secret_id", currentSecretId);

        Map<String, String> headers = namespace != null
                ? Map.of(VaultTransport.HEADER_VAULT_NAMESPACE, namespace)
                : Map.of();

        logger.debug("AppRole login to mount '{}' using {}", mount, secretSource);
        return transport.request("POST", "/auth/" + mount + "/login", body, headers)
                .thenApply(response -> VaultToken.fromAuth(response, clock));
    }

    private String resolveSecretId() {
        if (staticSecretId != null) {
            return staticSecretId;
        }
        if (secretFilePath != null) {
            return readSecretFile();
        }
        return readSecretEnvVar();
    }

    private String readSecretFile() {
        String content;
        try {
            content = Files.readString(Path.of(secretFilePath)).trim();
        } catch (IOException e) {
            throw new VaultConfigurationException("Cannot read secret file: " + secretFilePath, e);
        }
        if (content.isBlank()) {
            throw new VaultConfigurationException("Secret file is empty: " + secretFilePath);
        }
        return content;
    }

    private String readSecretEnvVar() {
        String value = environment.apply(secretEnvVarName);
        if (value == null || value.isBlank()) {
            throw new VaultConfigurationException("Environment variable " + secretEnvVarName +
                    " is not set or is empty");
        }
        return value.trim();
    }

    /**
     * Returns the role ID used for authentication.
     *
     * @return the role ID
     */
    public String getRoleId() {
        return roleId;
    }

    /**
     * Returns a description of the secret source (for logging).
     *
     * @return the secret source description
     */
    public String getSecretSource() {
        return secretSource;
    }

    public String getMount() {
        return mount;
    }

    /**
     * Builder for {@link AppRoleAuthenticator}. Exactly one secret ID source must be set.
     */
    public static final class Builder {
        private final VaultTransport transport;
        private String roleId;
        private String secretId;
        private String secretFilePath;
        private String secretEnvVarName;
        private String secretSource;
        private Function<String, String> environment = System::getenv;
        private String mount = AuthMethod.APPROLE.getDefaultMount();
        private String namespace;
        private Clock clock = Clock.systemUTC();

        private Builder(VaultTransport transport) {
            this.transport = transport;
        }

        public Builder roleId(String roleId) {
            this.roleId = roleId;
            return this;
        }

        /**
         * Uses a fixed secret ID.
         *
         * @param secretId the AppRole secret ID
         * @param source   description of where the secret came from (for logging)
         */
        public Builder secretId(String secretId, String source) {
            clearSource();
            this.secretId = Preconditions.requireNonBlank(secretId, "Secret ID");
            this.secretSource = source;
            return this;
        }

        /**
         * Reads the secret ID from a file on every login.
         */
        public Builder secretFile(String secretFilePath) {
            clearSource();
            this.secretFilePath = Preconditions.requireNonBlank(secretFilePath, "Secret file path");
            this.secretSource = "secret file: " + secretFilePath;
            return this;
        }

        /**
         * Reads the secret ID from an environment variable on every login.
         */
        public Builder secretEnvVar(String envVarName) {
            clearSource();
            this.secretEnvVarName = Preconditions.requireNonBlank(envVarName, "Environment variable name");
            this.secretSource = envVarName + " environment variable";
            return this;
        }

        /**
         * Picks the secret ID source automatically.
         *
         * <p>Resolution order:
         * <ol>
         *   <li>Secret file at the given path, if it exists and is readable</li>
         *   <li>Environment variable, if set</li>
         * </ol>
         *
         * @throws VaultConfigurationException if neither source is available
         */
        public Builder secretFromFileOrEnvironment(String secretFilePath, String envVarName) {
            if (secretFilePath != null && !secretFilePath.isBlank()) {
                if (Files.isReadable(Path.of(secretFilePath))) {
                    return secretFile(secretFilePath);
                }
                logger.debug("Secret file not readable: {}, checking environment variable", secretFilePath);
            }

            String envSecret = envVarName != null ? environment.apply(envVarName) : null;
            if (envSecret != null && !envSecret.isBlank()) {
                if (secretFilePath != null && !secretFilePath.isBlank()) {
                    logger.info("Using secret ID from {} (secret file {} not available)",
                            envVarName, secretFilePath);
                }
                return secretEnvVar(envVarName);
            }

            throw new VaultConfigurationException(
                    "AppRole authentication requires secret ID. Set " + envVarName +
                            " environment variable or provide a readable secret file path.");
        }

        public Builder mount(String mount) {
            if (mount != null && !mount.isBlank()) {
                this.mount = mount;
            }
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = Preconditions.blankToNull(namespace);
            return this;
        }

        public Builder environment(Function<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        private void clearSource() {
            this.secretId = null;
            this.secretFilePath = null;
            this.secretEnvVarName = null;
        }

        public AppRoleAuthenticator build() {
            if (transport == null) {
                throw new VaultConfigurationException("Transport cannot be null");
            }
            Preconditions.requireNonBlank(roleId, "Role ID");
            if (secretId == null && secretFilePath == null && secretEnvVarName == null) {
                throw new VaultConfigurationException("AppRole secret ID source is not configured");
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            if (environment == null) {
                environment = System::getenv;
            }
            return new AppRoleAuthenticator(this);
        }
    }
}
