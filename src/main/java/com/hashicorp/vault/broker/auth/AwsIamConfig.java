package com.hashicorp.vault.broker.auth;

import com.hashicorp.vault.broker.InvalidCredentialsException;
import com.hashicorp.vault.broker.Preconditions;
import com.hashicorp.vault.broker.VaultConfigurationException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

/**
 * Settings for {@link AwsIamAuthenticator}, validated by {@link Builder#build()}.
 *
 * <p>When no explicit credentials or provider are given, credentials come from the AWS
 * SDK default provider chain (environment, system properties, shared profile, container
 * and instance metadata).
 *
 * <p>Without an explicit STS endpoint the endpoint follows the region: the global
 * endpoint for {@code us-east-1}, {@code https://sts.<region>.amazonaws.com/} otherwise.
 * Requests to the global endpoint are always signed for {@code us-east-1}.
 */
public final class AwsIamConfig {

    public static final String DEFAULT_REGION = "us-east-1";
    public static final String DEFAULT_STS_ENDPOINT = "https://sts.amazonaws.com/";
    static final String GLOBAL_STS_HOST = "sts.amazonaws.com";

    private final String role;
    private final String mount;
    private final String namespace;
    private final String serverIdHeaderValue;
    private final String region;
    private final URI stsEndpoint;
    private final AwsCredentialsProvider credentialsProvider;
    private final boolean explicitCredentials;

    private AwsIamConfig(Builder builder, URI stsEndpoint, AwsCredentialsProvider credentialsProvider) {
        this.role = builder.role;
        this.mount = builder.mount;
        this.namespace = builder.namespace;
        this.serverIdHeaderValue = builder.serverIdHeaderValue;
        this.region = builder.region;
        this.stsEndpoint = stsEndpoint;
        this.credentialsProvider = credentialsProvider;
        this.explicitCredentials = builder.credentials != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates loosely typed credentials from a configuration map.
     *
     * <p>Accepts a map with {@code accessKeyId} and {@code secretAccessKey} (and an
     * optional {@code sessionToken}). Lists, the credential shape of older releases, and
     * any other type are rejected.
     *
     * @param raw the configured value, may be null
     * @return the credentials, or null if {@code raw} is null
     * @throws InvalidCredentialsException if the value has the wrong shape or a key is blank
     */
    public static AwsCredentials parseCredentials(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof List) {
            throw new InvalidCredentialsException(
                    "Invalid AWS credentials provided in config: expected a mapping with "
                            + "accessKeyId and secretAccessKey, not a list");
        }
        if (!(raw instanceof Map)) {
            throw new InvalidCredentialsException(
                    "Invalid AWS credentials provided in config: expected a mapping, got "
                            + raw.getClass().getSimpleName());
        }
        Map<?, ?> map = (Map<?, ?>) raw;
        return credentials(asString(map.get("accessKeyId")), asString(map.get("secretAccessKey")),
                asString(map.get("sessionToken")));
    }

    private static String asString(Object value) {
        return value instanceof String ? (String) value : null;
    }

    static AwsCredentials credentials(String accessKeyId, String secretAccessKey, String sessionToken) {
        if (accessKeyId == null || accessKeyId.isBlank()
                || secretAccessKey == null || secretAccessKey.isBlank()) {
            throw new InvalidCredentialsException(
                    "Invalid AWS credentials provided in config: accessKeyId and secretAccessKey are required.");
        }
        if (sessionToken != null && !sessionToken.isBlank()) {
            return AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken);
        }
        return AwsBasicCredentials.create(accessKeyId, secretAccessKey);
    }

    /** Role name of the {@code auth/{mount}/role/{name}} backend. */
    public String getRole() {
        return role;
    }

    public String getMount() {
        return mount;
    }

    public String getNamespace() {
        return namespace;
    }

    /** Value for the {@code X-Vault-AWS-IAM-Server-ID} header, or null. */
    public String getServerIdHeaderValue() {
        return serverIdHeaderValue;
    }

    public String getRegion() {
        return region;
    }

    public URI getStsEndpoint() {
        return stsEndpoint;
    }

    /**
     * Region for the SigV4 credential scope. STS accepts only {@code us-east-1}
     * signatures on the global endpoint, whatever region is configured.
     */
    public String getSigningRegion() {
        return GLOBAL_STS_HOST.equalsIgnoreCase(stsEndpoint.getHost()) ? DEFAULT_REGION : region;
    }

    static String regionalStsEndpoint(String region) {
        return DEFAULT_REGION.equals(region) ? DEFAULT_STS_ENDPOINT : "https://sts." + region + ".amazonaws.com/";
    }

    public AwsCredentialsProvider getCredentialsProvider() {
        return credentialsProvider;
    }

    public boolean hasExplicitCredentials() {
        return explicitCredentials;
    }

    public static final class Builder {
        private String role;
        private String mount = AuthMethod.IAM.getDefaultMount();
        private String namespace;
        private String serverIdHeaderValue;
        private String region = DEFAULT_REGION;
        private String stsEndpoint;
        private AwsCredentials credentials;
        private AwsCredentialsProvider credentialsProvider;

        private Builder() {
        }

        public Builder role(String role) {
            this.role = role;
            return this;
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

        public Builder serverIdHeaderValue(String serverIdHeaderValue) {
            this.serverIdHeaderValue = Preconditions.blankToNull(serverIdHeaderValue);
            return this;
        }

        public Builder region(String region) {
            if (region != null && !region.isBlank()) {
                this.region = region;
            }
            return this;
        }

        /**
         * Overrides the STS endpoint. A null or blank value derives it from the region.
         */
        public Builder stsEndpoint(String stsEndpoint) {
            this.stsEndpoint = Preconditions.blankToNull(stsEndpoint);
            return this;
        }

        /**
         * Uses explicit long-term credentials.
         *
         * @throws InvalidCredentialsException if either value is missing
         */
        public Builder credentials(String accessKeyId, String secretAccessKey) {
            this.credentials = AwsIamConfig.credentials(accessKeyId, secretAccessKey, null);
            return this;
        }

        /**
         * Uses explicit credentials from a configuration map.
         *
         * @throws InvalidCredentialsException if the map is incomplete
         * @see AwsIamConfig#parseCredentials(Object)
         */
        public Builder credentials(Map<String, ?> credentials) {
            this.credentials = parseCredentials(credentials);
            return this;
        }

        /**
         * Uses already validated credentials, or clears them when null.
         */
        public Builder credentials(AwsCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        /**
         * Replaces the default provider chain. Ignored when explicit credentials are set.
         */
        public Builder credentialsProvider(AwsCredentialsProvider credentialsProvider) {
            this.credentialsProvider = credentialsProvider;
            return this;
        }

        public AwsIamConfig build() {
            Preconditions.requireNonBlank(role, "IAM role");
            String target = stsEndpoint != null ? stsEndpoint : regionalStsEndpoint(region);
            URI endpoint;
            try {
                endpoint = URI.create(target);
            } catch (IllegalArgumentException e) {
                throw new VaultConfigurationException("Invalid STS endpoint: " + target, e);
            }
            if (endpoint.getHost() == null || endpoint.getScheme() == null) {
                throw new VaultConfigurationException("STS endpoint must be an absolute URL: " + target);
            }

            AwsCredentialsProvider provider;
            if (credentials != null) {
                provider = StaticCredentialsProvider.create(credentials);
            } else if (credentialsProvider != null) {
                provider = credentialsProvider;
            } else {
                provider = DefaultCredentialsProvider.create();
            }
            return new AwsIamConfig(this, endpoint, provider);
        }
    }
}
