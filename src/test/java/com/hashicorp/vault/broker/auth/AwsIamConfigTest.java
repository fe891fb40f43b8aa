package com.hashicorp.vault.broker.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hashicorp.vault.broker.InvalidCredentialsException;
import com.hashicorp.vault.broker.VaultConfigurationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

/**
 * Unit tests for AwsIamConfig.
 */
class AwsIamConfigTest {

    @Test
    void build_withDefaults_usesDefaultChain() {
        AwsIamConfig config = AwsIamConfig.builder().role("r").build();

        assertThat(config.getMount()).isEqualTo("aws");
        assertThat(config.getRegion()).isEqualTo("us-east-1");
        assertThat(config.getStsEndpoint()).hasToString("https://sts.amazonaws.com/");
        assertThat(config.getCredentialsProvider()).isInstanceOf(DefaultCredentialsProvider.class);
        assertThat(config.hasExplicitCredentials()).isFalse();
        assertThat(config.getServerIdHeaderValue()).isNull();
    }

    @Test
    void build_withExplicitCredentials_usesStaticProvider() {
        AwsIamConfig config = AwsIamConfig.builder()
                .role("r")
                .credentials("AKIDEXAMPLE", "secret")
                .build();

        assertThat(config.getCredentialsProvider()).isInstanceOf(StaticCredentialsProvider.class);
        assertThat(config.hasExplicitCredentials()).isTrue();
        assertThat(config.getCredentialsProvider().resolveCredentials().accessKeyId()).isEqualTo("AKIDEXAMPLE");
    }

    @Test
    void build_withoutRole_throwsException() {
        assertThatThrownBy(() -> AwsIamConfig.builder().build())
                .isInstanceOf(VaultConfigurationException.class)
                .hasMessageContaining("IAM role");
    }

    @Test
    void build_withRelativeStsEndpoint_throwsException() {
        assertThatThrownBy(() -> AwsIamConfig.builder().role("r").stsEndpoint("sts.amazonaws.com").build())
                .isInstanceOf(VaultConfigurationException.class)
                .hasMessageContaining("absolute URL");
    }

    @Test
    void parseCredentials_withNull_returnsNull() {
        assertThat(AwsIamConfig.parseCredentials(null)).isNull();
    }

    @Test
    void parseCredentials_withSessionToken_returnsSessionCredentials() {
        AwsCredentials credentials = AwsIamConfig.parseCredentials(Map.of(
                "accessKeyId", "ASIA", "secretAccessKey", "secret", "sessionToken", "tok"));

        assertThat(credentials).isInstanceOf(AwsSessionCredentials.class);
        assertThat(((AwsSessionCredentials) credentials).sessionToken()).isEqualTo("tok");
    }

    @Test
    void parseCredentials_withList_throwsException() {
        assertThatThrownBy(() -> AwsIamConfig.parseCredentials(List.of("AKID", "secret")))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessageContaining("not a list");
    }

    @Test
    void parseCredentials_withString_throwsException() {
        assertThatThrownBy(() -> AwsIamConfig.parseCredentials("AKID:secret"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessageContaining("expected a mapping");
    }

    @Test
    void parseCredentials_withMissingSecret_throwsException() {
        assertThatThrownBy(() -> AwsIamConfig.parseCredentials(Map.of("accessKeyId", "AKID")))
                .isInstanceOf(InvalidCredentialsException.class)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_withRegionOnly_derivesRegionalEndpoint() {
        AwsIamConfig config = AwsIamConfig.builder().role("r").region("ap-southeast-2").build();

        assertThat(config.getStsEndpoint()).hasToString("https://sts.ap-southeast-2.amazonaws.com/");
        assertThat(config.getSigningRegion()).isEqualTo("ap-southeast-2");
    }

    @Test
    void getSigningRegion_withGlobalEndpoint_isUsEast1() {
        AwsIamConfig config = AwsIamConfig.builder()
                .role("r")
                .region("eu-west-1")
                .stsEndpoint("https://sts.amazonaws.com/")
                .build();

        assertThat(config.getRegion()).isEqualTo("eu-west-1");
        assertThat(config.getSigningRegion()).isEqualTo("us-east-1");
    }
}
