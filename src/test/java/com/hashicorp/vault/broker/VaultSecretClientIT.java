package com.hashicorp.vault.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hashicorp.vault.broker.auth.AuthMethod;
import com.hashicorp.vault.broker.transport.HttpVaultTransport;
import com.hashicorp.vault.broker.transport.VaultTransport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.vault.VaultContainer;

/**
 * Integration tests for VaultSecretClient using Testcontainers with a real Vault server.
 */
@Testcontainers
class VaultSecretClientIT {

    private static final String ROOT_TOKEN = "root-test-token";
    private static final String ROLE_ID = "test-role-id";
    private static final String SECRET_ID = "test-secret-id";
    private static final String VAULT_VERSION = System.getenv("VAULT_TEST_VERSION") != null
            ? System.getenv("VAULT_TEST_VERSION")
            : "1.17";

    @Container
    static VaultContainer<?> vaultContainer = new VaultContainer<>("hashicorp/vault:" + VAULT_VERSION)
            .withVaultToken(ROOT_TOKEN);

    @TempDir
    Path tempDir;

    private static String vaultAddr() {
        return "http://" + vaultContainer.getHost() + ":" + vaultContainer.getFirstMappedPort();
    }

    @BeforeAll
    static void configureVault() {
        VaultTransport admin = new HttpVaultTransport(vaultAddr());
        Map<String, String> root = Map.of(VaultTransport.HEADER_VAULT_TOKEN, ROOT_TOKEN);

        admin.request("POST", "sys/mounts/kv", Map.of("type", "kv"), root).join();
        admin.request("POST", "sys/auth/approle", Map.of("type", "approle"), root).join();
        admin.request("PUT", "sys/policies/acl/app",
                Map.of("policy", "path \"kv/*\" { capabilities = [\"create\", \"read\", \"update\"] }"),
                root).join();
        admin.request("POST", "auth/approle/role/app",
                Map.of("token_policies", "app", "token_ttl", "1h"), root).join();
        admin.request("POST", "auth/approle/role/app/role-id", Map.of("role_id", ROLE_ID), root).join();
        admin.request("POST", "auth/approle/role/app/custom-secret-id", Map.of("secret_id", SECRET_ID), root)
                .join();
    }

    private VaultSecretClient appRoleClient(Map<String, Object> extra, Map<String, String> env) {
        Map<String, Object> params = new HashMap<>();
        params.put(VaultClientConfig.PARAM_VAULT_ADDR, vaultAddr());
        params.put(VaultClientConfig.PARAM_AUTH_METHOD, "approle");
        params.put(VaultClientConfig.PARAM_APPROLE_ID, ROLE_ID);
        params.putAll(extra);
        return VaultClientFactory.create(VaultClientConfig.fromParams(params, env::get));
    }

    @Test
    void writeThenRead_withAppRole_returnsWrittenData() {
        VaultSecretClient client = appRoleClient(Map.of(), Map.of("VAULT_SECRET_ID", SECRET_ID));

        client.write("kv/app", Map.of("username", "svc", "password", "s3cr3t")).join();
        Lease lease = client.read("kv/app").join();

        assertThat(lease.getData())
                .containsEntry("username", "svc")
                .containsEntry("password", "s3cr3t");
        assertThat(lease.isRenewable()).isFalse();
        assertThat(client.getTokenManager().getAuthMethod()).isEqualTo(AuthMethod.APPROLE);
    }

    @Test
    void read_withSecretFile_authenticatesFromFile() throws Exception {
        Path secretFile = tempDir.resolve("secret-id");
        Files.writeString(secretFile, SECRET_ID + "\n");
        VaultSecretClient client = appRoleClient(
                Map.of(VaultClientConfig.PARAM_APPROLE_SECRET_FILE, secretFile.toString()), Map.of());

        client.write("kv/from-file", Map.of("k", "v")).join();

        assertThat(client.read("kv/from-file").join().getData()).containsEntry("k", "v");
    }

    @Test
    void concurrentReads_shareOneLogin() {
        VaultSecretClient writer = appRoleClient(Map.of(), Map.of("VAULT_SECRET_ID", SECRET_ID));
        writer.write("kv/shared", Map.of("n", 1)).join();

        VaultSecretClient client = appRoleClient(Map.of(), Map.of("VAULT_SECRET_ID", SECRET_ID));
        List<CompletableFuture<Lease>> reads = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            reads.add(client.read("kv/shared"));
        }

        for (CompletableFuture<Lease> read : reads) {
            assertThat(read.join().getData()).containsEntry("n", 1L);
        }
    }

    @Test
    void read_withWrongSecretId_failsWithAuthenticationException() {
        VaultSecretClient client = appRoleClient(Map.of(), Map.of("VAULT_SECRET_ID", "wrong-secret"));

        assertThatThrownBy(() -> client.read("kv/app").join())
                .cause()
                .isInstanceOfSatisfying(AuthenticationException.class,
                        e -> assertThat(e.getHttpStatusCode()).isEqualTo(400));
    }

    @Test
    void read_withRootToken_outsidePolicy_succeeds() {
        Map<String, Object> params = Map.of(
                VaultClientConfig.PARAM_VAULT_ADDR, vaultAddr(),
                VaultClientConfig.PARAM_TOKEN, ROOT_TOKEN);
        VaultSecretClient client = VaultClientFactory.create(VaultClientConfig.fromParams(params, name -> null));

        client.write("kv/root-only", Map.of("x", "y")).join();

        assertThat(client.read("kv/root-only").join().getData()).containsEntry("x", "y");
    }

    @Test
    void read_missingPath_failsWithNotFound() {
        VaultSecretClient client = appRoleClient(Map.of(), Map.of("VAULT_SECRET_ID", SECRET_ID));

        assertThatThrownBy(() -> client.read("kv/does-not-exist").join())
                .cause()
                .isInstanceOfSatisfying(TransportException.class,
                        e -> assertThat(e.getHttpStatusCode()).isEqualTo(404));
    }
}
