package com.hashicorp.vault.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for VaultClientRegistry.
 */
class VaultClientRegistryTest {

    private VaultClientConfig config;
    private VaultClientRegistry registry;

    @BeforeEach
    void setUp() {
        config = VaultClientConfig.fromParams(Map.of("vault-addr", "https://vault:8200", "token", "hvs.abc"),
                name -> null);
        registry = new VaultClientRegistry(cfg -> mock(VaultSecretClient.class));
    }

    @Test
    void boot_thenGet_returnsSameClient() {
        VaultSecretClient client = registry.boot("payments", config);

        assertThat(registry.get("payments")).isSameAs(client);
        assertThat(registry.names()).containsExactly("payments");
    }

    @Test
    void boot_withDuplicateName_throwsException() {
        registry.boot("payments", config);

        assertThatThrownBy(() -> registry.boot("payments", config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already booted");
    }

    @Test
    void boot_withNullConfig_throwsException() {
        assertThatThrownBy(() -> registry.boot("payments", null))
                .isInstanceOf(VaultConfigurationException.class);
    }

    @Test
    void get_withUnknownName_throwsException() {
        assertThatThrownBy(() -> registry.get("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No Vault client booted with name 'missing'");
    }

    @Test
    void clear_removesClients() {
        registry.boot("a", config);
        registry.boot("b", config);

        registry.clear("a");
        assertThat(registry.names()).containsExactly("b");

        registry.clear();
        assertThat(registry.names()).isEmpty();
        registry.clear("unknown");
    }

    @Test
    void registries_doNotShareClients() {
        VaultClientRegistry other = new VaultClientRegistry(cfg -> mock(VaultSecretClient.class));
        registry.boot("shared-name", config);

        assertThat(other.names()).isEmpty();
        other.boot("shared-name", config);
        assertThat(other.get("shared-name")).isNotSameAs(registry.get("shared-name"));
    }

    @Test
    void boot_withDuplicateName_buildsClientOnce() {
        AtomicInteger built = new AtomicInteger();
        VaultClientRegistry counting = new VaultClientRegistry(cfg -> {
            built.incrementAndGet();
            return mock(VaultSecretClient.class);
        });
        VaultSecretClient first = counting.boot("payments", config);

        assertThatThrownBy(() -> counting.boot("payments", config))
                .isInstanceOf(IllegalStateException.class);
        assertThat(built).hasValue(1);
        assertThat(counting.get("payments")).isSameAs(first);
    }

    @Test
    void boot_concurrentlyWithSameName_buildsOneClient() throws Exception {
        AtomicInteger built = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        VaultClientRegistry counting = new VaultClientRegistry(cfg -> {
            built.incrementAndGet();
            return mock(VaultSecretClient.class);
        });
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        counting.boot("payments", config);
                        return true;
                    } catch (IllegalStateException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int booted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    booted++;
                }
            }
            assertThat(booted).isEqualTo(1);
            assertThat(built).hasValue(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void boot_whenFactoryFails_leavesNameFree() {
        VaultClientRegistry failing = new VaultClientRegistry(cfg -> {
            throw new VaultConfigurationException("bad config");
        });

        assertThatThrownBy(() -> failing.boot("payments", config))
                .isInstanceOf(VaultConfigurationException.class);
        assertThat(failing.names()).isEmpty();
    }
}
