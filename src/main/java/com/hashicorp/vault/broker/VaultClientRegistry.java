package com.hashicorp.vault.broker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named clients for applications that want to share one client per Vault role.
 *
 * <p>A registry is an ordinary object: create it at startup, pass it to whatever needs a
 * client and {@link #clear()} it on shutdown. There is no static instance.
 */
public class VaultClientRegistry {

    private static final Logger logger = LoggerFactory.getLogger(VaultClientRegistry.class);

    private final ConcurrentMap<String, VaultSecretClient> clients = new ConcurrentHashMap<>();
    private final Function<VaultClientConfig, VaultSecretClient> clientFactory;

    public VaultClientRegistry() {
        this(VaultClientFactory::create);
    }

    /**
     * @param clientFactory builds the client for {@link #boot}
     */
    public VaultClientRegistry(Function<VaultClientConfig, VaultSecretClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * Creates a client and stores it under a name.
     *
     * @param name   client name
     * @param config client configuration
     * @return the new client
     * @throws IllegalStateException if a client with this name is already booted
     */
    public VaultSecretClient boot(String name, VaultClientConfig config) {
        Preconditions.requireNonBlank(name, "Client name");
        if (config == null) {
            throw new VaultConfigurationException("Configuration should be provided");
        }
        // The factory runs at most once per name, even when boots race
        boolean[] created = new boolean[1];
        VaultSecretClient client = clients.computeIfAbsent(name, key -> {
            created[0] = true;
            return clientFactory.apply(config);
        });
        if (!created[0]) {
            throw new IllegalStateException("Client with name '" + name + "' already booted");
        }
        logger.debug("Booted Vault client '{}'", name);
        return client;
    }

    /**
     * Returns a booted client.
     *
     * @throws IllegalArgumentException if no client has this name
     */
    public VaultSecretClient get(String name) {
        VaultSecretClient client = name != null ? clients.get(name) : null;
        if (client == null) {
            throw new IllegalArgumentException("No Vault client booted with name '" + name + "'");
        }
        return client;
    }

    /**
     * Removes one client. Unknown names are ignored.
     */
    public void clear(String name) {
        if (name != null && clients.remove(name) != null) {
            logger.debug("Cleared Vault client '{}'", name);
        }
    }

    /**
     * Removes all clients.
     */
    public void clear() {
        clients.clear();
    }

    public Set<String> names() {
        return Set.copyOf(clients.keySet());
    }
}
