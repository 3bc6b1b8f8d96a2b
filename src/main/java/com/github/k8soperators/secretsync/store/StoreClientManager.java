package com.github.k8soperators.secretsync.store;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.provider.Provider;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import com.github.k8soperators.secretsync.provider.StoreContext;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Clients created during one reconciliation, one per store. Closing the
 * manager closes every client it handed out.
 */
public class StoreClientManager implements AutoCloseable {

    private static final Logger log = Logger.getLogger(StoreClientManager.class);

    private final ProviderRegistry providers;
    private final KubernetesClient kubernetesClient;
    private final String namespace;
    private final Instant deadline;
    private final Clock clock;
    private final Map<StoreKey, SecretsClient> clients = new LinkedHashMap<>();

    public StoreClientManager(ProviderRegistry providers, KubernetesClient kubernetesClient, String namespace, Instant deadline, Clock clock) {
        this.providers = providers;
        this.kubernetesClient = kubernetesClient;
        this.namespace = namespace;
        this.deadline = deadline;
        this.clock = clock;
    }

    public SecretsClient get(GenericStore store) {
        StoreKey key = StoreKey.of(store);
        SecretsClient client = clients.get(key);

        if (client == null) {
            String kind = ProviderRegistry.kindOf(store);
            Provider provider = providers.forStore(store);
            StoreContext context = new StoreContext(store, kind, kubernetesClient, namespace, deadline, clock);
            context.checkDeadline("connecting to " + key);
            client = provider.newClient(context);
            clients.put(key, client);
            log.tracef("Client for %s created in namespace %s", key, namespace);
        }

        return client;
    }

    /**
     * Fails with a transient error once the deadline of the current attempt
     * has passed.
     */
    public void checkDeadline(String operation) {
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw SyncException.transientError("deadline exceeded before %s", operation);
        }
    }

    @Override
    public void close() {
        RuntimeException failure = null;

        for (Map.Entry<StoreKey, SecretsClient> entry : clients.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warnf(e, "Closing client for %s failed", entry.getKey());
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        clients.clear();

        if (failure != null) {
            throw failure;
        }
    }
}
