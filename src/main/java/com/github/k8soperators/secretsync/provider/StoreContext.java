package com.github.k8soperators.secretsync.provider;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.utils.Serialization;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Everything a provider needs to build a client: the store, the cluster
 * client for credential lookups, the namespace of the resource being
 * reconciled and the deadline of the current attempt.
 */
public class StoreContext {

    private final GenericStore store;
    private final String providerKind;
    private final KubernetesClient kubernetesClient;
    private final String namespace;
    private final Instant deadline;
    private final Clock clock;

    public StoreContext(GenericStore store, String providerKind, KubernetesClient kubernetesClient, String namespace, Instant deadline, Clock clock) {
        this.store = store;
        this.providerKind = providerKind;
        this.kubernetesClient = kubernetesClient;
        this.namespace = namespace;
        this.deadline = deadline;
        this.clock = clock;
    }

    public GenericStore getStore() {
        return store;
    }

    public String getProviderKind() {
        return providerKind;
    }

    public KubernetesClient getKubernetesClient() {
        return kubernetesClient;
    }

    /**
     * Namespace of the requesting resource. For cluster stores using referent
     * authentication, credentials are looked up here.
     */
    public String getNamespace() {
        return namespace;
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Converts the provider section of the store into the provider's
     * configuration type.
     */
    public <T> T getConfig(Class<T> type) {
        return readConfig(store, providerKind, type);
    }

    public void checkDeadline(String operation) {
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw SyncException.transientError("deadline exceeded before %s", operation);
        }
    }

    public static <T> T readConfig(GenericStore store, String providerKind, Class<T> type) {
        return Optional.ofNullable(store.getSpec().getProvider())
                .map(provider -> provider.getConfig(providerKind))
                .map(node -> Serialization.jsonMapper().convertValue(node, type))
                .orElseThrow(() -> SyncException.validation("store %s has no %s provider configuration",
                        store.getMetadata().getName(), providerKind));
    }
}
