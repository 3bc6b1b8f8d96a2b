package com.github.k8soperators.secretsync.store;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.ClusterSecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.ClusterStoreCondition;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreRef;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns store references into store resources. Stores are always read from
 * the cluster, never cached across reconciliations.
 */
@Singleton
public class StoreResolver {

    private static final Logger log = Logger.getLogger(StoreResolver.class);

    private final KubernetesClient client;
    private final String controllerClass;

    @Inject
    public StoreResolver(KubernetesClient client, @ConfigProperty(name = "secretsync.controller-class") Optional<String> controllerClass) {
        this(client, controllerClass.orElse(""));
    }

    public StoreResolver(KubernetesClient client, String controllerClass) {
        this.client = client;
        this.controllerClass = controllerClass;
    }

    public String getControllerClass() {
        return controllerClass;
    }

    public boolean isManaged(GenericStore store) {
        return store.isManagedBy(controllerClass);
    }

    /**
     * Reads the store named by {@code ref}. Cluster stores must allow
     * {@code namespace} through their conditions.
     *
     * @throws SyncException NOT_FOUND naming the store when it does not exist
     */
    public GenericStore get(SecretStoreRef ref, String namespace) {
        if (ref.getLabelSelector() != null) {
            throw SyncException.validation("store reference %s: a label selector is not allowed here", ref);
        }

        GenericStore store = find(ref, namespace)
                .orElseThrow(() -> SyncException.notFound("could not get %s \"%s\": not found", ref.getKindOrDefault(), ref.getName()));

        if (store instanceof ClusterSecretStore && !isAllowed((ClusterSecretStore) store, namespace)) {
            throw SyncException.validation("%s \"%s\" may not be used from namespace %s", store.getKind(), ref.getName(), namespace);
        }

        return store;
    }

    Optional<GenericStore> find(SecretStoreRef ref, String namespace) {
        if (ref.getName() == null || ref.getName().isBlank()) {
            throw SyncException.validation("store reference must set a name");
        }

        if (ref.isClusterScoped()) {
            return Optional.ofNullable(client.resources(ClusterSecretStore.class).withName(ref.getName()).get());
        }

        if (!SecretStoreRef.KIND_SECRET_STORE.equals(ref.getKindOrDefault())) {
            throw SyncException.validation("unknown store kind %s", ref.getKind());
        }

        return Optional.ofNullable(client.resources(SecretStore.class).inNamespace(namespace).withName(ref.getName()).get());
    }

    /**
     * Resolves references that either name a store or select stores by label.
     * Each store appears once, in reference order.
     */
    public List<GenericStore> resolve(Collection<SecretStoreRef> refs, String namespace) {
        Map<StoreKey, GenericStore> stores = new LinkedHashMap<>();

        for (SecretStoreRef ref : refs) {
            boolean named = ref.getName() != null && !ref.getName().isBlank();

            if (named && ref.getLabelSelector() != null) {
                throw SyncException.validation("store reference %s sets both name and labelSelector", ref);
            }

            if (named) {
                GenericStore store = get(ref, namespace);
                stores.putIfAbsent(StoreKey.of(store), store);
            } else if (ref.getLabelSelector() != null) {
                select(ref, namespace).forEach(store -> stores.putIfAbsent(StoreKey.of(store), store));
            } else {
                throw SyncException.validation("store reference must set name or labelSelector");
            }
        }

        return new ArrayList<>(stores.values());
    }

    List<GenericStore> select(SecretStoreRef ref, String namespace) {
        List<GenericStore> result = new ArrayList<>();

        if (ref.isClusterScoped()) {
            for (ClusterSecretStore store : client.resources(ClusterSecretStore.class).withLabelSelector(ref.getLabelSelector()).list().getItems()) {
                if (isAllowed(store, namespace)) {
                    result.add(store);
                } else {
                    log.debugf("ClusterSecretStore %s selected but not allowed in namespace %s", store.getMetadata().getName(), namespace);
                }
            }
        } else {
            result.addAll(client.resources(SecretStore.class).inNamespace(namespace).withLabelSelector(ref.getLabelSelector()).list().getItems());
        }

        log.tracef("Selector %s in namespace %s matched %d stores", ref, namespace, result.size());
        return result;
    }

    /**
     * A cluster store without conditions is usable everywhere; otherwise one
     * condition must list the namespace or select it by label.
     */
    public boolean isAllowed(ClusterSecretStore store, String namespace) {
        List<ClusterStoreCondition> conditions = store.getSpec() == null ? null : store.getSpec().getConditions();

        if (conditions == null || conditions.isEmpty()) {
            return true;
        }

        Namespace ns = null;

        for (ClusterStoreCondition condition : conditions) {
            if (condition.getNamespaces() != null && condition.getNamespaces().contains(namespace)) {
                return true;
            }

            if (condition.getNamespaceSelector() != null) {
                if (ns == null) {
                    ns = client.namespaces().withName(namespace).get();
                }
                if (ns != null && LabelSelectors.matches(condition.getNamespaceSelector(), ns.getMetadata().getLabels())) {
                    return true;
                }
            }
        }

        return false;
    }
}
