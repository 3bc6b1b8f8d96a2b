package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.ClusterSecretStore;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.store.StoreResolver;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;

/**
 * Validates cluster-wide stores. Clients are built without a namespace.
 */
@ControllerConfiguration(name = "clustersecretstore")
public class ClusterSecretStoreReconciler extends AbstractStoreReconciler<ClusterSecretStore> {

    public ClusterSecretStoreReconciler(KubernetesClient client, StoreResolver stores, ProviderRegistry providers, RequeueBackoff backoff) {
        super(client, stores, providers, backoff);
    }
}
