package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.store.StoreResolver;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;

@ControllerConfiguration(name = "secretstore")
public class SecretStoreReconciler extends AbstractStoreReconciler<SecretStore> {

    public SecretStoreReconciler(KubernetesClient client, StoreResolver stores, ProviderRegistry providers, RequeueBackoff backoff) {
        super(client, stores, providers, backoff);
    }
}
