package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreStatus;
import com.github.k8soperators.secretsync.provider.Provider;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import com.github.k8soperators.secretsync.store.StoreClientManager;
import com.github.k8soperators.secretsync.store.StoreResolver;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.inject.Inject;

import java.time.Clock;
import java.time.Duration;

/**
 * Validates managed stores: the provider kind is known, the configuration
 * passes static checks, a client can be built and the backend does not report
 * an error.
 */
abstract class AbstractStoreReconciler<S extends GenericStore> implements Reconciler<S>, Cleaner<S> {

    static final String MESSAGE_VALID = "store validated";
    static final String MESSAGE_NOT_MAINTAINED = " (provider is not maintained)";

    protected final Logger log = Logger.getLogger(getClass());

    protected final KubernetesClient client;
    protected final StoreResolver stores;
    protected final ProviderRegistry providers;
    protected final RequeueBackoff backoff;

    @Inject
    @ConfigProperty(name = "secretsync.reconcile-timeout", defaultValue = "30s")
    Duration reconcileTimeout;

    Clock clock = Clock.systemUTC();

    protected AbstractStoreReconciler(KubernetesClient client, StoreResolver stores, ProviderRegistry providers, RequeueBackoff backoff) {
        this.client = client;
        this.stores = stores;
        this.providers = providers;
        this.backoff = backoff;
    }

    @Override
    public UpdateControl<S> reconcile(S store, Context<S> context) {
        String namespace = store.getMetadata().getNamespace();
        String name = store.getMetadata().getName();

        if (!stores.isManaged(store)) {
            log.debugf("%s{namespace=%s, name=%s}: managed by another controller, skipping", store.getKind(), namespace, name);
            backoff.forget(store);
            return UpdateControl.noUpdate();
        }

        SecretStoreStatus status = store.getOrCreateStatus();

        try {
            Provider provider = providers.forStore(store);
            status.setCapabilities(provider.capabilities().name());
            provider.validateStore(store);

            try (StoreClientManager clients = new StoreClientManager(providers, client, namespace, clock.instant().plus(reconcileTimeout), clock)) {
                SecretsClient secrets = clients.get(store);

                if (secrets.validate() == SecretsClient.ValidationResult.ERROR) {
                    throw SyncException.validation("could not validate %s provider of store %s", provider.kind(), name);
                }
            }

            String message = MESSAGE_VALID;

            if (provider.maintenanceStatus() == Provider.MaintenanceStatus.NOT_MAINTAINED) {
                log.warnf("%s{namespace=%s, name=%s}: provider %s is not maintained", store.getKind(), namespace, name, provider.kind());
                message += MESSAGE_NOT_MAINTAINED;
            }

            status.markReady(SecretStoreStatus.REASON_VALID, message);
            backoff.onSuccess(store);
            log.debugf("%s{namespace=%s, name=%s}: %s", store.getKind(), namespace, name, message);

            Integer refreshSeconds = store.getSpec() == null ? null : store.getSpec().getRefreshInterval();
            UpdateControl<S> control = UpdateControl.patchStatus(store);

            if (refreshSeconds != null && refreshSeconds > 0) {
                control.rescheduleAfter(Duration.ofSeconds(refreshSeconds));
            }

            return control;
        } catch (RuntimeException e) {
            SyncException error = SyncException.from(e);
            Duration delay = backoff.onFailure(store);
            log.infof("%s{namespace=%s, name=%s}: invalid, retrying in %s: %s", store.getKind(), namespace, name, delay, error.getMessage());
            status.updateCondition(SecretStoreStatus.CONDITION_READY, SecretStoreStatus.STATUS_FALSE,
                    SecretStoreStatus.REASON_INVALID_PROVIDER_CONFIG, error.getMessage());
            return UpdateControl.patchStatus(store).rescheduleAfter(delay);
        }
    }

    @Override
    public DeleteControl cleanup(S store, Context<S> context) {
        backoff.forget(store);
        return DeleteControl.defaultDelete();
    }
}
