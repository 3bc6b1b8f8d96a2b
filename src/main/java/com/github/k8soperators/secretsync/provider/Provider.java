package com.github.k8soperators.secretsync.provider;

import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;

/**
 * Constructor of {@link SecretsClient}s for one provider kind. Implementations
 * are CDI beans discovered by the {@link ProviderRegistry}.
 */
public interface Provider {

    enum Capabilities {
        ReadOnly,
        WriteOnly,
        ReadWrite
    }

    enum MaintenanceStatus {
        MAINTAINED,
        NOT_MAINTAINED
    }

    /**
     * Key of this provider below {@code spec.provider} of a store.
     */
    String kind();

    default Capabilities capabilities() {
        return Capabilities.ReadWrite;
    }

    default MaintenanceStatus maintenanceStatus() {
        return MaintenanceStatus.MAINTAINED;
    }

    /**
     * Static validation of the store configuration, without contacting the
     * backend.
     *
     * @throws com.github.k8soperators.secretsync.SyncException VALIDATION when the configuration is unusable
     */
    void validateStore(GenericStore store);

    /**
     * Builds a client for the store in the given context. Implementations may
     * authenticate eagerly and fail with {@code AUTH}.
     */
    SecretsClient newClient(StoreContext context);

}
