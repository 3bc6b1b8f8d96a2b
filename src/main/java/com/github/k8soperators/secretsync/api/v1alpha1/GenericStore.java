package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Common view of {@link SecretStore} and {@link ClusterSecretStore}.
 */
public interface GenericStore extends HasMetadata {

    SecretStoreSpec getSpec();

    SecretStoreStatus getOrCreateStatus();

    /**
     * Stores with a blank controller class are processed by every engine,
     * others only by the engine running with the same class.
     */
    @JsonIgnore
    default boolean isManagedBy(String controllerClass) {
        String storeClass = getSpec() == null ? null : getSpec().getController();
        return storeClass == null || storeClass.isBlank() || storeClass.equals(controllerClass);
    }

    @JsonIgnore
    default boolean isClusterScoped() {
        return false;
    }
}
