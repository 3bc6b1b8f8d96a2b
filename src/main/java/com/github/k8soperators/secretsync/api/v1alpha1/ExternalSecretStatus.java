package com.github.k8soperators.secretsync.api.v1alpha1;

import io.fabric8.kubernetes.api.model.LocalObjectReference;

public class ExternalSecretStatus extends SyncStatus {

    LocalObjectReference binding;

    public LocalObjectReference getBinding() {
        return binding;
    }

    public void setBinding(LocalObjectReference binding) {
        this.binding = binding;
    }
}
