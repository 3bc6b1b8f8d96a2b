package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

@Version("v1alpha1")
@Group("secretsync.k8soperators.github.com")
public class PushSecret extends CustomResource<PushSecretSpec, PushSecretStatus>
        implements Namespaced, SyncResource {

    private static final long serialVersionUID = 1L;

    @Override
    @JsonIgnore
    public PushSecretStatus getOrCreateStatus() {
        if (status == null) {
            status = new PushSecretStatus();
        }

        return status;
    }

    @Override
    @JsonIgnore
    public String getRefreshInterval() {
        return spec == null ? null : spec.getRefreshInterval();
    }
}
