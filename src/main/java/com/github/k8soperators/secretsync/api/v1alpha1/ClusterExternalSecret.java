package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

import java.util.Optional;

/**
 * Cluster-scoped template that provisions an {@link ExternalSecret} in every
 * selected namespace.
 */
@Version("v1alpha1")
@Group("secretsync.k8soperators.github.com")
public class ClusterExternalSecret extends CustomResource<ClusterExternalSecretSpec, ClusterExternalSecretStatus> {

    private static final long serialVersionUID = 1L;

    @JsonIgnore
    public ClusterExternalSecretStatus getOrCreateStatus() {
        if (status == null) {
            status = new ClusterExternalSecretStatus();
        }

        return status;
    }

    /**
     * Name of the provisioned ExternalSecrets, defaulting to the name of this
     * resource.
     */
    @JsonIgnore
    public String getExternalSecretName() {
        return Optional.ofNullable(spec)
                .map(ClusterExternalSecretSpec::getExternalSecretName)
                .filter(name -> !name.isBlank())
                .orElseGet(() -> getMetadata().getName());
    }

    @JsonIgnore
    public OwnerReference controllerReference() {
        return new OwnerReferenceBuilder()
                .withApiVersion(getApiVersion())
                .withKind(getKind())
                .withName(getMetadata().getName())
                .withUid(getMetadata().getUid())
                .withController(Boolean.TRUE)
                .withBlockOwnerDeletion(Boolean.TRUE)
                .build();
    }

    @JsonIgnore
    public boolean isControllingOwner(HasMetadata resource) {
        return resource.getOwnerReferenceFor(this)
            .map(OwnerReference::getController)
            .filter(Boolean.TRUE::equals)
            .orElse(false);
    }
}
