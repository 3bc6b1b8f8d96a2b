package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.k8soperators.secretsync.SyncException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Version("v1alpha1")
@Group("secretsync.k8soperators.github.com")
public class ExternalSecret extends CustomResource<ExternalSecretSpec, ExternalSecretStatus>
        implements Namespaced, SyncResource {

    private static final long serialVersionUID = 1L;

    @Override
    @JsonIgnore
    public ExternalSecretStatus getOrCreateStatus() {
        if (status == null) {
            status = new ExternalSecretStatus();
        }

        return status;
    }

    /**
     * Name of the target Secret, defaulting to the name of this resource.
     */
    @JsonIgnore
    public String getTargetName() {
        return Optional.ofNullable(spec)
                .map(ExternalSecretSpec::getTarget)
                .map(ExternalSecretTarget::getName)
                .filter(name -> !name.isBlank())
                .orElseGet(() -> getMetadata().getName());
    }

    @Override
    @JsonIgnore
    public String getRefreshInterval() {
        return spec == null ? null : spec.getRefreshInterval();
    }

    /**
     * Makes this resource the controller of {@code resource}. Other owner
     * references are kept.
     *
     * @throws SyncException CONFLICT when another controller is already set
     */
    @JsonIgnore
    public void own(HasMetadata resource) {
        String uid = getMetadata().getUid();

        otherController(resource).ifPresent(or -> {
            throw SyncException.conflict("%s %s is already controlled by %s %s",
                    resource.getKind(), resource.getMetadata().getName(), or.getKind(), or.getName());
        });

        resource.getOwnerReferenceFor(this)
            .ifPresentOrElse(
                    or -> {
                        or.setApiVersion(getApiVersion());
                        or.setKind(getKind());
                        or.setName(getMetadata().getName());
                        or.setController(Boolean.TRUE);
                        or.setBlockOwnerDeletion(Boolean.TRUE);
                    },
                    () ->
                        resource.addOwnerReference(new OwnerReferenceBuilder()
                            .withApiVersion(getApiVersion())
                            .withKind(getKind())
                            .withName(getMetadata().getName())
                            .withUid(uid)
                            .withController(Boolean.TRUE)
                            .withBlockOwnerDeletion(Boolean.TRUE)
                            .build()));
    }

    @JsonIgnore
    public Optional<OwnerReference> otherController(HasMetadata resource) {
        return resource.optionalMetadata()
            .map(ObjectMeta::getOwnerReferences)
            .orElseGet(List::of)
            .stream()
            .filter(or -> Boolean.TRUE.equals(or.getController()))
            .filter(or -> !Objects.equals(or.getUid(), getMetadata().getUid()))
            .findFirst();
    }

    @JsonIgnore
    public boolean isControllingOwner(HasMetadata resource) {
        return resource.getOwnerReferenceFor(this)
            .map(OwnerReference::getController)
            .filter(Boolean.TRUE::equals)
            .orElse(false);
    }
}
