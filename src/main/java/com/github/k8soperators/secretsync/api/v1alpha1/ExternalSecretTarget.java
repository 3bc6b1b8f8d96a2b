package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Objects;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "name", "creationPolicy", "deletionPolicy", "immutable", "template" })
public class ExternalSecretTarget {

    public enum CreationPolicy {
        /** Create or update the target and make it owned by the ExternalSecret. */
        Owner,
        /** Create or update the target without an owner reference. */
        Orphan,
        /** Only merge keys into an already existing target. */
        Merge,
        /** Never write the target. */
        None
    }

    public enum DeletionPolicy {
        Retain,
        Delete,
        Merge
    }

    String name;
    CreationPolicy creationPolicy;
    DeletionPolicy deletionPolicy;
    Boolean immutable;
    Template template;

    @JsonIgnore
    public CreationPolicy getCreationPolicyOrDefault() {
        return Objects.requireNonNullElse(creationPolicy, CreationPolicy.Owner);
    }

    @JsonIgnore
    public DeletionPolicy getDeletionPolicyOrDefault() {
        return Objects.requireNonNullElse(deletionPolicy, DeletionPolicy.Retain);
    }

    @JsonIgnore
    public boolean isImmutable() {
        return Boolean.TRUE.equals(immutable);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public CreationPolicy getCreationPolicy() {
        return creationPolicy;
    }

    public void setCreationPolicy(CreationPolicy creationPolicy) {
        this.creationPolicy = creationPolicy;
    }

    public DeletionPolicy getDeletionPolicy() {
        return deletionPolicy;
    }

    public void setDeletionPolicy(DeletionPolicy deletionPolicy) {
        this.deletionPolicy = deletionPolicy;
    }

    public Boolean getImmutable() {
        return immutable;
    }

    public void setImmutable(Boolean immutable) {
        this.immutable = immutable;
    }

    public Template getTemplate() {
        return template;
    }

    public void setTemplate(Template template) {
        this.template = template;
    }
}
