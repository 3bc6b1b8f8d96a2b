package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import javax.validation.constraints.NotNull;

import java.util.List;
import java.util.Objects;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "secretStoreRefs", "selector", "data", "updatePolicy", "deletionPolicy", "refreshInterval", "template" })
public class PushSecretSpec {

    public enum UpdatePolicy {
        /** Push unconditionally. */
        Always,
        /** Push only when the remote key does not exist yet. */
        IfNotExists
    }

    public enum DeletionPolicy {
        None,
        Delete
    }

    @NotNull
    List<SecretStoreRef> secretStoreRefs;
    @NotNull
    Selector selector;
    List<PushSecretData> data;
    UpdatePolicy updatePolicy;
    DeletionPolicy deletionPolicy;
    String refreshInterval;
    Template template;

    @JsonIgnore
    public UpdatePolicy getUpdatePolicyOrDefault() {
        return Objects.requireNonNullElse(updatePolicy, UpdatePolicy.Always);
    }

    @JsonIgnore
    public DeletionPolicy getDeletionPolicyOrDefault() {
        return Objects.requireNonNullElse(deletionPolicy, DeletionPolicy.None);
    }

    public List<SecretStoreRef> getSecretStoreRefs() {
        return secretStoreRefs;
    }

    public void setSecretStoreRefs(List<SecretStoreRef> secretStoreRefs) {
        this.secretStoreRefs = secretStoreRefs;
    }

    public Selector getSelector() {
        return selector;
    }

    public void setSelector(Selector selector) {
        this.selector = selector;
    }

    public List<PushSecretData> getData() {
        return data;
    }

    public void setData(List<PushSecretData> data) {
        this.data = data;
    }

    public UpdatePolicy getUpdatePolicy() {
        return updatePolicy;
    }

    public void setUpdatePolicy(UpdatePolicy updatePolicy) {
        this.updatePolicy = updatePolicy;
    }

    public DeletionPolicy getDeletionPolicy() {
        return deletionPolicy;
    }

    public void setDeletionPolicy(DeletionPolicy deletionPolicy) {
        this.deletionPolicy = deletionPolicy;
    }

    public String getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(String refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public Template getTemplate() {
        return template;
    }

    public void setTemplate(Template template) {
        this.template = template;
    }

    /**
     * Source of the pushed values: a Secret in the namespace of the
     * PushSecret, or a generator.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "secret", "generatorRef" })
    public static class Selector {

        SecretSelector secret;
        GeneratorRef generatorRef;

        public SecretSelector getSecret() {
            return secret;
        }

        public void setSecret(SecretSelector secret) {
            this.secret = secret;
        }

        public GeneratorRef getGeneratorRef() {
            return generatorRef;
        }

        public void setGeneratorRef(GeneratorRef generatorRef) {
            this.generatorRef = generatorRef;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SecretSelector {

        @NotNull
        String name;

        public SecretSelector() {
        }

        public SecretSelector(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
