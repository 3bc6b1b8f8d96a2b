package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.LabelSelector;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "name", "kind", "labelSelector" })
public class SecretStoreRef {

    public static final String KIND_SECRET_STORE = "SecretStore";
    public static final String KIND_CLUSTER_SECRET_STORE = "ClusterSecretStore";

    String name;
    String kind;
    LabelSelector labelSelector;

    public SecretStoreRef() {
    }

    public SecretStoreRef(String name, String kind) {
        this.name = name;
        this.kind = kind;
    }

    @JsonIgnore
    public String getKindOrDefault() {
        return kind == null || kind.isBlank() ? KIND_SECRET_STORE : kind;
    }

    @JsonIgnore
    public boolean isClusterScoped() {
        return KIND_CLUSTER_SECRET_STORE.equals(getKindOrDefault());
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public LabelSelector getLabelSelector() {
        return labelSelector;
    }

    public void setLabelSelector(LabelSelector labelSelector) {
        this.labelSelector = labelSelector;
    }

    @Override
    public String toString() {
        return labelSelector != null ? getKindOrDefault() + labelSelector.getMatchLabels() : getKindOrDefault() + "/" + name;
    }
}
