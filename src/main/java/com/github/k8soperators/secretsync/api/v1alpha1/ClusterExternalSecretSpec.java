package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.LabelSelector;

import javax.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "externalSecretSpec", "externalSecretName", "externalSecretMetadata", "namespaceSelector",
    "namespaceSelectors", "namespaces", "refreshTime" })
public class ClusterExternalSecretSpec {

    @NotNull
    ExternalSecretSpec externalSecretSpec;
    String externalSecretName;
    ExternalSecretMetadata externalSecretMetadata;
    /** Deprecated in favour of {@link #namespaceSelectors}; still honoured. */
    LabelSelector namespaceSelector;
    List<LabelSelector> namespaceSelectors;
    List<String> namespaces;
    String refreshTime;

    @JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ExternalSecretMetadata {

        Map<String, String> labels;
        Map<String, String> annotations;

        public Map<String, String> getLabels() {
            return labels;
        }

        public void setLabels(Map<String, String> labels) {
            this.labels = labels;
        }

        public Map<String, String> getAnnotations() {
            return annotations;
        }

        public void setAnnotations(Map<String, String> annotations) {
            this.annotations = annotations;
        }
    }

    public ExternalSecretSpec getExternalSecretSpec() {
        return externalSecretSpec;
    }

    public void setExternalSecretSpec(ExternalSecretSpec externalSecretSpec) {
        this.externalSecretSpec = externalSecretSpec;
    }

    public String getExternalSecretName() {
        return externalSecretName;
    }

    public void setExternalSecretName(String externalSecretName) {
        this.externalSecretName = externalSecretName;
    }

    public ExternalSecretMetadata getExternalSecretMetadata() {
        return externalSecretMetadata;
    }

    public void setExternalSecretMetadata(ExternalSecretMetadata externalSecretMetadata) {
        this.externalSecretMetadata = externalSecretMetadata;
    }

    public LabelSelector getNamespaceSelector() {
        return namespaceSelector;
    }

    public void setNamespaceSelector(LabelSelector namespaceSelector) {
        this.namespaceSelector = namespaceSelector;
    }

    public List<LabelSelector> getNamespaceSelectors() {
        return namespaceSelectors;
    }

    public void setNamespaceSelectors(List<LabelSelector> namespaceSelectors) {
        this.namespaceSelectors = namespaceSelectors;
    }

    public List<String> getNamespaces() {
        return namespaces;
    }

    public void setNamespaces(List<String> namespaces) {
        this.namespaces = namespaces;
    }

    public String getRefreshTime() {
        return refreshTime;
    }

    public void setRefreshTime(String refreshTime) {
        this.refreshTime = refreshTime;
    }
}
