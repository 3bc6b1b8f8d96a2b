package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.ArrayList;
import java.util.List;

public class ClusterExternalSecretStatus extends ConditionedStatus {

    public static final String REASON_PROVISIONED = "Provisioned";
    public static final String REASON_PARTIALLY_PROVISIONED = "PartiallyProvisioned";

    String externalSecretName;
    List<String> provisionedNamespaces = new ArrayList<>();
    List<NamespaceFailure> failedNamespaces = new ArrayList<>();

    @JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "namespace", "reason" })
    public static class NamespaceFailure {

        String namespace;
        String reason;

        public NamespaceFailure() {
        }

        public NamespaceFailure(String namespace, String reason) {
            this.namespace = namespace;
            this.reason = reason;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }
    }

    public String getExternalSecretName() {
        return externalSecretName;
    }

    public void setExternalSecretName(String externalSecretName) {
        this.externalSecretName = externalSecretName;
    }

    public List<String> getProvisionedNamespaces() {
        return provisionedNamespaces;
    }

    public void setProvisionedNamespaces(List<String> provisionedNamespaces) {
        this.provisionedNamespaces = provisionedNamespaces;
    }

    public List<NamespaceFailure> getFailedNamespaces() {
        return failedNamespaces;
    }

    public void setFailedNamespaces(List<NamespaceFailure> failedNamespaces) {
        this.failedNamespaces = failedNamespaces;
    }
}
