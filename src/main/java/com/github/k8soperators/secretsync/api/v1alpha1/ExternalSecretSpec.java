package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;
import java.util.Objects;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "secretStoreRef", "target", "refreshInterval", "refreshPolicy", "data", "dataFrom" })
public class ExternalSecretSpec {

    public enum RefreshPolicy {
        Periodic,
        OnChange,
        CreatedOnce
    }

    SecretStoreRef secretStoreRef;
    ExternalSecretTarget target;
    String refreshInterval;
    RefreshPolicy refreshPolicy;
    List<ExternalSecretData> data;
    List<ExternalSecretDataFrom> dataFrom;

    @JsonIgnore
    public RefreshPolicy getRefreshPolicyOrDefault() {
        return Objects.requireNonNullElse(refreshPolicy, RefreshPolicy.Periodic);
    }

    @JsonIgnore
    public ExternalSecretTarget getOrCreateTarget() {
        if (target == null) {
            target = new ExternalSecretTarget();
        }
        return target;
    }

    public SecretStoreRef getSecretStoreRef() {
        return secretStoreRef;
    }

    public void setSecretStoreRef(SecretStoreRef secretStoreRef) {
        this.secretStoreRef = secretStoreRef;
    }

    public ExternalSecretTarget getTarget() {
        return target;
    }

    public void setTarget(ExternalSecretTarget target) {
        this.target = target;
    }

    public String getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(String refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public RefreshPolicy getRefreshPolicy() {
        return refreshPolicy;
    }

    public void setRefreshPolicy(RefreshPolicy refreshPolicy) {
        this.refreshPolicy = refreshPolicy;
    }

    public List<ExternalSecretData> getData() {
        return data;
    }

    public void setData(List<ExternalSecretData> data) {
        this.data = data;
    }

    public List<ExternalSecretDataFrom> getDataFrom() {
        return dataFrom;
    }

    public void setDataFrom(List<ExternalSecretDataFrom> dataFrom) {
        this.dataFrom = dataFrom;
    }
}
