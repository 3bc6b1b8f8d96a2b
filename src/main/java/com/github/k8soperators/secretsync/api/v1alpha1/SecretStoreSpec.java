package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import javax.validation.constraints.NotNull;

import java.util.List;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "controller", "provider", "refreshInterval", "conditions" })
public class SecretStoreSpec {

    String controller;
    @NotNull
    StoreProvider provider;
    Integer refreshInterval;
    List<ClusterStoreCondition> conditions;

    public String getController() {
        return controller;
    }

    public void setController(String controller) {
        this.controller = controller;
    }

    public StoreProvider getProvider() {
        return provider;
    }

    public void setProvider(StoreProvider provider) {
        this.provider = provider;
    }

    public Integer getRefreshInterval() {
        return refreshInterval;
    }

    public void setRefreshInterval(Integer refreshInterval) {
        this.refreshInterval = refreshInterval;
    }

    public List<ClusterStoreCondition> getConditions() {
        return conditions;
    }

    public void setConditions(List<ClusterStoreCondition> conditions) {
        this.conditions = conditions;
    }
}
