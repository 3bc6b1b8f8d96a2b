package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider configuration of a store: a single provider kind mapped to its
 * kind-specific configuration, e.g. {@code {"fake": {"data": [...]}}}.
 */
@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
public class StoreProvider {

    private final Map<String, JsonNode> providers = new LinkedHashMap<>();

    public StoreProvider() {
    }

    public StoreProvider(String kind, JsonNode config) {
        providers.put(kind, config);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getProviders() {
        return providers;
    }

    @JsonAnySetter
    public void setProvider(String kind, JsonNode config) {
        providers.put(kind, config);
    }

    @JsonIgnore
    public JsonNode getConfig(String kind) {
        return providers.get(kind);
    }
}
