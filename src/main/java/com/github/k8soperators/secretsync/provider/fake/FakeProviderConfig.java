package com.github.k8soperators.secretsync.provider.fake;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.k8soperators.secretsync.provider.SecretsClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration below {@code spec.provider.fake} of a store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FakeProviderConfig {

    List<Entry> data = new ArrayList<>();
    SecretsClient.ValidationResult validationResult;

    public List<Entry> getData() {
        return data;
    }

    public void setData(List<Entry> data) {
        this.data = data;
    }

    public SecretsClient.ValidationResult getValidationResult() {
        return validationResult;
    }

    public void setValidationResult(SecretsClient.ValidationResult validationResult) {
        this.validationResult = validationResult;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {

        String key;
        String value;
        String version;
        Map<String, String> valueMap;
        Map<String, String> tags;

        public Entry() {
        }

        public Entry(String key, String value) {
            this.key = key;
            this.value = value;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public Map<String, String> getValueMap() {
            return valueMap;
        }

        public void setValueMap(Map<String, String> valueMap) {
            this.valueMap = valueMap;
        }

        public Map<String, String> getTags() {
            return tags;
        }

        public void setTags(Map<String, String> tags) {
            this.tags = tags;
        }
    }
}
