package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "engineVersion", "type", "mergePolicy", "metadata", "data", "templateFrom" })
public class Template {

    public static final String ENGINE_V2 = "v2";

    public enum MergePolicy {
        Replace,
        Merge
    }

    public enum TemplateScope {
        Values,
        KeysAndValues
    }

    String engineVersion;
    String type;
    MergePolicy mergePolicy;
    Metadata metadata;
    Map<String, String> data;
    List<TemplateFrom> templateFrom;

    @JsonIgnore
    public String getEngineVersionOrDefault() {
        return engineVersion == null || engineVersion.isBlank() ? ENGINE_V2 : engineVersion;
    }

    @JsonIgnore
    public MergePolicy getMergePolicyOrDefault() {
        return Objects.requireNonNullElse(mergePolicy, MergePolicy.Replace);
    }

    public String getEngineVersion() {
        return engineVersion;
    }

    public void setEngineVersion(String engineVersion) {
        this.engineVersion = engineVersion;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public MergePolicy getMergePolicy() {
        return mergePolicy;
    }

    public void setMergePolicy(MergePolicy mergePolicy) {
        this.mergePolicy = mergePolicy;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public void setMetadata(Metadata metadata) {
        this.metadata = metadata;
    }

    public Map<String, String> getData() {
        return data;
    }

    public void setData(Map<String, String> data) {
        this.data = data;
    }

    public List<TemplateFrom> getTemplateFrom() {
        return templateFrom;
    }

    public void setTemplateFrom(List<TemplateFrom> templateFrom) {
        this.templateFrom = templateFrom;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "labels", "annotations" })
    public static class Metadata {

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

    /**
     * A source of template strings. Exactly one of {@code configMap},
     * {@code secret} or {@code literal} is set.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "configMap", "secret", "literal" })
    public static class TemplateFrom {

        TemplateRef configMap;
        TemplateRef secret;
        String literal;

        public TemplateRef getConfigMap() {
            return configMap;
        }

        public void setConfigMap(TemplateRef configMap) {
            this.configMap = configMap;
        }

        public TemplateRef getSecret() {
            return secret;
        }

        public void setSecret(TemplateRef secret) {
            this.secret = secret;
        }

        public String getLiteral() {
            return literal;
        }

        public void setLiteral(String literal) {
            this.literal = literal;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "name", "items" })
    public static class TemplateRef {

        String name;
        List<TemplateRefItem> items;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<TemplateRefItem> getItems() {
            return items;
        }

        public void setItems(List<TemplateRefItem> items) {
            this.items = items;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "key", "templateAs" })
    public static class TemplateRefItem {

        String key;
        TemplateScope templateAs;

        public TemplateRefItem() {
        }

        public TemplateRefItem(String key, TemplateScope templateAs) {
            this.key = key;
            this.templateAs = templateAs;
        }

        @JsonIgnore
        public TemplateScope getTemplateAsOrDefault() {
            return Objects.requireNonNullElse(templateAs, TemplateScope.Values);
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public TemplateScope getTemplateAs() {
            return templateAs;
        }

        public void setTemplateAs(TemplateScope templateAs) {
            this.templateAs = templateAs;
        }
    }
}
