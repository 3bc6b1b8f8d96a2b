package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Map;
import java.util.Objects;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "path", "name", "tags", "conversionStrategy", "decodingStrategy" })
public class FindSpec {

    String path;
    FindName name;
    Map<String, String> tags;
    ConversionStrategy conversionStrategy;
    DecodingStrategy decodingStrategy;

    @JsonIgnore
    public String getNameRegexp() {
        return name == null ? null : name.getRegexp();
    }

    @JsonIgnore
    public DecodingStrategy getDecodingStrategyOrDefault() {
        return Objects.requireNonNullElse(decodingStrategy, DecodingStrategy.None);
    }

    @JsonIgnore
    public ConversionStrategy getConversionStrategyOrDefault() {
        return Objects.requireNonNullElse(conversionStrategy, ConversionStrategy.Default);
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public FindName getName() {
        return name;
    }

    public void setName(FindName name) {
        this.name = name;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public void setTags(Map<String, String> tags) {
        this.tags = tags;
    }

    public ConversionStrategy getConversionStrategy() {
        return conversionStrategy;
    }

    public void setConversionStrategy(ConversionStrategy conversionStrategy) {
        this.conversionStrategy = conversionStrategy;
    }

    public DecodingStrategy getDecodingStrategy() {
        return decodingStrategy;
    }

    public void setDecodingStrategy(DecodingStrategy decodingStrategy) {
        this.decodingStrategy = decodingStrategy;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FindName {

        String regexp;

        public FindName() {
        }

        public FindName(String regexp) {
            this.regexp = regexp;
        }

        public String getRegexp() {
            return regexp;
        }

        public void setRegexp(String regexp) {
            this.regexp = regexp;
        }
    }
}
