package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import javax.validation.constraints.NotNull;

import java.util.Objects;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "key", "property", "version", "decodingStrategy", "conversionStrategy", "metadataPolicy" })
public class RemoteRef {

    @NotNull
    String key;
    String property;
    String version;
    DecodingStrategy decodingStrategy;
    ConversionStrategy conversionStrategy;
    MetadataPolicy metadataPolicy;

    public RemoteRef() {
    }

    public RemoteRef(String key, String property) {
        this.key = key;
        this.property = property;
    }

    @JsonIgnore
    public DecodingStrategy getDecodingStrategyOrDefault() {
        return Objects.requireNonNullElse(decodingStrategy, DecodingStrategy.None);
    }

    @JsonIgnore
    public ConversionStrategy getConversionStrategyOrDefault() {
        return Objects.requireNonNullElse(conversionStrategy, ConversionStrategy.Default);
    }

    @JsonIgnore
    public MetadataPolicy getMetadataPolicyOrDefault() {
        return Objects.requireNonNullElse(metadataPolicy, MetadataPolicy.None);
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getProperty() {
        return property;
    }

    public void setProperty(String property) {
        this.property = property;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public DecodingStrategy getDecodingStrategy() {
        return decodingStrategy;
    }

    public void setDecodingStrategy(DecodingStrategy decodingStrategy) {
        this.decodingStrategy = decodingStrategy;
    }

    public ConversionStrategy getConversionStrategy() {
        return conversionStrategy;
    }

    public void setConversionStrategy(ConversionStrategy conversionStrategy) {
        this.conversionStrategy = conversionStrategy;
    }

    public MetadataPolicy getMetadataPolicy() {
        return metadataPolicy;
    }

    public void setMetadataPolicy(MetadataPolicy metadataPolicy) {
        this.metadataPolicy = metadataPolicy;
    }

    @Override
    public String toString() {
        return property == null ? key : key + "[" + property + "]";
    }
}
