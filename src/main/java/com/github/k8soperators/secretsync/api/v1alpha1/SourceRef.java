package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * Overrides the default store of an {@link ExternalSecret} for one data entry,
 * or replaces the store lookup with a generator.
 */
@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "storeRef", "generatorRef" })
public class SourceRef {

    SecretStoreRef storeRef;
    GeneratorRef generatorRef;

    public SecretStoreRef getStoreRef() {
        return storeRef;
    }

    public void setStoreRef(SecretStoreRef storeRef) {
        this.storeRef = storeRef;
    }

    public GeneratorRef getGeneratorRef() {
        return generatorRef;
    }

    public void setGeneratorRef(GeneratorRef generatorRef) {
        this.generatorRef = generatorRef;
    }
}
