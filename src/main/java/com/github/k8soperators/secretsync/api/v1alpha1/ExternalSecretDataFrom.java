package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Bulk source of keys: {@code extract} expands one remote value into several
 * keys, {@code find} discovers keys across the store, and a
 * {@code sourceRef.generatorRef} invokes a generator instead.
 */
@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "extract", "find", "rewrite", "sourceRef" })
public class ExternalSecretDataFrom {

    RemoteRef extract;
    FindSpec find;
    List<Rewrite> rewrite;
    SourceRef sourceRef;

    @JsonIgnore
    public GeneratorRef getGeneratorRef() {
        return sourceRef == null ? null : sourceRef.getGeneratorRef();
    }

    public RemoteRef getExtract() {
        return extract;
    }

    public void setExtract(RemoteRef extract) {
        this.extract = extract;
    }

    public FindSpec getFind() {
        return find;
    }

    public void setFind(FindSpec find) {
        this.find = find;
    }

    public List<Rewrite> getRewrite() {
        return rewrite;
    }

    public void setRewrite(List<Rewrite> rewrite) {
        this.rewrite = rewrite;
    }

    public SourceRef getSourceRef() {
        return sourceRef;
    }

    public void setSourceRef(SourceRef sourceRef) {
        this.sourceRef = sourceRef;
    }
}
