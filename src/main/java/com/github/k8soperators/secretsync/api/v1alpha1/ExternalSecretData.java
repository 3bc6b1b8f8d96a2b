package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import javax.validation.constraints.NotNull;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "secretKey", "remoteRef", "sourceRef" })
public class ExternalSecretData {

    @NotNull
    String secretKey;
    @NotNull
    RemoteRef remoteRef;
    SourceRef sourceRef;

    public ExternalSecretData() {
    }

    public ExternalSecretData(String secretKey, RemoteRef remoteRef) {
        this.secretKey = secretKey;
        this.remoteRef = remoteRef;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public RemoteRef getRemoteRef() {
        return remoteRef;
    }

    public void setRemoteRef(RemoteRef remoteRef) {
        this.remoteRef = remoteRef;
    }

    public SourceRef getSourceRef() {
        return sourceRef;
    }

    public void setSourceRef(SourceRef sourceRef) {
        this.sourceRef = sourceRef;
    }
}
