package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import javax.validation.constraints.NotNull;

import java.util.Objects;

@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "remoteKey", "property" })
public class PushRemoteRef {

    @NotNull
    String remoteKey;
    String property;

    public PushRemoteRef() {
    }

    public PushRemoteRef(String remoteKey, String property) {
        this.remoteKey = remoteKey;
        this.property = property;
    }

    public String getRemoteKey() {
        return remoteKey;
    }

    public void setRemoteKey(String remoteKey) {
        this.remoteKey = remoteKey;
    }

    public String getProperty() {
        return property;
    }

    public void setProperty(String property) {
        this.property = property;
    }

    @Override
    public int hashCode() {
        return Objects.hash(remoteKey, property);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PushRemoteRef)) {
            return false;
        }
        PushRemoteRef other = (PushRemoteRef) obj;
        return Objects.equals(remoteKey, other.remoteKey) && Objects.equals(property, other.property);
    }

    @Override
    public String toString() {
        return property == null ? remoteKey : remoteKey + "[" + property + "]";
    }
}
