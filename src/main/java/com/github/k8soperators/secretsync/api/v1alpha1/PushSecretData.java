package com.github.k8soperators.secretsync.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import javax.validation.constraints.NotNull;

import java.util.Objects;

/**
 * Maps one key of the source secret (or the whole secret when
 * {@code match.secretKey} is empty) to a remote key.
 */
@JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "match", "conversionStrategy" })
public class PushSecretData {

    public enum ConversionStrategy {
        None,
        ReverseUnicode
    }

    @NotNull
    Match match;
    ConversionStrategy conversionStrategy;

    public PushSecretData() {
    }

    public PushSecretData(String secretKey, String remoteKey) {
        this.match = new Match(secretKey, new PushRemoteRef(remoteKey, null));
    }

    @JsonIgnore
    public ConversionStrategy getConversionStrategyOrDefault() {
        return Objects.requireNonNullElse(conversionStrategy, ConversionStrategy.None);
    }

    @JsonIgnore
    public String getSecretKey() {
        return match == null ? null : match.getSecretKey();
    }

    @JsonIgnore
    public PushRemoteRef getRemoteRef() {
        return match == null ? null : match.getRemoteRef();
    }

    @JsonIgnore
    public String getRemoteKey() {
        PushRemoteRef ref = getRemoteRef();
        return ref == null ? null : ref.getRemoteKey();
    }

    public Match getMatch() {
        return match;
    }

    public void setMatch(Match match) {
        this.match = match;
    }

    public ConversionStrategy getConversionStrategy() {
        return conversionStrategy;
    }

    public void setConversionStrategy(ConversionStrategy conversionStrategy) {
        this.conversionStrategy = conversionStrategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(match, conversionStrategy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PushSecretData)) {
            return false;
        }
        PushSecretData other = (PushSecretData) obj;
        return Objects.equals(match, other.match) && conversionStrategy == other.conversionStrategy;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({ "secretKey", "remoteRef" })
    public static class Match {

        String secretKey;
        @NotNull
        PushRemoteRef remoteRef;

        public Match() {
        }

        public Match(String secretKey, PushRemoteRef remoteRef) {
            this.secretKey = secretKey;
            this.remoteRef = remoteRef;
        }

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey;
        }

        public PushRemoteRef getRemoteRef() {
            return remoteRef;
        }

        public void setRemoteRef(PushRemoteRef remoteRef) {
            this.remoteRef = remoteRef;
        }

        @Override
        public int hashCode() {
            return Objects.hash(secretKey, remoteRef);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Match)) {
                return false;
            }
            Match other = (Match) obj;
            return Objects.equals(secretKey, other.secretKey) && Objects.equals(remoteRef, other.remoteRef);
        }
    }
}
