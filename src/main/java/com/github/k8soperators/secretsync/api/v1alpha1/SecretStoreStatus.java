package com.github.k8soperators.secretsync.api.v1alpha1;

public class SecretStoreStatus extends ConditionedStatus {

    public static final String REASON_VALID = "Valid";
    public static final String REASON_INVALID_PROVIDER_CONFIG = "InvalidProviderConfig";

    String capabilities;

    public String getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(String capabilities) {
        this.capabilities = capabilities;
    }
}
