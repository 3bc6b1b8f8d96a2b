package com.github.k8soperators.secretsync.api.v1alpha1;

import java.util.Map;
import java.util.TreeMap;

public class PushSecretStatus extends SyncStatus {

    /**
     * Store key ({@code <Kind>/<name>}) to remote key to the descriptor that
     * produced it.
     */
    Map<String, Map<String, PushSecretData>> syncedPushSecrets = new TreeMap<>();
    String syncedSourceHash;

    public Map<String, Map<String, PushSecretData>> getSyncedPushSecrets() {
        return syncedPushSecrets;
    }

    public void setSyncedPushSecrets(Map<String, Map<String, PushSecretData>> syncedPushSecrets) {
        this.syncedPushSecrets = syncedPushSecrets;
    }

    public String getSyncedSourceHash() {
        return syncedSourceHash;
    }

    public void setSyncedSourceHash(String syncedSourceHash) {
        this.syncedSourceHash = syncedSourceHash;
    }
}
