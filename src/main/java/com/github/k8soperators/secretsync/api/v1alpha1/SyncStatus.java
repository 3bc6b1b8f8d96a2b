package com.github.k8soperators.secretsync.api.v1alpha1;

/**
 * Status shared by the pull and push resources: when the last refresh
 * happened and which resource version it was computed from.
 */
public abstract class SyncStatus extends ConditionedStatus {

    String refreshTime;
    String syncedResourceVersion;

    public String getRefreshTime() {
        return refreshTime;
    }

    public void setRefreshTime(String refreshTime) {
        this.refreshTime = refreshTime;
    }

    public String getSyncedResourceVersion() {
        return syncedResourceVersion;
    }

    public void setSyncedResourceVersion(String syncedResourceVersion) {
        this.syncedResourceVersion = syncedResourceVersion;
    }
}
