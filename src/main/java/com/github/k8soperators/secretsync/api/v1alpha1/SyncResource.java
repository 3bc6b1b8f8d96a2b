package com.github.k8soperators.secretsync.api.v1alpha1;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Common view of the pull and push resources used by refresh scheduling.
 */
public interface SyncResource extends HasMetadata {

    SyncStatus getOrCreateStatus();

    String getRefreshInterval();

}
