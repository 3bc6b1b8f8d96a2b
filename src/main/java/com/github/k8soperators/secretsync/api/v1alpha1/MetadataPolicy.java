package com.github.k8soperators.secretsync.api.v1alpha1;

/**
 * Whether a remote reference resolves to the value of a secret or to its
 * metadata (tags, labels) as a JSON object.
 */
public enum MetadataPolicy {
    None,
    Fetch
}
