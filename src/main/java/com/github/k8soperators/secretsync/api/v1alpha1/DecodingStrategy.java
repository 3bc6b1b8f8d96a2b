package com.github.k8soperators.secretsync.api.v1alpha1;

public enum DecodingStrategy {
    None,
    Base64,
    Base64URL,
    Auto
}
