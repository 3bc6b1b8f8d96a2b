package com.github.k8soperators.secretsync.api.v1alpha1;

public enum ConversionStrategy {
    Default,
    Unicode
}
