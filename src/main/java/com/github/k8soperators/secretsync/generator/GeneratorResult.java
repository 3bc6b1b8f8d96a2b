package com.github.k8soperators.secretsync.generator;

import java.util.Collections;
import java.util.Map;

public class GeneratorResult {

    private final Map<String, byte[]> data;
    private final Map<String, String> cleanupState;

    public GeneratorResult(Map<String, byte[]> data) {
        this(data, Collections.emptyMap());
    }

    public GeneratorResult(Map<String, byte[]> data, Map<String, String> cleanupState) {
        this.data = data;
        this.cleanupState = cleanupState;
    }

    public Map<String, byte[]> getData() {
        return data;
    }

    public Map<String, String> getCleanupState() {
        return cleanupState;
    }
}
