package com.github.k8soperators.secretsync.generator;

import com.github.k8soperators.secretsync.api.generators.v1alpha1.UUID;

import javax.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Generates a random (version 4) UUID under the key {@code uuid}.
 */
@ApplicationScoped
public class UUIDGenerator implements Generator<UUID> {

    public static final String KEY = "uuid";

    @Override
    public Class<UUID> resourceType() {
        return UUID.class;
    }

    @Override
    public GeneratorResult generate(UUID resource) {
        String uuid = java.util.UUID.randomUUID().toString();
        return new GeneratorResult(Map.of(KEY, uuid.getBytes(StandardCharsets.UTF_8)));
    }
}
