package com.github.k8soperators.secretsync.generator;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.Map;

/**
 * Produces secret material from a generator resource. Generators are CDI
 * beans, looked up by the kind of their resource type.
 *
 * @param <T> the generator resource
 */
public interface Generator<T extends HasMetadata> {

    Class<T> resourceType();

    default String kind() {
        return HasMetadata.getKind(resourceType());
    }

    default String apiVersion() {
        return HasMetadata.getApiVersion(resourceType());
    }

    GeneratorResult generate(T resource);

    /**
     * Releases whatever {@link #generate(HasMetadata)} issued, using the state
     * it returned. Generators without external side effects keep the default.
     */
    default void cleanup(T resource, Map<String, String> state) {
    }

}
