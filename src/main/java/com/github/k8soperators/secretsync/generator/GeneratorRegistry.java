package com.github.k8soperators.secretsync.generator;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.GeneratorRef;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.jboss.logging.Logger;

import javax.enterprise.inject.Any;
import javax.enterprise.inject.Instance;
import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Resolves a {@link GeneratorRef} to its generator and resource and runs it.
 * Nothing is cached: every call reads the resource and generates anew.
 */
@Singleton
public class GeneratorRegistry {

    private static final Logger log = Logger.getLogger(GeneratorRegistry.class);

    private final Map<String, Generator<?>> generators = new TreeMap<>();
    private final KubernetesClient client;

    @Inject
    public GeneratorRegistry(@Any Instance<Generator<?>> generators, KubernetesClient client) {
        this(generators.stream().collect(Collectors.toList()), client);
    }

    public GeneratorRegistry(Collection<? extends Generator<?>> generators, KubernetesClient client) {
        this.client = client;

        for (Generator<?> generator : generators) {
            if (this.generators.putIfAbsent(generator.kind(), generator) != null) {
                throw new IllegalStateException("generator kind registered twice: " + generator.kind());
            }
        }
    }

    /**
     * Reads the referenced generator resource from {@code namespace} and runs
     * its generator.
     *
     * @throws SyncException VALIDATION for an unknown kind, NOT_FOUND for a missing resource
     */
    public Generated generate(String namespace, GeneratorRef ref) {
        Generator<?> generator = generators.get(ref.getKind());

        if (generator == null) {
            throw SyncException.validation("unknown generator kind %s", ref.getKind());
        }

        if (ref.getApiVersion() != null && !ref.getApiVersion().equals(generator.apiVersion())) {
            throw SyncException.validation("generator %s: unsupported apiVersion %s", ref.getKind(), ref.getApiVersion());
        }

        return run(generator, namespace, ref.getName());
    }

    <T extends HasMetadata> Generated run(Generator<T> generator, String namespace, String name) {
        T resource = client.resources(generator.resourceType()).inNamespace(namespace).withName(name).get();

        if (resource == null) {
            throw SyncException.notFound("generator %s %s/%s not found", generator.kind(), namespace, name);
        }

        GeneratorResult result = generator.generate(resource);
        log.debugf("Generator %s/%s produced %d keys", generator.kind(), name, result.getData().size());

        return new Generated(result.getData(), () -> generator.cleanup(resource, result.getCleanupState()));
    }

    /**
     * Output of one generator invocation with a handle to release it.
     */
    public static class Generated {

        private final Map<String, byte[]> data;
        private final Runnable cleanup;

        public Generated(Map<String, byte[]> data, Runnable cleanup) {
            this.data = data;
            this.cleanup = cleanup;
        }

        public Map<String, byte[]> getData() {
            return data;
        }

        public void cleanup() {
            cleanup.run();
        }
    }
}
