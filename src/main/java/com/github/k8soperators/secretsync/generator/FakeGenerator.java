package com.github.k8soperators.secretsync.generator;

import com.github.k8soperators.secretsync.api.generators.v1alpha1.Fake;

import javax.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns the configured data verbatim. Meant for tests and demos.
 */
@ApplicationScoped
public class FakeGenerator implements Generator<Fake> {

    @Override
    public Class<Fake> resourceType() {
        return Fake.class;
    }

    @Override
    public GeneratorResult generate(Fake resource) {
        Map<String, byte[]> data = new LinkedHashMap<>();

        if (resource.getSpec() != null && resource.getSpec().getData() != null) {
            resource.getSpec().getData().forEach((k, v) -> data.put(k, v.getBytes(StandardCharsets.UTF_8)));
        }

        return new GeneratorResult(data);
    }
}
