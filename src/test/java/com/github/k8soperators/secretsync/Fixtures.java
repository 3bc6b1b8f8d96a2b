package com.github.k8soperators.secretsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.k8soperators.secretsync.api.v1alpha1.ClusterSecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.StoreProvider;
import com.github.k8soperators.secretsync.provider.fake.FakeProvider;
import com.github.k8soperators.secretsync.provider.fake.FakeProviderConfig;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.utils.Serialization;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for the stores and secrets used across the tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static SecretStore fakeStore(String namespace, String name, FakeProviderConfig.Entry... entries) {
        SecretStore store = new SecretStore();
        store.setMetadata(new ObjectMetaBuilder().withNamespace(namespace).withName(name).build());
        store.setSpec(fakeSpec(entries));
        return store;
    }

    public static ClusterSecretStore fakeClusterStore(String name, FakeProviderConfig.Entry... entries) {
        ClusterSecretStore store = new ClusterSecretStore();
        store.setMetadata(new ObjectMetaBuilder().withName(name).build());
        store.setSpec(fakeSpec(entries));
        return store;
    }

    public static SecretStoreSpec fakeSpec(FakeProviderConfig.Entry... entries) {
        FakeProviderConfig config = new FakeProviderConfig();
        config.getData().addAll(Arrays.asList(entries));
        SecretStoreSpec spec = new SecretStoreSpec();
        spec.setProvider(new StoreProvider(FakeProvider.KIND, Serialization.jsonMapper().valueToTree(config)));
        return spec;
    }

    public static FakeProviderConfig.Entry entry(String key, String value) {
        return new FakeProviderConfig.Entry(key, value);
    }

    public static JsonNode json(String text) {
        try {
            return Serialization.jsonMapper().readTree(text);
        } catch (IOException e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    public static Secret secret(String namespace, String name, String... keysAndValues) {
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            data.put(keysAndValues[i], Base64.getEncoder().encodeToString(bytes(keysAndValues[i + 1])));
        }
        return new SecretBuilder()
                .withNewMetadata()
                    .withNamespace(namespace)
                    .withName(name)
                .endMetadata()
                .withData(data)
                .build();
    }

    public static String value(Secret secret, String key) {
        return text(Base64.getDecoder().decode(secret.getData().get(key)));
    }

    public static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
