package com.github.k8soperators.secretsync.transform.template;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.Template;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Config map and secret contents referenced by {@code templateFrom}, read
 * before rendering so that rendering itself performs no I/O.
 */
public class TemplateSources {

    public static final TemplateSources EMPTY = new TemplateSources(Collections.emptyMap(), Collections.emptyMap());

    private final Map<String, Map<String, String>> configMaps;
    private final Map<String, Map<String, String>> secrets;

    public TemplateSources(Map<String, Map<String, String>> configMaps, Map<String, Map<String, String>> secrets) {
        this.configMaps = configMaps;
        this.secrets = secrets;
    }

    /**
     * Reads every config map and secret referenced by the template from
     * {@code namespace}.
     */
    public static TemplateSources resolve(KubernetesClient client, String namespace, Template template) {
        if (template == null || template.getTemplateFrom() == null) {
            return EMPTY;
        }

        Map<String, Map<String, String>> configMaps = new HashMap<>();
        Map<String, Map<String, String>> secrets = new HashMap<>();

        for (Template.TemplateFrom from : template.getTemplateFrom()) {
            if (from.getConfigMap() != null) {
                String name = from.getConfigMap().getName();
                configMaps.computeIfAbsent(name, n -> readConfigMap(client, namespace, n));
            }
            if (from.getSecret() != null) {
                String name = from.getSecret().getName();
                secrets.computeIfAbsent(name, n -> readSecret(client, namespace, n));
            }
        }

        return new TemplateSources(configMaps, secrets);
    }

    static Map<String, String> readConfigMap(KubernetesClient client, String namespace, String name) {
        ConfigMap configMap = client.configMaps().inNamespace(namespace).withName(name).get();

        if (configMap == null) {
            throw SyncException.notFound("template source ConfigMap %s/%s not found", namespace, name);
        }

        return Optional.ofNullable(configMap.getData()).orElseGet(Collections::emptyMap);
    }

    static Map<String, String> readSecret(KubernetesClient client, String namespace, String name) {
        Secret secret = client.secrets().inNamespace(namespace).withName(name).get();

        if (secret == null) {
            throw SyncException.notFound("template source Secret %s/%s not found", namespace, name);
        }

        Map<String, String> data = new HashMap<>();
        Optional.ofNullable(secret.getData()).ifPresent(d -> d.forEach((k, v) ->
            data.put(k, new String(Base64.getDecoder().decode(v), StandardCharsets.UTF_8))));
        Optional.ofNullable(secret.getStringData()).ifPresent(data::putAll);
        return data;
    }

    String configMapValue(String name, String key) {
        return value(configMaps, "ConfigMap", name, key);
    }

    String secretValue(String name, String key) {
        return value(secrets, "Secret", name, key);
    }

    static String value(Map<String, Map<String, String>> sources, String kind, String name, String key) {
        Map<String, String> source = sources.get(name);

        if (source == null) {
            throw SyncException.notFound("template source %s %s not resolved", kind, name);
        }
        if (!source.containsKey(key)) {
            throw SyncException.notFound("template source %s %s has no key %s", kind, name, key);
        }

        return source.get(key);
    }
}
