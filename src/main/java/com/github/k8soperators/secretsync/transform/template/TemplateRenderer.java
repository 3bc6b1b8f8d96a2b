package com.github.k8soperators.secretsync.transform.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.Template;
import io.fabric8.kubernetes.client.utils.Serialization;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a target {@link Template} to fetched secret data.
 *
 * <p>
 * Sources are applied in order: {@code templateFrom} entries (later entries
 * override earlier ones), then inline {@code data}. With merge policy
 * {@code Replace} the rendered keys are the whole result; with {@code Merge}
 * they are laid over the fetched data. A template without any data
 * templates passes the fetched data through.
 */
public class TemplateRenderer {

    private final TemplateEngine engine;

    public TemplateRenderer(TemplateEngine engine) {
        this.engine = engine;
    }

    public RenderedTemplate render(Template template, Map<String, byte[]> fetched, TemplateSources sources) {
        if (template == null) {
            return new RenderedTemplate(null, fetched, Collections.emptyMap(), Collections.emptyMap());
        }

        if (!Template.ENGINE_V2.equals(template.getEngineVersionOrDefault())) {
            throw SyncException.validation("unsupported template engine version %s", template.getEngineVersion());
        }

        Map<String, Object> values = values(fetched);
        Map<String, byte[]> rendered = new LinkedHashMap<>();

        for (Template.TemplateFrom from : Objects.requireNonNullElse(template.getTemplateFrom(), List.<Template.TemplateFrom>of())) {
            if (from.getConfigMap() != null) {
                renderItems(from.getConfigMap(), sources::configMapValue, values, rendered);
            }
            if (from.getSecret() != null) {
                renderItems(from.getSecret(), sources::secretValue, values, rendered);
            }
            if (from.getLiteral() != null) {
                renderKeysAndValues("literal", from.getLiteral(), values, rendered);
            }
        }

        if (template.getData() != null) {
            template.getData().forEach((key, text) -> rendered.put(key, bytes(engine.render(key, text, values))));
        }

        Map<String, byte[]> data;

        if (template.getData() == null && template.getTemplateFrom() == null) {
            data = fetched;
        } else if (template.getMergePolicyOrDefault() == Template.MergePolicy.Merge) {
            data = new LinkedHashMap<>(fetched);
            data.putAll(rendered);
        } else {
            data = rendered;
        }

        Template.Metadata metadata = template.getMetadata();

        return new RenderedTemplate(template.getType(),
                data,
                renderStrings("label", metadata == null ? null : metadata.getLabels(), values),
                renderStrings("annotation", metadata == null ? null : metadata.getAnnotations(), values));
    }

    interface SourceLookup {
        String value(String name, String key);
    }

    void renderItems(Template.TemplateRef ref, SourceLookup lookup, Map<String, Object> values, Map<String, byte[]> rendered) {
        for (Template.TemplateRefItem item : Objects.requireNonNullElse(ref.getItems(), List.<Template.TemplateRefItem>of())) {
            String text = lookup.value(ref.getName(), item.getKey());

            if (item.getTemplateAsOrDefault() == Template.TemplateScope.KeysAndValues) {
                renderKeysAndValues(ref.getName() + "/" + item.getKey(), text, values, rendered);
            } else {
                rendered.put(item.getKey(), bytes(engine.render(item.getKey(), text, values)));
            }
        }
    }

    /**
     * Renders a template producing a YAML (or JSON) map and adds its entries.
     */
    void renderKeysAndValues(String name, String text, Map<String, Object> values, Map<String, byte[]> rendered) {
        String output = engine.render(name, text, values);

        if (output.isBlank()) {
            return;
        }

        Map<String, Object> entries;

        try {
            entries = Serialization.yamlMapper().readValue(output, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw SyncException.validation("template %s: output is not a map: %s", name, e.getOriginalMessage());
        }

        if (entries != null) {
            entries.forEach((key, value) -> rendered.put(key, bytes(value instanceof Map || value instanceof List
                    ? Serialization.asJson(value)
                    : TemplateFunctions.string(value))));
        }
    }

    Map<String, String> renderStrings(String kind, Map<String, String> templates, Map<String, Object> values) {
        if (templates == null) {
            return Collections.emptyMap();
        }

        Map<String, String> result = new LinkedHashMap<>();
        templates.forEach((key, text) -> result.put(key, engine.render(kind + " " + key, text, values)));
        return result;
    }

    static Map<String, Object> values(Map<String, byte[]> data) {
        Map<String, Object> values = new LinkedHashMap<>();
        data.forEach((key, value) -> values.put(key, new String(value, StandardCharsets.UTF_8)));
        return values;
    }

    static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
