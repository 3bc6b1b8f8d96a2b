package com.github.k8soperators.secretsync.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.Rewrite;
import com.github.k8soperators.secretsync.provider.SecretValues;
import com.github.k8soperators.secretsync.transform.template.TemplateEngine;
import io.fabric8.kubernetes.client.utils.Serialization;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies {@code dataFrom[].rewrite} rules, in declaration order, to the keys
 * (and for merges, the values) of one fetched data set.
 */
public class Rewriter {

    private static final Pattern GROUP_REFERENCE = Pattern.compile("\\$\\{(\\d+)\\}");

    private final TemplateEngine engine;

    public Rewriter(TemplateEngine engine) {
        this.engine = engine;
    }

    public Map<String, byte[]> rewrite(List<Rewrite> rewrites, Map<String, byte[]> data) {
        Map<String, byte[]> current = data;

        for (Rewrite rewrite : Objects.requireNonNullElse(rewrites, List.<Rewrite>of())) {
            if (rewrite.getRegexp() != null) {
                current = regexp(rewrite.getRegexp(), current);
            } else if (rewrite.getTransform() != null) {
                current = transform(rewrite.getTransform(), current);
            } else if (rewrite.getMerge() != null) {
                current = merge(rewrite.getMerge(), current);
            } else {
                throw SyncException.validation("rewrite rule must set one of regexp, transform or merge");
            }
        }

        return current;
    }

    Map<String, byte[]> regexp(Rewrite.Regexp rule, Map<String, byte[]> data) {
        Pattern pattern;

        try {
            pattern = Pattern.compile(Objects.requireNonNullElse(rule.getSource(), ""));
        } catch (PatternSyntaxException e) {
            throw SyncException.validation("invalid regexp %s: %s", rule.getSource(), e.getDescription());
        }

        String replacement = GROUP_REFERENCE.matcher(Objects.requireNonNullElse(rule.getTarget(), "")).replaceAll("\\$$1");
        Map<String, byte[]> result = new LinkedHashMap<>();

        data.forEach((key, value) -> {
            String rewritten;

            try {
                rewritten = pattern.matcher(key).replaceAll(replacement);
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                throw SyncException.validation("invalid regexp target %s: %s", rule.getTarget(), e.getMessage());
            }

            result.put(requireKey(rewritten, key), value);
        });

        return result;
    }

    Map<String, byte[]> transform(Rewrite.Transform rule, Map<String, byte[]> data) {
        Map<String, byte[]> result = new LinkedHashMap<>();

        data.forEach((key, value) -> {
            Map<String, Object> context = new HashMap<>();
            context.put("value", key);
            result.put(requireKey(engine.render(key, rule.getTemplate(), context), key), value);
        });

        return result;
    }

    /**
     * Folds every value into one document. Non-priority keys are merged in
     * lexical order, then priority keys from last to first, so the first
     * priority key has the final word.
     */
    Map<String, byte[]> merge(Rewrite.Merge rule, Map<String, byte[]> data) {
        List<String> priority = Objects.requireNonNullElse(rule.getPriority(), List.of());
        List<String> order = new ArrayList<>(new TreeSet<>(data.keySet()));
        order.removeAll(priority);

        for (int i = priority.size() - 1; i >= 0; i--) {
            if (data.containsKey(priority.get(i))) {
                order.add(priority.get(i));
            }
        }

        Rewrite.MergeStrategy strategy = rule.getStrategyOrDefault();

        if (strategy != Rewrite.MergeStrategy.Extract && (rule.getInto() == null || rule.getInto().isEmpty())) {
            throw SyncException.validation("merge strategy %s requires into", strategy);
        }

        Map<String, byte[]> result = new LinkedHashMap<>();

        if (strategy == Rewrite.MergeStrategy.Append) {
            ArrayNode merged = Serialization.jsonMapper().createArrayNode();

            for (String key : order) {
                JsonNode node = parse(key, data.get(key));

                if (node.isArray()) {
                    merged.addAll((ArrayNode) node);
                } else {
                    merged.add(node);
                }
            }

            result.put(rule.getInto(), SecretValues.toBytes(merged));
            return result;
        }

        ObjectNode merged = Serialization.jsonMapper().createObjectNode();
        Map<String, String> origin = new HashMap<>();

        for (String key : order) {
            JsonNode node = parse(key, data.get(key));

            if (!node.isObject()) {
                throw SyncException.validation("merge: value of %s is not a JSON object", key);
            }

            boolean isPriority = priority.contains(key);
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();

            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String previous = origin.get(field.getKey());

                if (previous != null && !isPriority && !priority.contains(previous)
                        && rule.getConflictPolicyOrDefault() == Rewrite.ConflictPolicy.Error) {
                    throw SyncException.conflict("merge: key %s defined in both %s and %s", field.getKey(), previous, key);
                }

                merged.set(field.getKey(), field.getValue());
                origin.put(field.getKey(), key);
            }
        }

        if (strategy == Rewrite.MergeStrategy.JSON) {
            result.put(rule.getInto(), SecretValues.toBytes(merged));
        } else {
            merged.fields().forEachRemaining(field -> result.put(field.getKey(), SecretValues.toBytes(field.getValue())));
        }

        return result;
    }

    static JsonNode parse(String key, byte[] value) {
        try {
            return SecretValues.parse(value);
        } catch (SyncException e) {
            throw e.wrap("merge: value of " + key);
        }
    }

    static String requireKey(String rewritten, String original) {
        if (rewritten == null || rewritten.isEmpty()) {
            throw SyncException.validation("key %s rewritten to an empty key", original);
        }
        return rewritten;
    }
}
