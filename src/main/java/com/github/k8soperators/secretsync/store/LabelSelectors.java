package com.github.k8soperators.secretsync.store;

import com.github.k8soperators.secretsync.SyncException;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class LabelSelectors {

    private LabelSelectors() {
    }

    public static boolean matches(LabelSelector selector, Map<String, String> labels) {
        Map<String, String> actual = Objects.requireNonNullElse(labels, Collections.emptyMap());

        if (selector.getMatchLabels() != null
                && !actual.entrySet().containsAll(selector.getMatchLabels().entrySet())) {
            return false;
        }

        for (LabelSelectorRequirement requirement : Objects.requireNonNullElse(selector.getMatchExpressions(), List.<LabelSelectorRequirement>of())) {
            if (!matches(requirement, actual)) {
                return false;
            }
        }

        return true;
    }

    static boolean matches(LabelSelectorRequirement requirement, Map<String, String> labels) {
        String value = labels.get(requirement.getKey());
        List<String> values = Objects.requireNonNullElse(requirement.getValues(), List.of());

        switch (requirement.getOperator()) {
        case "In":
            return value != null && values.contains(value);
        case "NotIn":
            return value == null || !values.contains(value);
        case "Exists":
            return labels.containsKey(requirement.getKey());
        case "DoesNotExist":
            return !labels.containsKey(requirement.getKey());
        default:
            throw SyncException.validation("unsupported label selector operator %s", requirement.getOperator());
        }
    }
}
