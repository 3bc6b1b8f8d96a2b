package com.github.k8soperators.secretsync.transform.template;

import java.util.Map;

public class RenderedTemplate {

    private final String type;
    private final Map<String, byte[]> data;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;

    public RenderedTemplate(String type, Map<String, byte[]> data, Map<String, String> labels, Map<String, String> annotations) {
        this.type = type;
        this.data = data;
        this.labels = labels;
        this.annotations = annotations;
    }

    public String getType() {
        return type;
    }

    public Map<String, byte[]> getData() {
        return data;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }
}
