package com.github.k8soperators.secretsync.transform.template;

import java.util.List;

@FunctionalInterface
public interface TemplateFunction {

    /**
     * @param args evaluated arguments; a piped value is the last one
     */
    Object apply(List<Object> args);

}
