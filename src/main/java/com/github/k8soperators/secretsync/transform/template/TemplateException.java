package com.github.k8soperators.secretsync.transform.template;

/**
 * Parse or execution failure inside one template. Converted into a
 * validation error carrying the template name by {@link TemplateEngine}.
 */
class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    TemplateException(String format, Object... args) {
        super(String.format(format, args));
    }

    TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
