package com.github.k8soperators.secretsync;

import java.util.function.Supplier;

/**
 * Failure raised anywhere in the synchronization engine. The {@link Kind}
 * tells the reconcilers whether the failure is a soft miss, a configuration
 * problem or a backend problem; all kinds are retried with backoff.
 */
public class SyncException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Remote key or property is absent. */
        NOT_FOUND,
        /** Credentials were rejected by the backend. */
        AUTH,
        /** Network, rate limit or deadline problems. */
        TRANSIENT,
        /** Malformed resource or store configuration. */
        VALIDATION,
        /** Merge rule collision, or a target owned by another controller. */
        CONFLICT
    }

    private final Kind kind;

    public SyncException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SyncException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static SyncException notFound(String format, Object... args) {
        return new SyncException(Kind.NOT_FOUND, String.format(format, args));
    }

    public static SyncException auth(String format, Object... args) {
        return new SyncException(Kind.AUTH, String.format(format, args));
    }

    public static SyncException transientError(String format, Object... args) {
        return new SyncException(Kind.TRANSIENT, String.format(format, args));
    }

    public static SyncException validation(String format, Object... args) {
        return new SyncException(Kind.VALIDATION, String.format(format, args));
    }

    public static SyncException conflict(String format, Object... args) {
        return new SyncException(Kind.CONFLICT, String.format(format, args));
    }

    /**
     * Converts any exception into a {@code SyncException}, keeping the kind of
     * an existing one and treating everything else as transient.
     */
    public static SyncException from(Exception e) {
        if (e instanceof SyncException) {
            return (SyncException) e;
        }
        return new SyncException(Kind.TRANSIENT, String.valueOf(e.getMessage()), e);
    }

    /**
     * Runs one pipeline stage, tagging any failure with the stage name.
     */
    public static <T> T during(String stage, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw from(e).wrap(stage);
        }
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }

    /**
     * Prefix the message with some context ("rewrite", "store foo", ...) and
     * keep the kind.
     */
    public SyncException wrap(String context) {
        return new SyncException(kind, context + ": " + getMessage(), this);
    }
}
