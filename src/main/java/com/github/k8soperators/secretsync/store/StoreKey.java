package com.github.k8soperators.secretsync.store;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreRef;

import java.util.Objects;

/**
 * Identifies a store within the namespace of the resource using it, rendered
 * as {@code <Kind>/<name>}.
 */
public final class StoreKey implements Comparable<StoreKey> {

    private final String kind;
    private final String name;

    private StoreKey(String kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    public static StoreKey of(String kind, String name) {
        return new StoreKey(kind, name);
    }

    public static StoreKey of(GenericStore store) {
        return new StoreKey(store.getKind(), store.getMetadata().getName());
    }

    public static StoreKey parse(String key) {
        int slash = key.indexOf('/');

        if (slash <= 0 || slash == key.length() - 1) {
            throw SyncException.validation("invalid store key %s", key);
        }

        return new StoreKey(key.substring(0, slash), key.substring(slash + 1));
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public SecretStoreRef toRef() {
        return new SecretStoreRef(name, kind);
    }

    @Override
    public int compareTo(StoreKey other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StoreKey)) {
            return false;
        }
        StoreKey other = (StoreKey) obj;
        return kind.equals(other.kind) && name.equals(other.name);
    }

    @Override
    public String toString() {
        return kind + "/" + name;
    }
}
