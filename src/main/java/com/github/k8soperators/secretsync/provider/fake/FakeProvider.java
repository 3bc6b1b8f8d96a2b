package com.github.k8soperators.secretsync.provider.fake;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.provider.Provider;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import com.github.k8soperators.secretsync.provider.StoreContext;
import org.jboss.logging.Logger;

import javax.enterprise.context.ApplicationScoped;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory provider. Read-only entries come from the store configuration,
 * pushed values are kept per store for the lifetime of the process.
 */
@ApplicationScoped
public class FakeProvider implements Provider {

    public static final String KIND = "fake";

    private static final Logger log = Logger.getLogger(FakeProvider.class);

    private final ConcurrentMap<String, ConcurrentMap<String, byte[]>> pushed = new ConcurrentHashMap<>();

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public void validateStore(GenericStore store) {
        FakeProviderConfig config = StoreContext.readConfig(store, KIND, FakeProviderConfig.class);

        for (FakeProviderConfig.Entry entry : config.getData()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw SyncException.validation("fake store %s: entry without key", store.getMetadata().getName());
            }
            if (entry.getValue() != null && entry.getValueMap() != null) {
                throw SyncException.validation("fake store %s: entry %s sets both value and valueMap",
                        store.getMetadata().getName(), entry.getKey());
            }
        }
    }

    @Override
    public SecretsClient newClient(StoreContext context) {
        context.checkDeadline("creating fake client");
        FakeProviderConfig config = context.getConfig(FakeProviderConfig.class);
        String id = storeId(context.getStore());
        log.tracef("Creating fake client for %s", id);
        return new FakeSecretsClient(config, pushed.computeIfAbsent(id, k -> new ConcurrentHashMap<>()));
    }

    static String storeId(GenericStore store) {
        return Objects.requireNonNullElse(store.getMetadata().getNamespace(), "")
                + "/" + store.getKind()
                + "/" + store.getMetadata().getName();
    }
}
