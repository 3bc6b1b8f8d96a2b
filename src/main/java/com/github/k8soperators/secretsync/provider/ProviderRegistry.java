package com.github.k8soperators.secretsync.provider;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.StoreProvider;
import org.jboss.logging.Logger;

import javax.enterprise.inject.Any;
import javax.enterprise.inject.Instance;
import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Resolves the provider kind declared by a store to the {@link Provider}
 * that builds its clients.
 */
@Singleton
public class ProviderRegistry {

    private static final Logger log = Logger.getLogger(ProviderRegistry.class);

    private final Map<String, Provider> providers = new TreeMap<>();

    @Inject
    public ProviderRegistry(@Any Instance<Provider> providers) {
        this(providers.stream().collect(Collectors.toList()));
    }

    public ProviderRegistry(Collection<? extends Provider> providers) {
        providers.forEach(this::register);
    }

    public final void register(Provider provider) {
        Provider existing = providers.putIfAbsent(provider.kind(), provider);

        if (existing != null) {
            throw new IllegalStateException(String.format("provider kind %s registered twice: %s, %s",
                    provider.kind(), existing.getClass().getName(), provider.getClass().getName()));
        }

        if (provider.maintenanceStatus() == Provider.MaintenanceStatus.NOT_MAINTAINED) {
            log.warnf("Provider %s is registered but no longer maintained", provider.kind());
        } else {
            log.debugf("Provider %s registered (%s)", provider.kind(), provider.capabilities());
        }
    }

    public Optional<Provider> get(String kind) {
        return Optional.ofNullable(providers.get(kind));
    }

    public Set<String> getKinds() {
        return providers.keySet();
    }

    /**
     * The single provider kind declared by the store.
     */
    public static String kindOf(GenericStore store) {
        StoreProvider provider = store.getSpec() == null ? null : store.getSpec().getProvider();

        if (provider == null || provider.getProviders().size() != 1) {
            throw SyncException.validation("store %s must configure exactly one provider, found %s",
                    store.getMetadata().getName(), provider == null ? "[]" : provider.getProviders().keySet());
        }

        return provider.getProviders().keySet().iterator().next();
    }

    public Provider forStore(GenericStore store) {
        String kind = kindOf(store);

        return get(kind).orElseThrow(() ->
            SyncException.validation("store %s uses unknown provider %s", store.getMetadata().getName(), kind));
    }
}
