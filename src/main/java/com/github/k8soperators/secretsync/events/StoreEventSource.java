package com.github.k8soperators.secretsync.events;

import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreRef;
import com.github.k8soperators.secretsync.store.LabelSelectors;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.javaoperatorsdk.operator.processing.event.source.IndexerResourceCache;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Function;

/**
 * Requeues the resources referring to a store, by name or label selector,
 * when the store changes.
 */
public class StoreEventSource<P extends HasMetadata> extends ReferencingEventSource<GenericStore, P> {

    public StoreEventSource(IndexerResourceCache<P> primaryCache, Function<P, Collection<SecretStoreRef>> storeRefs) {
        super(primaryCache, (primary, store) -> isReferenced(primary, store, storeRefs.apply(primary)));
    }

    @Override
    public StoreEventSource<P> watch(SharedIndexInformer<? extends GenericStore> informer) {
        super.watch(informer);
        return this;
    }

    static boolean isReferenced(HasMetadata primary, GenericStore store, Collection<SecretStoreRef> refs) {
        if (!store.isClusterScoped() && !Objects.equals(primary.getMetadata().getNamespace(), store.getMetadata().getNamespace())) {
            return false;
        }

        return refs.stream()
                .filter(ref -> ref.getKindOrDefault().equals(store.getKind()))
                .anyMatch(ref -> ref.getLabelSelector() != null
                        ? LabelSelectors.matches(ref.getLabelSelector(), store.getMetadata().getLabels())
                        : Objects.equals(ref.getName(), store.getMetadata().getName()));
    }
}
