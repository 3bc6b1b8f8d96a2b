package com.github.k8soperators.secretsync.events;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.javaoperatorsdk.operator.processing.event.source.IndexerResourceCache;

import java.util.function.BiPredicate;

/**
 * Watches target secrets written by the engine and requeues their
 * controlling owner when one is modified or deleted.
 */
public class OwnedSecretEventSource<P extends HasMetadata> extends ReferencingEventSource<Secret, P> {

    public OwnedSecretEventSource(IndexerResourceCache<P> primaryCache, BiPredicate<P, Secret> isControllingOwner) {
        super(primaryCache, isControllingOwner);
    }

    @Override
    public OwnedSecretEventSource<P> watch(SharedIndexInformer<? extends Secret> informer) {
        super.watch(informer);
        return this;
    }
}
