package com.github.k8soperators.secretsync.events;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.javaoperatorsdk.operator.processing.event.source.AbstractEventSource;
import io.javaoperatorsdk.operator.processing.event.source.IndexerResourceCache;
import io.javaoperatorsdk.operator.processing.event.source.controller.ResourceAction;
import io.javaoperatorsdk.operator.processing.event.source.controller.ResourceEvent;
import org.jboss.logging.Logger;

import java.util.function.BiPredicate;
import java.util.stream.Stream;

/**
 * Requeues every primary resource that references a changed secondary
 * resource.
 *
 * @param <T> secondary resource watched by an informer
 * @param <P> primary resource
 */
public class ReferencingEventSource<T extends HasMetadata, P extends HasMetadata> extends AbstractEventSource implements ResourceEventHandler<T> {

    private final Logger log = Logger.getLogger(getClass());

    protected final IndexerResourceCache<P> primaryCache;
    private final BiPredicate<P, T> isReferenced;

    public ReferencingEventSource(IndexerResourceCache<P> primaryCache, BiPredicate<P, T> isReferenced) {
        this.primaryCache = primaryCache;
        this.isReferenced = isReferenced;
    }

    public ReferencingEventSource<T, P> watch(SharedIndexInformer<? extends T> informer) {
        informer.addEventHandler(this);
        return this;
    }

    @Override
    public void onAdd(T obj) {
        log.debugf("%s{namespace=%s, name=%s}: added", obj.getKind(), obj.getMetadata().getNamespace(), obj.getMetadata().getName());
        getReferencingResources(obj).forEach(this::handleEvent);
    }

    @Override
    public void onUpdate(T oldObj, T obj) {
        log.debugf("%s{namespace=%s, name=%s}: updated", obj.getKind(), obj.getMetadata().getNamespace(), obj.getMetadata().getName());
        getReferencingResources(obj).forEach(this::handleEvent);
    }

    @Override
    public void onDelete(T obj, boolean deletedFinalStateUnknown) {
        log.debugf("%s{namespace=%s, name=%s}: deleted", obj.getKind(), obj.getMetadata().getNamespace(), obj.getMetadata().getName());
        getReferencingResources(obj).forEach(this::handleEvent);
    }

    Stream<P> getReferencingResources(T obj) {
        return primaryCache.list().filter(primary -> isReferenced.test(primary, obj));
    }

    void handleEvent(P primary) {
        getEventHandler().handleEvent(new ResourceEvent(ResourceAction.UPDATED, ResourceID.fromResource(primary), primary));
    }
}
