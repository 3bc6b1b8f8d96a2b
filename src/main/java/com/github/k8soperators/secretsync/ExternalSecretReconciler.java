package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.ClusterSecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.ConditionedStatus;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecret;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretData;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretDataFrom;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretStatus;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretTarget;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretTarget.CreationPolicy;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretTarget.DeletionPolicy;
import com.github.k8soperators.secretsync.api.v1alpha1.FindSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.RemoteRef;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreRef;
import com.github.k8soperators.secretsync.api.v1alpha1.SourceRef;
import com.github.k8soperators.secretsync.api.v1alpha1.Template;
import com.github.k8soperators.secretsync.events.OwnedSecretEventSource;
import com.github.k8soperators.secretsync.events.StoreEventSource;
import com.github.k8soperators.secretsync.generator.GeneratorRegistry;
import com.github.k8soperators.secretsync.generator.GeneratorRegistry.Generated;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import com.github.k8soperators.secretsync.store.StoreClientManager;
import com.github.k8soperators.secretsync.store.StoreKey;
import com.github.k8soperators.secretsync.store.StoreResolver;
import com.github.k8soperators.secretsync.transform.Decoding;
import com.github.k8soperators.secretsync.transform.KeyConversion;
import com.github.k8soperators.secretsync.transform.Rewriter;
import com.github.k8soperators.secretsync.transform.template.RenderedTemplate;
import com.github.k8soperators.secretsync.transform.template.TemplateEngine;
import com.github.k8soperators.secretsync.transform.template.TemplateRenderer;
import com.github.k8soperators.secretsync.transform.template.TemplateSources;
import io.fabric8.kubernetes.api.model.LocalObjectReference;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceInitializer;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pull synchronization: fetches remote values through the referenced stores
 * and generators, runs them through the rewrite and template pipeline and
 * writes the target {@code Secret}.
 */
@ControllerConfiguration(name = "externalsecret")
public class ExternalSecretReconciler extends AbstractSyncReconciler<ExternalSecret>
        implements Reconciler<ExternalSecret>, Cleaner<ExternalSecret>, EventSourceInitializer<ExternalSecret> {

    public static final String ANNOTATION_DATA_HASH = "secretsync.k8soperators.github.com/data-hash";

    static final String MESSAGE_SYNCED = "secret synced";
    static final String MESSAGE_DELETED = "secret deleted because data was empty";

    private final Rewriter rewriter;
    private final TemplateRenderer renderer;

    public ExternalSecretReconciler(KubernetesClient client,
            StoreResolver stores,
            ProviderRegistry providers,
            GeneratorRegistry generators,
            RequeueBackoff backoff) {
        super(client, stores, providers, generators, backoff);
        TemplateEngine engine = new TemplateEngine();
        this.rewriter = new Rewriter(engine);
        this.renderer = new TemplateRenderer(engine);
    }

    @Override
    public Map<String, EventSource> prepareEventSources(EventSourceContext<ExternalSecret> context) {
        StoreEventSource<ExternalSecret> storeSource = new StoreEventSource<>(context.getPrimaryCache(), ExternalSecretReconciler::storeRefs)
                .watch(client.resources(SecretStore.class).inAnyNamespace().inform())
                .watch(client.resources(ClusterSecretStore.class).inform());

        OwnedSecretEventSource<ExternalSecret> targetSource = new OwnedSecretEventSource<>(context.getPrimaryCache(), ExternalSecret::isControllingOwner)
                .watch(client.secrets().inAnyNamespace().withLabel(LABEL_KEY_MANAGED_BY, SECRETSYNC).inform());

        return Map.of(
                "storeSource", storeSource,
                "targetSource", targetSource);
    }

    @Override
    public UpdateControl<ExternalSecret> reconcile(ExternalSecret externalSecret, Context<ExternalSecret> context) {
        ExternalSecretStatus status = externalSecret.getOrCreateStatus();
        String namespace = externalSecret.getMetadata().getNamespace();
        String name = externalSecret.getMetadata().getName();

        try {
            Map<StoreKey, GenericStore> referenced = resolveStores(externalSecret);
            Optional<StoreKey> unmanaged = referenced.entrySet()
                    .stream()
                    .filter(entry -> !stores.isManaged(entry.getValue()))
                    .map(Map.Entry::getKey)
                    .findFirst();

            if (unmanaged.isPresent()) {
                log.debugf("ExternalSecret{namespace=%s, name=%s}: store %s is managed by another controller, skipping",
                        namespace, name, unmanaged.get());
                return UpdateControl.noUpdate();
            }

            Duration interval = refreshInterval(externalSecret);
            Secret existing = client.secrets().inNamespace(namespace).withName(externalSecret.getTargetName()).get();
            Instant now = clock.instant();

            if (!isRefreshDue(externalSecret, existing, interval, now)) {
                log.tracef("ExternalSecret{namespace=%s, name=%s}: refresh not due", namespace, name);
                return reschedule(UpdateControl.noUpdate(), periodic(externalSecret) ? untilNextRefresh(status, interval, now) : Duration.ZERO);
            }

            sync(externalSecret, referenced, existing);

            status.setRefreshTime(now.toString());
            status.setSyncedResourceVersion(resourceVersion(externalSecret));
            status.setBinding(new LocalObjectReference(externalSecret.getTargetName()));
            backoff.onSuccess(externalSecret);

            return reschedule(UpdateControl.patchStatus(externalSecret), periodic(externalSecret) ? interval : Duration.ZERO);
        } catch (RuntimeException e) {
            return failed(externalSecret, e);
        }
    }

    @Override
    public DeleteControl cleanup(ExternalSecret externalSecret, Context<ExternalSecret> context) {
        ExternalSecretTarget target = Optional.ofNullable(externalSecret.getSpec())
                .map(ExternalSecretSpec::getTarget)
                .orElseGet(ExternalSecretTarget::new);
        CreationPolicy creationPolicy = target.getCreationPolicyOrDefault();

        try {
            if (target.getDeletionPolicyOrDefault() == DeletionPolicy.Delete
                    && (creationPolicy == CreationPolicy.Owner || creationPolicy == CreationPolicy.Orphan)) {
                Secret existing = client.secrets()
                        .inNamespace(externalSecret.getMetadata().getNamespace())
                        .withName(externalSecret.getTargetName())
                        .get();

                if (existing != null && isManagedSecret(existing) && existing.getMetadata().getDeletionTimestamp() == null) {
                    log.infof("Secret{namespace=%s, name=%s}: deleting target of removed ExternalSecret",
                            existing.getMetadata().getNamespace(), existing.getMetadata().getName());
                    client.resource(existing).delete();
                }
            }
        } catch (RuntimeException e) {
            Duration delay = backoff.onFailure(externalSecret);
            log.warnf(e, "ExternalSecret{namespace=%s, name=%s}: target cleanup failed, retrying in %s",
                    externalSecret.getMetadata().getNamespace(), externalSecret.getMetadata().getName(), delay);
            return DeleteControl.noFinalizerRemoval().rescheduleAfter(delay);
        }

        backoff.forget(externalSecret);
        return DeleteControl.defaultDelete();
    }

    static Collection<SecretStoreRef> storeRefs(ExternalSecret externalSecret) {
        ExternalSecretSpec spec = externalSecret.getSpec();

        if (spec == null) {
            return List.of();
        }

        return Stream.concat(
                    Stream.of(spec.getSecretStoreRef()),
                    Stream.concat(
                            nonNull(spec.getData()).stream().map(ExternalSecretData::getSourceRef),
                            nonNull(spec.getDataFrom()).stream().map(ExternalSecretDataFrom::getSourceRef))
                        .filter(Objects::nonNull)
                        .map(SourceRef::getStoreRef))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * Reads every store the resource refers to. A missing store fails the
     * reconciliation with a message naming it.
     */
    Map<StoreKey, GenericStore> resolveStores(ExternalSecret externalSecret) {
        Map<StoreKey, GenericStore> referenced = new LinkedHashMap<>();
        String namespace = externalSecret.getMetadata().getNamespace();

        for (SecretStoreRef ref : storeRefs(externalSecret)) {
            StoreKey key = StoreKey.of(ref.getKindOrDefault(), ref.getName());

            if (!referenced.containsKey(key)) {
                referenced.put(key, stores.get(ref, namespace));
            }
        }

        return referenced;
    }

    static boolean periodic(ExternalSecret externalSecret) {
        return externalSecret.getSpec().getRefreshPolicyOrDefault() == ExternalSecretSpec.RefreshPolicy.Periodic;
    }

    boolean isRefreshDue(ExternalSecret externalSecret, Secret existing, Duration interval, Instant now) {
        ExternalSecretStatus status = externalSecret.getOrCreateStatus();
        boolean deleted = status.getCondition(ConditionedStatus.CONDITION_READY)
                .map(c -> ConditionedStatus.REASON_DELETED.equals(c.getReason()))
                .orElse(false);

        if (status.getRefreshTime() == null || !(status.isReady() || deleted)) {
            return true;
        }

        boolean writesTarget = externalSecret.getSpec().getOrCreateTarget().getCreationPolicyOrDefault() != CreationPolicy.None;
        boolean targetMissing = writesTarget && !deleted && existing == null;

        switch (externalSecret.getSpec().getRefreshPolicyOrDefault()) {
        case CreatedOnce:
            return targetMissing;
        case OnChange:
            return isVersionChanged(externalSecret);
        case Periodic:
        default:
            return isVersionChanged(externalSecret)
                    || targetMissing
                    || (writesTarget && isModified(existing))
                    || isIntervalElapsed(status, interval, now);
        }
    }

    /**
     * A target whose data no longer matches the hash recorded at the last
     * write was changed by someone else.
     */
    static boolean isModified(Secret existing) {
        if (existing == null || existing.getMetadata().getAnnotations() == null) {
            return false;
        }

        String recorded = existing.getMetadata().getAnnotations().get(ANNOTATION_DATA_HASH);
        return recorded != null && !recorded.equals(Hashes.ofData(decodeData(existing)));
    }

    void sync(ExternalSecret externalSecret, Map<StoreKey, GenericStore> referenced, Secret existing) {
        String namespace = externalSecret.getMetadata().getNamespace();
        List<Generated> generated = new ArrayList<>();

        try {
            Map<String, byte[]> data;

            try (StoreClientManager clients = newClientManager(namespace)) {
                data = fetch(externalSecret, referenced, clients, generated);
            }

            Template template = externalSecret.getSpec().getOrCreateTarget().getTemplate();
            RenderedTemplate rendered = SyncException.during("template",
                    () -> renderer.render(template, data, TemplateSources.resolve(client, namespace, template)));

            write(externalSecret, existing, rendered);
        } catch (RuntimeException e) {
            for (Generated output : generated) {
                try {
                    output.cleanup();
                } catch (RuntimeException cleanupFailure) {
                    log.warnf(cleanupFailure, "ExternalSecret{namespace=%s, name=%s}: generator cleanup failed",
                            namespace, externalSecret.getMetadata().getName());
                    e.addSuppressed(cleanupFailure);
                }
            }
            throw e;
        }
    }

    /**
     * Fetches {@code dataFrom} entries, then {@code data} entries, each in
     * declaration order. Later keys override earlier ones.
     */
    Map<String, byte[]> fetch(ExternalSecret externalSecret,
            Map<StoreKey, GenericStore> referenced,
            StoreClientManager clients,
            List<Generated> generated) {

        ExternalSecretSpec spec = externalSecret.getSpec();
        String namespace = externalSecret.getMetadata().getNamespace();
        Map<String, byte[]> result = new LinkedHashMap<>();

        for (ExternalSecretDataFrom from : nonNull(spec.getDataFrom())) {
            clients.checkDeadline("dataFrom");
            Map<String, byte[]> values;

            if (from.getGeneratorRef() != null) {
                Generated output = SyncException.during("generator", () -> generators.generate(namespace, from.getGeneratorRef()));
                generated.add(output);
                values = output.getData();
            } else if (from.getExtract() != null) {
                values = extract(from.getExtract(), clients.get(store(externalSecret, referenced, from.getSourceRef())));
            } else if (from.getFind() != null) {
                values = find(from.getFind(), clients.get(store(externalSecret, referenced, from.getSourceRef())));
            } else {
                throw SyncException.validation("dataFrom entry must set extract, find or sourceRef.generatorRef");
            }

            Map<String, byte[]> fetched = values;
            result.putAll(SyncException.during("rewrite", () -> rewriter.rewrite(from.getRewrite(), fetched)));
        }

        DeletionPolicy deletionPolicy = spec.getOrCreateTarget().getDeletionPolicyOrDefault();

        for (ExternalSecretData entry : nonNull(spec.getData())) {
            clients.checkDeadline("data");

            if (entry.getSourceRef() != null && entry.getSourceRef().getGeneratorRef() != null) {
                throw SyncException.validation("data entry %s: generatorRef is only supported in dataFrom", entry.getSecretKey());
            }

            RemoteRef ref = entry.getRemoteRef();
            SecretsClient secrets = clients.get(store(externalSecret, referenced, entry.getSourceRef()));
            byte[] value;

            try {
                value = secrets.getSecret(ref);
            } catch (SyncException e) {
                if (e.isNotFound() && deletionPolicy != DeletionPolicy.Retain) {
                    log.debugf("ExternalSecret{namespace=%s, name=%s}: %s not found, omitting key %s",
                            namespace, externalSecret.getMetadata().getName(), ref, entry.getSecretKey());
                    continue;
                }
                throw e.wrap("extract " + ref);
            }

            result.put(entry.getSecretKey(),
                    SyncException.during("decode", () -> Decoding.decode(entry.getSecretKey(), value, ref.getDecodingStrategyOrDefault())));
        }

        return result;
    }

    static Map<String, byte[]> extract(RemoteRef ref, SecretsClient secrets) {
        Map<String, byte[]> values = SyncException.during("extract", () -> secrets.getSecretMap(ref));
        Map<String, byte[]> decoded = SyncException.during("decode", () -> Decoding.decode(values, ref.getDecodingStrategyOrDefault()));
        return SyncException.during("convert", () -> KeyConversion.convert(decoded, ref.getConversionStrategyOrDefault()));
    }

    static Map<String, byte[]> find(FindSpec find, SecretsClient secrets) {
        Map<String, byte[]> values = SyncException.during("find", () -> secrets.getAllSecrets(find));
        Map<String, byte[]> decoded = SyncException.during("decode", () -> Decoding.decode(values, find.getDecodingStrategyOrDefault()));
        return SyncException.during("convert", () -> KeyConversion.convertFound(decoded, find.getConversionStrategyOrDefault()));
    }

    static GenericStore store(ExternalSecret externalSecret, Map<StoreKey, GenericStore> referenced, SourceRef sourceRef) {
        SecretStoreRef ref = Optional.ofNullable(sourceRef)
                .map(SourceRef::getStoreRef)
                .orElseGet(() -> externalSecret.getSpec().getSecretStoreRef());

        if (ref == null) {
            throw SyncException.validation("no secretStoreRef given");
        }

        return referenced.get(StoreKey.of(ref.getKindOrDefault(), ref.getName()));
    }

    void write(ExternalSecret externalSecret, Secret existing, RenderedTemplate rendered) {
        ExternalSecretTarget target = externalSecret.getSpec().getOrCreateTarget();
        ExternalSecretStatus status = externalSecret.getOrCreateStatus();
        CreationPolicy creationPolicy = target.getCreationPolicyOrDefault();
        String namespace = externalSecret.getMetadata().getNamespace();
        String targetName = externalSecret.getTargetName();

        if (target.getDeletionPolicyOrDefault() == DeletionPolicy.Delete && rendered.getData().isEmpty()) {
            if (existing != null && isManagedSecret(existing)) {
                log.infof("Secret{namespace=%s, name=%s}: deleted, no data left to sync", namespace, targetName);
                client.resource(existing).delete();
            }
            status.updateCondition(ConditionedStatus.CONDITION_READY, ConditionedStatus.STATUS_FALSE, ConditionedStatus.REASON_DELETED, MESSAGE_DELETED);
            return;
        }

        if (creationPolicy == CreationPolicy.None) {
            log.tracef("ExternalSecret{namespace=%s, name=%s}: creationPolicy None, nothing written", namespace, externalSecret.getMetadata().getName());
            status.markReady(ConditionedStatus.REASON_SYNCED, MESSAGE_SYNCED);
            return;
        }

        if (creationPolicy == CreationPolicy.Merge && existing == null) {
            throw SyncException.notFound("target secret %s does not exist: creationPolicy=Merge", targetName);
        }

        if (creationPolicy == CreationPolicy.Owner && existing != null) {
            Optional<OwnerReference> otherController = externalSecret.otherController(existing);

            if (otherController.isPresent()) {
                throw SyncException.conflict("target secret %s is already owned by %s %s",
                        targetName, otherController.get().getKind(), otherController.get().getName());
            }
        }

        Secret desired = desiredSecret(externalSecret, existing, rendered);

        if (existing == null) {
            client.resource(desired).create();
            log.debugf("Secret{namespace=%s, name=%s}: created", namespace, targetName);
        } else if (hasDesiredState(existing, desired)) {
            log.tracef("Secret{namespace=%s, name=%s}: unchanged", namespace, targetName);
        } else if (Boolean.TRUE.equals(existing.getImmutable())) {
            throw SyncException.validation("target secret %s is immutable and cannot be updated", targetName);
        } else {
            logChanged(existing, desired);
            client.resource(desired).update();
        }

        status.markReady(ConditionedStatus.REASON_SYNCED, MESSAGE_SYNCED);
    }

    Secret desiredSecret(ExternalSecret externalSecret, Secret existing, RenderedTemplate rendered) {
        ExternalSecretTarget target = externalSecret.getSpec().getOrCreateTarget();
        CreationPolicy creationPolicy = target.getCreationPolicyOrDefault();
        Map<String, byte[]> data;

        if (creationPolicy == CreationPolicy.Merge) {
            data = decodeData(existing);
            data.putAll(rendered.getData());
        } else {
            data = rendered.getData();
        }

        String type = Optional.ofNullable(rendered.getType())
                .or(() -> Optional.ofNullable(existing).map(Secret::getType))
                .orElse("Opaque");

        SecretBuilder builder = Optional.ofNullable(existing)
                .map(SecretBuilder::new)
                .orElseGet(SecretBuilder::new)
                .editOrNewMetadata()
                    .withNamespace(externalSecret.getMetadata().getNamespace())
                    .withName(externalSecret.getTargetName())
                    .addToLabels(rendered.getLabels())
                    .addToAnnotations(rendered.getAnnotations())
                    .addToAnnotations(ANNOTATION_DATA_HASH, Hashes.ofData(data))
                .endMetadata()
                .withType(type)
                .withData(encodeData(data))
                .withStringData(null);

        if (creationPolicy != CreationPolicy.Merge) {
            builder.editMetadata().addToLabels(LABEL_KEY_MANAGED_BY, SECRETSYNC).endMetadata();
        }

        if (target.isImmutable()) {
            builder.withImmutable(Boolean.TRUE);
        }

        Secret desired = builder.build();

        if (creationPolicy == CreationPolicy.Owner) {
            externalSecret.own(desired);
        } else if (desired.getMetadata().getOwnerReferences() != null) {
            desired.getMetadata().getOwnerReferences().removeIf(ref -> Objects.equals(ref.getUid(), externalSecret.getMetadata().getUid()));
        }

        return desired;
    }

    static boolean hasDesiredState(Secret current, Secret desired) {
        return Objects.equals(current.getData(), desired.getData())
                && Objects.equals(current.getType(), desired.getType())
                && Objects.equals(current.getImmutable(), desired.getImmutable())
                && Objects.equals(current.getMetadata().getLabels(), desired.getMetadata().getLabels())
                && Objects.equals(current.getMetadata().getAnnotations(), desired.getMetadata().getAnnotations())
                && Objects.equals(current.getMetadata().getOwnerReferences(), desired.getMetadata().getOwnerReferences());
    }

    static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
