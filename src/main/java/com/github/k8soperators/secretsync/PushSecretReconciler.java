package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.ClusterSecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.PushRemoteRef;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecret;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretData;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretSpec.DeletionPolicy;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretSpec.UpdatePolicy;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretStatus;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreRef;
import com.github.k8soperators.secretsync.events.ReferencingEventSource;
import com.github.k8soperators.secretsync.events.StoreEventSource;
import com.github.k8soperators.secretsync.generator.GeneratorRegistry;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import com.github.k8soperators.secretsync.store.StoreClientManager;
import com.github.k8soperators.secretsync.store.StoreKey;
import com.github.k8soperators.secretsync.store.StoreResolver;
import com.github.k8soperators.secretsync.transform.KeyConversion;
import com.github.k8soperators.secretsync.transform.template.TemplateEngine;
import com.github.k8soperators.secretsync.transform.template.TemplateRenderer;
import com.github.k8soperators.secretsync.transform.template.TemplateSources;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceInitializer;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Push synchronization: writes the keys of a source {@code Secret} (or of a
 * generator output) to every referenced managed store and tracks what was
 * written in {@code status.syncedPushSecrets} so that removed entries can be
 * cleaned up.
 */
@ControllerConfiguration(name = "pushsecret")
public class PushSecretReconciler extends AbstractSyncReconciler<PushSecret>
        implements Reconciler<PushSecret>, Cleaner<PushSecret>, EventSourceInitializer<PushSecret> {

    static final String MESSAGE_SYNCED = "PushSecret synced successfully";
    static final String MESSAGE_UNCHANGED_SUFFIX = ". Existing secrets in providers unchanged.";
    static final String MESSAGE_SET_FAILED = "set secret failed: ";
    static final String MESSAGE_NO_SOURCE = "could not get source secret";

    private final TemplateRenderer renderer;

    public PushSecretReconciler(KubernetesClient client,
            StoreResolver stores,
            ProviderRegistry providers,
            GeneratorRegistry generators,
            RequeueBackoff backoff) {
        super(client, stores, providers, generators, backoff);
        this.renderer = new TemplateRenderer(new TemplateEngine());
    }

    @Override
    public Map<String, EventSource> prepareEventSources(EventSourceContext<PushSecret> context) {
        StoreEventSource<PushSecret> storeSource = new StoreEventSource<>(context.getPrimaryCache(), PushSecretReconciler::storeRefs)
                .watch(client.resources(SecretStore.class).inAnyNamespace().inform())
                .watch(client.resources(ClusterSecretStore.class).inform());

        ReferencingEventSource<Secret, PushSecret> sourceSecretSource = new ReferencingEventSource<Secret, PushSecret>(context.getPrimaryCache(), PushSecretReconciler::isSourceSecret)
                .watch(client.secrets().inAnyNamespace().inform());

        return Map.of(
                "storeSource", storeSource,
                "sourceSecretSource", sourceSecretSource);
    }

    @Override
    public UpdateControl<PushSecret> reconcile(PushSecret pushSecret, Context<PushSecret> context) {
        PushSecretStatus status = pushSecret.getOrCreateStatus();
        PushSecretSpec spec = pushSecret.getSpec();
        String namespace = pushSecret.getMetadata().getNamespace();
        String name = pushSecret.getMetadata().getName();

        try {
            Duration interval = refreshInterval(pushSecret);
            Instant now = clock.instant();
            Map<String, byte[]> source = readSourceSecret(pushSecret);
            String sourceHash = source == null ? null : Hashes.ofData(source);

            if (!isRefreshDue(pushSecret, sourceHash, interval, now)) {
                log.tracef("PushSecret{namespace=%s, name=%s}: refresh not due", namespace, name);
                return reschedule(UpdateControl.noUpdate(), untilNextRefresh(status, interval, now));
            }

            List<GenericStore> referenced = stores.resolve(storeRefs(pushSecret), namespace);
            Map<StoreKey, GenericStore> managed = new LinkedHashMap<>();
            List<StoreKey> unmanaged = new ArrayList<>();

            for (GenericStore store : referenced) {
                if (stores.isManaged(store)) {
                    managed.put(StoreKey.of(store), store);
                } else {
                    unmanaged.add(StoreKey.of(store));
                }
            }

            if (managed.isEmpty() && !referenced.isEmpty()) {
                log.debugf("PushSecret{namespace=%s, name=%s}: all stores are managed by another controller, skipping", namespace, name);
                return UpdateControl.noUpdate();
            }

            if (source == null) {
                source = SyncException.during("generator", () -> generators.generate(namespace, spec.getSelector().getGeneratorRef()).getData());
            }

            Map<String, byte[]> values = source;
            Map<String, byte[]> rendered = SyncException.during("template",
                    () -> renderer.render(spec.getTemplate(), values, TemplateSources.resolve(client, namespace, spec.getTemplate())).getData());

            Map<String, PushSecretData> desired = desiredEntries(pushSecret);
            Map<String, Map<String, PushSecretData>> previous = status.getSyncedPushSecrets() == null
                    ? Map.of()
                    : status.getSyncedPushSecrets();
            Map<String, Map<String, PushSecretData>> synced = new TreeMap<>();
            List<SyncException> errors = new ArrayList<>();

            for (StoreKey key : unmanaged) {
                Optional.ofNullable(previous.get(key.toString())).ifPresent(entries -> synced.put(key.toString(), entries));
            }

            try (StoreClientManager clients = newClientManager(namespace)) {
                removeOrphans(pushSecret, previous, desired, managed, unmanaged, clients, synced, errors);

                for (Map.Entry<StoreKey, GenericStore> store : managed.entrySet()) {
                    clients.checkDeadline("push to " + store.getKey());
                    Map<String, PushSecretData> storeEntries = synced.computeIfAbsent(store.getKey().toString(), k -> new TreeMap<>());
                    Map<String, PushSecretData> storePrevious = previous.getOrDefault(store.getKey().toString(), Map.of());
                    push(pushSecret, store.getValue(), rendered, desired, storePrevious, clients, storeEntries, errors);
                }
            }

            synced.values().removeIf(Map::isEmpty);
            status.setSyncedPushSecrets(synced);

            if (!errors.isEmpty()) {
                SyncException first = errors.get(0);
                SyncException error = new SyncException(first.getKind(), MESSAGE_SET_FAILED + first.getMessage(), first);
                errors.stream().skip(1).forEach(error::addSuppressed);
                return failed(pushSecret, error);
            }

            String message = spec.getUpdatePolicyOrDefault() == UpdatePolicy.IfNotExists
                    ? MESSAGE_SYNCED + MESSAGE_UNCHANGED_SUFFIX
                    : MESSAGE_SYNCED;

            status.markReady(PushSecretStatus.REASON_SYNCED, message);
            status.setRefreshTime(now.toString());
            status.setSyncedResourceVersion(resourceVersion(pushSecret));
            status.setSyncedSourceHash(sourceHash);
            backoff.onSuccess(pushSecret);

            log.debugf("PushSecret{namespace=%s, name=%s}: pushed %d entries to %d stores", namespace, name, desired.size(), managed.size());
            return reschedule(UpdateControl.patchStatus(pushSecret), interval);
        } catch (RuntimeException e) {
            return failed(pushSecret, e);
        }
    }

    @Override
    public DeleteControl cleanup(PushSecret pushSecret, Context<PushSecret> context) {
        if (pushSecret.getSpec() == null || pushSecret.getSpec().getDeletionPolicyOrDefault() != DeletionPolicy.Delete) {
            backoff.forget(pushSecret);
            return DeleteControl.defaultDelete();
        }

        String namespace = pushSecret.getMetadata().getNamespace();
        Map<String, Map<String, PushSecretData>> synced = Optional.ofNullable(pushSecret.getOrCreateStatus().getSyncedPushSecrets())
                .orElseGet(Map::of);
        List<RuntimeException> errors = new ArrayList<>();

        try (StoreClientManager clients = newClientManager(namespace)) {
            for (Map.Entry<String, Map<String, PushSecretData>> entry : synced.entrySet()) {
                Optional<GenericStore> store = existingStore(StoreKey.parse(entry.getKey()), namespace);

                if (store.isEmpty() || !stores.isManaged(store.get())) {
                    continue;
                }

                for (PushSecretData data : entry.getValue().values()) {
                    try {
                        clients.get(store.get()).deleteSecret(data.getRemoteRef());
                        log.debugf("PushSecret{namespace=%s, name=%s}: deleted %s from %s",
                                namespace, pushSecret.getMetadata().getName(), data.getRemoteRef(), entry.getKey());
                    } catch (RuntimeException e) {
                        errors.add(e);
                    }
                }
            }
        } catch (RuntimeException e) {
            errors.add(e);
        }

        if (!errors.isEmpty()) {
            Duration delay = backoff.onFailure(pushSecret);
            log.warnf(errors.get(0), "PushSecret{namespace=%s, name=%s}: %d remote deletions failed, retrying in %s",
                    namespace, pushSecret.getMetadata().getName(), errors.size(), delay);
            return DeleteControl.noFinalizerRemoval().rescheduleAfter(delay);
        }

        backoff.forget(pushSecret);
        return DeleteControl.defaultDelete();
    }

    static Collection<SecretStoreRef> storeRefs(PushSecret pushSecret) {
        return pushSecret.getSpec() == null || pushSecret.getSpec().getSecretStoreRefs() == null
                ? List.of()
                : pushSecret.getSpec().getSecretStoreRefs();
    }

    static boolean isSourceSecret(PushSecret pushSecret, Secret secret) {
        return Objects.equals(pushSecret.getMetadata().getNamespace(), secret.getMetadata().getNamespace())
                && Optional.ofNullable(pushSecret.getSpec())
                    .map(PushSecretSpec::getSelector)
                    .map(PushSecretSpec.Selector::getSecret)
                    .map(PushSecretSpec.SecretSelector::getName)
                    .filter(secret.getMetadata().getName()::equals)
                    .isPresent();
    }

    /**
     * Returns the data of the source secret, or {@code null} when the values
     * come from a generator.
     */
    Map<String, byte[]> readSourceSecret(PushSecret pushSecret) {
        PushSecretSpec.Selector selector = pushSecret.getSpec().getSelector();

        if (selector == null || (selector.getSecret() == null) == (selector.getGeneratorRef() == null)) {
            throw SyncException.validation("selector must set exactly one of secret or generatorRef");
        }

        if (selector.getSecret() == null) {
            return null;
        }

        Secret secret = client.secrets()
                .inNamespace(pushSecret.getMetadata().getNamespace())
                .withName(selector.getSecret().getName())
                .get();

        if (secret == null) {
            throw SyncException.notFound(MESSAGE_NO_SOURCE);
        }

        return decodeData(secret);
    }

    boolean isRefreshDue(PushSecret pushSecret, String sourceHash, Duration interval, Instant now) {
        PushSecretStatus status = pushSecret.getOrCreateStatus();

        if (status.getRefreshTime() == null || !status.isReady() || isVersionChanged(pushSecret)) {
            return true;
        }

        if (sourceHash != null && !sourceHash.equals(status.getSyncedSourceHash())) {
            return true;
        }

        return isIntervalElapsed(status, interval, now);
    }

    /**
     * Status key of an entry: the remote key, plus the property when one is
     * set.
     */
    static String statusKey(PushRemoteRef ref) {
        return ref.getProperty() == null || ref.getProperty().isEmpty()
                ? ref.getRemoteKey()
                : ref.getRemoteKey() + "/" + ref.getProperty();
    }

    static Map<String, PushSecretData> desiredEntries(PushSecret pushSecret) {
        Map<String, PushSecretData> desired = new LinkedHashMap<>();

        for (PushSecretData data : Optional.ofNullable(pushSecret.getSpec().getData()).orElseGet(List::of)) {
            if (data.getRemoteKey() == null || data.getRemoteKey().isEmpty()) {
                throw SyncException.validation("data entry for secret key %s has no remoteKey", data.getSecretKey());
            }
            desired.put(statusKey(data.getRemoteRef()), data);
        }

        return desired;
    }

    /**
     * Entries synced before that are no longer desired: deleted remotely under
     * {@code deletionPolicy=Delete}, forgotten otherwise. Failed deletions stay
     * in the status so they are retried.
     */
    void removeOrphans(PushSecret pushSecret,
            Map<String, Map<String, PushSecretData>> previous,
            Map<String, PushSecretData> desired,
            Map<StoreKey, GenericStore> managed,
            List<StoreKey> unmanaged,
            StoreClientManager clients,
            Map<String, Map<String, PushSecretData>> synced,
            List<SyncException> errors) {

        boolean delete = pushSecret.getSpec().getDeletionPolicyOrDefault() == DeletionPolicy.Delete;
        String namespace = pushSecret.getMetadata().getNamespace();

        for (Map.Entry<String, Map<String, PushSecretData>> entry : previous.entrySet()) {
            StoreKey key = StoreKey.parse(entry.getKey());

            if (unmanaged.contains(key)) {
                continue;
            }

            boolean stillReferenced = managed.containsKey(key);
            Map<String, PushSecretData> orphans = new TreeMap<>(entry.getValue());

            if (stillReferenced) {
                orphans.keySet().removeAll(desired.keySet());
            }

            if (orphans.isEmpty()) {
                continue;
            }

            if (!delete) {
                log.debugf("PushSecret{namespace=%s, name=%s}: forgetting %d entries of %s",
                        namespace, pushSecret.getMetadata().getName(), orphans.size(), key);
                continue;
            }

            Optional<GenericStore> store = stillReferenced ? Optional.of(managed.get(key)) : existingStore(key, namespace);

            if (store.isEmpty()) {
                log.warnf("PushSecret{namespace=%s, name=%s}: %s no longer exists, dropping %d synced entries",
                        namespace, pushSecret.getMetadata().getName(), key, orphans.size());
                continue;
            }

            if (!stores.isManaged(store.get())) {
                continue;
            }

            for (Map.Entry<String, PushSecretData> orphan : orphans.entrySet()) {
                PushRemoteRef ref = orphan.getValue().getRemoteRef();

                try {
                    clients.get(store.get()).deleteSecret(ref);
                    log.infof("PushSecret{namespace=%s, name=%s}: deleted orphaned %s from %s",
                            namespace, pushSecret.getMetadata().getName(), ref, key);
                } catch (RuntimeException e) {
                    SyncException error = SyncException.from(e);
                    errors.add(new SyncException(error.getKind(),
                            String.format("could not delete remote ref %s from secretstore %s: %s", ref.getRemoteKey(), key.getName(), error.getMessage()),
                            e));
                    synced.computeIfAbsent(key.toString(), k -> new TreeMap<>()).put(orphan.getKey(), orphan.getValue());
                }
            }
        }
    }

    Optional<GenericStore> existingStore(StoreKey key, String namespace) {
        try {
            return Optional.of(stores.get(key.toRef(), namespace));
        } catch (SyncException e) {
            if (e.isNotFound()) {
                log.warnf("%s is gone: %s", key, e.getMessage());
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Pushes every desired entry to one store. Entries that fail keep their
     * previous status entry, if any.
     */
    void push(PushSecret pushSecret,
            GenericStore store,
            Map<String, byte[]> source,
            Map<String, PushSecretData> desired,
            Map<String, PushSecretData> previous,
            StoreClientManager clients,
            Map<String, PushSecretData> synced,
            List<SyncException> errors) {

        String storeName = store.getMetadata().getName();
        SecretsClient secrets;

        try {
            secrets = clients.get(store);
        } catch (RuntimeException e) {
            SyncException error = SyncException.from(e);
            errors.add(new SyncException(error.getKind(),
                    String.format("could not get secrets client for store %s: %s", storeName, error.getMessage()), e));
            desired.keySet().forEach(key -> Optional.ofNullable(previous.get(key)).ifPresent(data -> synced.put(key, data)));
            return;
        }

        boolean ifNotExists = pushSecret.getSpec().getUpdatePolicyOrDefault() == UpdatePolicy.IfNotExists;

        for (Map.Entry<String, PushSecretData> entry : desired.entrySet()) {
            PushSecretData data = entry.getValue();

            try {
                byte[] value = value(source, data);

                if (ifNotExists && exists(secrets, data.getRemoteRef())) {
                    log.debugf("PushSecret{namespace=%s, name=%s}: %s already exists in %s, not pushed",
                            pushSecret.getMetadata().getNamespace(), pushSecret.getMetadata().getName(), data.getRemoteRef(), storeName);
                } else {
                    write(secrets, value, data, storeName);
                }

                synced.put(entry.getKey(), data);
            } catch (SyncException e) {
                errors.add(e);
                Optional.ofNullable(previous.get(entry.getKey())).ifPresent(old -> synced.put(entry.getKey(), old));
            }
        }
    }

    /**
     * Value pushed for one entry: one key of the source, or the whole source
     * as a JSON object when no key is given.
     */
    static byte[] value(Map<String, byte[]> source, PushSecretData data) {
        Map<String, byte[]> values = data.getConversionStrategyOrDefault() == PushSecretData.ConversionStrategy.ReverseUnicode
                ? revertKeys(source)
                : source;
        String secretKey = data.getSecretKey();

        if (secretKey == null || secretKey.isEmpty()) {
            Map<String, String> json = new TreeMap<>();
            values.forEach((key, value) -> json.put(key, new String(value, StandardCharsets.UTF_8)));
            return Serialization.asJson(json).getBytes(StandardCharsets.UTF_8);
        }

        byte[] value = values.get(secretKey);

        if (value == null) {
            throw SyncException.notFound("secret key %s does not exist", secretKey);
        }

        return value;
    }

    static Map<String, byte[]> revertKeys(Map<String, byte[]> source) {
        Map<String, byte[]> reverted = new LinkedHashMap<>();
        source.forEach((key, value) -> reverted.put(KeyConversion.fromUnicode(key), value));
        return reverted;
    }

    static boolean exists(SecretsClient secrets, PushRemoteRef ref) {
        try {
            return secrets.secretExists(ref);
        } catch (RuntimeException e) {
            SyncException error = SyncException.from(e);
            throw new SyncException(error.getKind(), "could not verify if secret exists in store: " + error.getMessage(), e);
        }
    }

    static void write(SecretsClient secrets, byte[] value, PushSecretData data, String storeName) {
        try {
            secrets.pushSecret(value, data);
        } catch (RuntimeException e) {
            SyncException error = SyncException.from(e);
            throw new SyncException(error.getKind(),
                    String.format("could not write remote ref %s to target secretstore %s: %s", data.getRemoteKey(), storeName, error.getMessage()),
                    e);
        }
    }
}
