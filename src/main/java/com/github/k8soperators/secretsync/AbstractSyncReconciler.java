package com.github.k8soperators.secretsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.k8soperators.secretsync.api.v1alpha1.Durations;
import com.github.k8soperators.secretsync.api.v1alpha1.SyncResource;
import com.github.k8soperators.secretsync.api.v1alpha1.SyncStatus;
import com.github.k8soperators.secretsync.generator.GeneratorRegistry;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.store.StoreClientManager;
import com.github.k8soperators.secretsync.store.StoreResolver;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.fabric8.zjsonpatch.JsonDiff;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import javax.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Collaborators and refresh bookkeeping shared by the pull and push
 * reconcilers.
 */
abstract class AbstractSyncReconciler<R extends SyncResource> {

    public static final String LABEL_KEY_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String SECRETSYNC = "secretsync";

    protected final Logger log = Logger.getLogger(getClass());

    protected final KubernetesClient client;
    protected final StoreResolver stores;
    protected final ProviderRegistry providers;
    protected final GeneratorRegistry generators;
    protected final RequeueBackoff backoff;

    @Inject
    @ConfigProperty(name = "secretsync.reconcile-timeout", defaultValue = "30s")
    Duration reconcileTimeout;

    @Inject
    @ConfigProperty(name = "secretsync.default-refresh-interval", defaultValue = "1h")
    Duration defaultRefreshInterval;

    Clock clock = Clock.systemUTC();

    protected AbstractSyncReconciler(KubernetesClient client,
            StoreResolver stores,
            ProviderRegistry providers,
            GeneratorRegistry generators,
            RequeueBackoff backoff) {
        this.client = client;
        this.stores = stores;
        this.providers = providers;
        this.generators = generators;
        this.backoff = backoff;
    }

    StoreClientManager newClientManager(String namespace) {
        return new StoreClientManager(providers, client, namespace, clock.instant().plus(reconcileTimeout), clock);
    }

    Duration refreshInterval(R resource) {
        return Durations.parse(resource.getRefreshInterval(), defaultRefreshInterval);
    }

    /**
     * Generation plus a hash of labels and annotations: changes whenever the
     * spec or the metadata of the resource changes.
     */
    static String resourceVersion(HasMetadata resource) {
        return resource.getMetadata().getGeneration()
                + "-" + Hashes.ofStrings(resource.getMetadata().getLabels(), resource.getMetadata().getAnnotations());
    }

    static boolean isVersionChanged(SyncResource resource) {
        return !Objects.equals(resource.getOrCreateStatus().getSyncedResourceVersion(), resourceVersion(resource));
    }

    Optional<Instant> nextRefresh(SyncStatus status, Duration interval) {
        if (interval.isZero() || status.getRefreshTime() == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(Instant.parse(status.getRefreshTime()).plus(interval));
        } catch (DateTimeParseException e) {
            log.debugf("Ignoring unparseable refresh time %s", status.getRefreshTime());
            return Optional.empty();
        }
    }

    boolean isIntervalElapsed(SyncStatus status, Duration interval, Instant now) {
        if (interval.isZero()) {
            return false;
        }
        return nextRefresh(status, interval).map(next -> !next.isAfter(now)).orElse(true);
    }

    Duration untilNextRefresh(SyncStatus status, Duration interval, Instant now) {
        return nextRefresh(status, interval)
                .map(next -> Duration.between(now, next))
                .filter(delay -> !delay.isNegative())
                .orElse(Duration.ZERO);
    }

    static <P extends HasMetadata> UpdateControl<P> reschedule(UpdateControl<P> control, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return control;
        }
        return control.rescheduleAfter(delay);
    }

    /**
     * Records a failed attempt in the {@code Ready} condition and requeues
     * with backoff.
     */
    UpdateControl<R> failed(R resource, RuntimeException cause) {
        SyncException error = SyncException.from(cause);
        Duration delay = backoff.onFailure(resource);

        if (error.getKind() == SyncException.Kind.TRANSIENT && !(cause instanceof SyncException)) {
            log.warnf(cause, "%s{namespace=%s, name=%s}: unexpected failure, retrying in %s",
                    resource.getKind(), resource.getMetadata().getNamespace(), resource.getMetadata().getName(), delay);
        } else {
            log.infof("%s{namespace=%s, name=%s}: %s failure, retrying in %s: %s",
                    resource.getKind(), resource.getMetadata().getNamespace(), resource.getMetadata().getName(),
                    error.getKind(), delay, error.getMessage());
        }

        resource.getOrCreateStatus().markErrored(error.getMessage());
        return UpdateControl.patchStatus(resource).rescheduleAfter(delay);
    }

    static boolean isManagedSecret(Secret secret) {
        return Optional.ofNullable(secret.getMetadata().getLabels())
                .map(labels -> labels.get(LABEL_KEY_MANAGED_BY))
                .filter(SECRETSYNC::equals)
                .isPresent();
    }

    static Map<String, byte[]> decodeData(Secret secret) {
        Map<String, byte[]> data = new LinkedHashMap<>();

        if (secret != null) {
            Optional.ofNullable(secret.getData()).orElseGet(Collections::emptyMap)
                .forEach((key, value) -> data.put(key, Base64.getDecoder().decode(value)));
            Optional.ofNullable(secret.getStringData()).orElseGet(Collections::emptyMap)
                .forEach((key, value) -> data.put(key, value.getBytes(StandardCharsets.UTF_8)));
        }

        return data;
    }

    static Map<String, String> encodeData(Map<String, byte[]> data) {
        Map<String, String> encoded = new LinkedHashMap<>();
        data.forEach((key, value) -> encoded.put(key, Base64.getEncoder().encodeToString(value)));
        return encoded;
    }

    /**
     * Debug-logs the difference between two versions of a secret with the
     * data values replaced by hashes.
     */
    void logChanged(Secret current, Secret desired) {
        if (log.isDebugEnabled()) {
            String namespace = desired.getMetadata().getNamespace();
            String name = desired.getMetadata().getName();
            ObjectMapper objectMapper = Serialization.jsonMapper();
            JsonNode currentJson = redact(objectMapper.convertValue(current, JsonNode.class));
            JsonNode desiredJson = redact(objectMapper.convertValue(desired, JsonNode.class));
            JsonNode patch = JsonDiff.asJson(currentJson, desiredJson);
            log.debugf("Secret{namespace=%s, name=%s}: changed =>\n%s", namespace, name, patch.toPrettyString());
        }
    }

    static JsonNode redact(JsonNode secret) {
        JsonNode data = secret.get("data");

        if (data instanceof ObjectNode) {
            ObjectNode redacted = (ObjectNode) data;
            Map<String, String> hashes = new LinkedHashMap<>();
            redacted.fields().forEachRemaining(field ->
                hashes.put(field.getKey(), "sha256:" + Hashes.sha256(field.getValue().asText().getBytes(StandardCharsets.UTF_8)).substring(0, 12)));
            hashes.forEach(redacted::put);
        }

        return secret;
    }
}
