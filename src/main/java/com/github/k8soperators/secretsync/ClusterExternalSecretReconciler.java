package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.ClusterExternalSecret;
import com.github.k8soperators.secretsync.api.v1alpha1.ClusterExternalSecretSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.ClusterExternalSecretSpec.ExternalSecretMetadata;
import com.github.k8soperators.secretsync.api.v1alpha1.ClusterExternalSecretStatus;
import com.github.k8soperators.secretsync.api.v1alpha1.ClusterExternalSecretStatus.NamespaceFailure;
import com.github.k8soperators.secretsync.api.v1alpha1.ConditionedStatus;
import com.github.k8soperators.secretsync.api.v1alpha1.Durations;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecret;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretSpec;
import com.github.k8soperators.secretsync.events.ReferencingEventSource;
import com.github.k8soperators.secretsync.store.LabelSelectors;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceInitializer;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provisions an owned {@link ExternalSecret} in every namespace selected by a
 * {@link ClusterExternalSecret} and removes it from namespaces that are no
 * longer selected. Provisioned resources are garbage collected with their
 * owner.
 */
@ControllerConfiguration(name = "clusterexternalsecret")
public class ClusterExternalSecretReconciler
        implements Reconciler<ClusterExternalSecret>, EventSourceInitializer<ClusterExternalSecret> {

    public static final String LABEL_KEY_OWNER = "secretsync.k8soperators.github.com/cluster-external-secret";

    static final Duration DEFAULT_REFRESH_TIME = Duration.ofMinutes(1);
    static final String MESSAGE_PROVISIONED = "external secrets provisioned in all selected namespaces";
    static final String MESSAGE_PARTIALLY_PROVISIONED = "one or more namespaces failed";

    private static final Logger log = Logger.getLogger(ClusterExternalSecretReconciler.class);

    private final KubernetesClient client;

    public ClusterExternalSecretReconciler(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Map<String, EventSource> prepareEventSources(EventSourceContext<ClusterExternalSecret> context) {
        ReferencingEventSource<Namespace, ClusterExternalSecret> namespaceSource =
                new ReferencingEventSource<Namespace, ClusterExternalSecret>(context.getPrimaryCache(), ClusterExternalSecretReconciler::isRelevant)
                    .watch(client.namespaces().inform());

        ReferencingEventSource<ExternalSecret, ClusterExternalSecret> provisionedSource =
                new ReferencingEventSource<ExternalSecret, ClusterExternalSecret>(context.getPrimaryCache(), ClusterExternalSecret::isControllingOwner)
                    .watch(client.resources(ExternalSecret.class).inAnyNamespace().withLabel(LABEL_KEY_OWNER).inform());

        return Map.of(
                "namespaceSource", namespaceSource,
                "provisionedSource", provisionedSource);
    }

    @Override
    public UpdateControl<ClusterExternalSecret> reconcile(ClusterExternalSecret resource, Context<ClusterExternalSecret> context) {
        String name = resource.getMetadata().getName();
        ClusterExternalSecretStatus status = resource.getOrCreateStatus();
        ClusterExternalSecretSpec spec = Optional.ofNullable(resource.getSpec()).orElseGet(ClusterExternalSecretSpec::new);
        String externalSecretName = resource.getExternalSecretName();
        Duration refreshTime = DEFAULT_REFRESH_TIME;

        try {
            refreshTime = Durations.parse(spec.getRefreshTime(), DEFAULT_REFRESH_TIME);

            if (spec.getExternalSecretSpec() == null) {
                throw SyncException.validation("ClusterExternalSecret %s has no externalSecretSpec", name);
            }

            String previousName = status.getExternalSecretName();

            if (previousName != null && !previousName.equals(externalSecretName)) {
                log.infof("ClusterExternalSecret{name=%s}: ExternalSecret renamed from %s to %s", name, previousName, externalSecretName);
                status.getProvisionedNamespaces().forEach(namespace -> deleteProvisioned(resource, namespace, previousName));
                status.setProvisionedNamespaces(new ArrayList<>());
            }

            Set<String> targets = targetNamespaces(spec);

            for (String namespace : status.getProvisionedNamespaces()) {
                if (!targets.contains(namespace)) {
                    deleteProvisioned(resource, namespace, externalSecretName);
                }
            }

            List<String> provisioned = new ArrayList<>();
            List<NamespaceFailure> failed = new ArrayList<>();

            for (String namespace : targets) {
                try {
                    provision(resource, namespace, externalSecretName);
                    provisioned.add(namespace);
                } catch (RuntimeException e) {
                    SyncException error = SyncException.from(e);
                    log.warnf("ClusterExternalSecret{name=%s}: could not provision namespace %s: %s", name, namespace, error.getMessage());
                    failed.add(new NamespaceFailure(namespace, error.getMessage()));
                }
            }

            status.setExternalSecretName(externalSecretName);
            status.setProvisionedNamespaces(provisioned);
            status.setFailedNamespaces(failed);

            if (failed.isEmpty()) {
                status.markReady(ClusterExternalSecretStatus.REASON_PROVISIONED, MESSAGE_PROVISIONED);
            } else {
                status.updateCondition(ConditionedStatus.CONDITION_READY, ConditionedStatus.STATUS_FALSE,
                        ClusterExternalSecretStatus.REASON_PARTIALLY_PROVISIONED, MESSAGE_PARTIALLY_PROVISIONED);
            }

            log.debugf("ClusterExternalSecret{name=%s}: provisioned %s, failed %d", name, provisioned, failed.size());
        } catch (RuntimeException e) {
            SyncException error = SyncException.from(e);
            log.infof("ClusterExternalSecret{name=%s}: %s", name, error.getMessage());
            status.markErrored(error.getMessage());
        }

        return UpdateControl.patchStatus(resource).rescheduleAfter(refreshTime);
    }

    /**
     * Active namespaces that are listed by name or match one of the
     * selectors, in name order.
     */
    Set<String> targetNamespaces(ClusterExternalSecretSpec spec) {
        Set<String> result = new TreeSet<>();

        for (Namespace namespace : client.namespaces().list().getItems()) {
            if (namespace.getMetadata().getDeletionTimestamp() == null && selects(spec, namespace)) {
                result.add(namespace.getMetadata().getName());
            }
        }

        return result;
    }

    static boolean selects(ClusterExternalSecretSpec spec, Namespace namespace) {
        if (spec.getNamespaces() != null && spec.getNamespaces().contains(namespace.getMetadata().getName())) {
            return true;
        }

        List<LabelSelector> selectors = new ArrayList<>();
        Optional.ofNullable(spec.getNamespaceSelectors()).ifPresent(selectors::addAll);
        Optional.ofNullable(spec.getNamespaceSelector()).ifPresent(selectors::add);

        return selectors.stream().anyMatch(selector -> LabelSelectors.matches(selector, namespace.getMetadata().getLabels()));
    }

    static boolean isRelevant(ClusterExternalSecret resource, Namespace namespace) {
        boolean provisioned = Optional.ofNullable(resource.getStatus())
                .map(ClusterExternalSecretStatus::getProvisionedNamespaces)
                .map(namespaces -> namespaces.contains(namespace.getMetadata().getName()))
                .orElse(false);

        return provisioned || (resource.getSpec() != null && selects(resource.getSpec(), namespace));
    }

    void provision(ClusterExternalSecret resource, String namespace, String externalSecretName) {
        ExternalSecret existing = client.resources(ExternalSecret.class).inNamespace(namespace).withName(externalSecretName).get();

        if (existing != null && !resource.isControllingOwner(existing)) {
            throw SyncException.conflict("ExternalSecret %s already exists in namespace %s and is not owned by ClusterExternalSecret %s",
                    externalSecretName, namespace, resource.getMetadata().getName());
        }

        ExternalSecretSpec desiredSpec = Serialization.clone(resource.getSpec().getExternalSecretSpec());
        Map<String, String> labels = new HashMap<>();
        Map<String, String> annotations = new HashMap<>();
        ExternalSecretMetadata metadata = resource.getSpec().getExternalSecretMetadata();

        if (metadata != null) {
            Optional.ofNullable(metadata.getLabels()).ifPresent(labels::putAll);
            Optional.ofNullable(metadata.getAnnotations()).ifPresent(annotations::putAll);
        }

        labels.put(LABEL_KEY_OWNER, resource.getMetadata().getName());

        if (existing == null) {
            ExternalSecret created = new ExternalSecret();
            created.setMetadata(new ObjectMetaBuilder()
                    .withNamespace(namespace)
                    .withName(externalSecretName)
                    .withLabels(labels)
                    .withAnnotations(annotations)
                    .withOwnerReferences(resource.controllerReference())
                    .build());
            created.setSpec(desiredSpec);
            client.resource(created).create();
            log.debugf("ExternalSecret{namespace=%s, name=%s}: created", namespace, externalSecretName);
            return;
        }

        ObjectMeta current = existing.getMetadata();
        boolean unchanged = Objects.equals(Serialization.asJson(existing.getSpec()), Serialization.asJson(desiredSpec))
                && containsAll(current.getLabels(), labels)
                && containsAll(current.getAnnotations(), annotations);

        if (unchanged) {
            log.tracef("ExternalSecret{namespace=%s, name=%s}: unchanged", namespace, externalSecretName);
            return;
        }

        existing.setSpec(desiredSpec);
        current.setLabels(merged(current.getLabels(), labels));
        current.setAnnotations(merged(current.getAnnotations(), annotations));
        client.resource(existing).update();
        log.debugf("ExternalSecret{namespace=%s, name=%s}: updated", namespace, externalSecretName);
    }

    void deleteProvisioned(ClusterExternalSecret resource, String namespace, String externalSecretName) {
        ExternalSecret existing = client.resources(ExternalSecret.class).inNamespace(namespace).withName(externalSecretName).get();

        if (existing != null && resource.isControllingOwner(existing)) {
            log.infof("ExternalSecret{namespace=%s, name=%s}: deleting, no longer selected by ClusterExternalSecret %s",
                    namespace, externalSecretName, resource.getMetadata().getName());
            client.resource(existing).delete();
        }
    }

    static boolean containsAll(Map<String, String> actual, Map<String, String> expected) {
        return expected.isEmpty() || (actual != null && actual.entrySet().containsAll(expected.entrySet()));
    }

    static Map<String, String> merged(Map<String, String> current, Map<String, String> additions) {
        Map<String, String> result = new HashMap<>(Objects.requireNonNullElse(current, Map.of()));
        result.putAll(additions);
        return result;
    }
}
