package com.github.k8soperators.secretsync.events;

import com.github.k8soperators.secretsync.api.v1alpha1.ClusterSecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecret;
import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecretSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreRef;
import io.fabric8.kubernetes.api.model.LabelSelectorBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.javaoperatorsdk.operator.processing.event.Event;
import io.javaoperatorsdk.operator.processing.event.EventHandler;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.javaoperatorsdk.operator.processing.event.source.IndexerResourceCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StoreEventSourceTest {

    IndexerResourceCache<ExternalSecret> cache;
    EventHandler handler;
    StoreEventSource<ExternalSecret> source;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        cache = mock(IndexerResourceCache.class);
        handler = mock(EventHandler.class);
        source = new StoreEventSource<>(cache, StoreEventSourceTest::refs);
        source.setEventHandler(handler);
    }

    @Test
    void testNamedStoreInSameNamespaceIsReferenced() {
        SecretStoreRef ref = new SecretStoreRef("vault", null);

        assertThat(StoreEventSource.isReferenced(externalSecret("team-a", "es"), store("team-a", "vault", Map.of()), List.of(ref))).isTrue();
        assertThat(StoreEventSource.isReferenced(externalSecret("team-b", "es"), store("team-a", "vault", Map.of()), List.of(ref))).isFalse();
        assertThat(StoreEventSource.isReferenced(externalSecret("team-a", "es"), store("team-a", "other", Map.of()), List.of(ref))).isFalse();
    }

    @Test
    void testKindMustMatch() {
        SecretStoreRef clusterRef = new SecretStoreRef("shared", SecretStoreRef.KIND_CLUSTER_SECRET_STORE);

        assertThat(StoreEventSource.isReferenced(externalSecret("team-a", "es"), store("team-a", "shared", Map.of()), List.of(clusterRef))).isFalse();
        assertThat(StoreEventSource.isReferenced(externalSecret("team-a", "es"), clusterStore("shared"), List.of(clusterRef))).isTrue();
    }

    @Test
    void testLabelSelectorMatchesStoreLabels() {
        SecretStoreRef ref = new SecretStoreRef();
        ref.setLabelSelector(new LabelSelectorBuilder().addToMatchLabels("tier", "db").build());

        assertThat(StoreEventSource.isReferenced(externalSecret("team-a", "es"), store("team-a", "db", Map.of("tier", "db")), List.of(ref))).isTrue();
        assertThat(StoreEventSource.isReferenced(externalSecret("team-a", "es"), store("team-a", "web", Map.of("tier", "web")), List.of(ref))).isFalse();
    }

    @Test
    void testStoreUpdateRequeuesReferencingResources() {
        ExternalSecret first = externalSecret("team-a", "first", new SecretStoreRef("vault", null));
        ExternalSecret second = externalSecret("team-a", "second", new SecretStoreRef("other", null));
        ExternalSecret third = externalSecret("team-a", "third", new SecretStoreRef("vault", null));
        when(cache.list()).thenAnswer(invocation -> List.of(first, second, third).stream());

        SecretStore vault = store("team-a", "vault", Map.of());
        source.onUpdate(vault, vault);

        ArgumentCaptor<Event> events = ArgumentCaptor.forClass(Event.class);
        verify(handler, times(2)).handleEvent(events.capture());
        assertThat(events.getAllValues().stream().map(Event::getRelatedCustomResourceID).collect(Collectors.toList()))
            .containsExactly(ResourceID.fromResource(first), ResourceID.fromResource(third));
    }

    @Test
    void testUnreferencedStoreIsIgnored() {
        ExternalSecret es = externalSecret("team-a", "es", new SecretStoreRef("vault", null));
        when(cache.list()).thenAnswer(invocation -> List.of(es).stream());

        source.onDelete(store("team-a", "unrelated", Map.of()), false);

        verify(handler, never()).handleEvent(any());
    }

    static Collection<SecretStoreRef> refs(ExternalSecret externalSecret) {
        return List.of(externalSecret.getSpec().getSecretStoreRef());
    }

    static ExternalSecret externalSecret(String namespace, String name) {
        return externalSecret(namespace, name, new SecretStoreRef("unused", null));
    }

    static ExternalSecret externalSecret(String namespace, String name, SecretStoreRef ref) {
        ExternalSecret es = new ExternalSecret();
        es.setMetadata(new ObjectMetaBuilder().withNamespace(namespace).withName(name).build());
        ExternalSecretSpec spec = new ExternalSecretSpec();
        spec.setSecretStoreRef(ref);
        es.setSpec(spec);
        return es;
    }

    static SecretStore store(String namespace, String name, Map<String, String> labels) {
        SecretStore store = new SecretStore();
        store.setMetadata(new ObjectMetaBuilder().withNamespace(namespace).withName(name).withLabels(labels).build());
        return store;
    }

    static ClusterSecretStore clusterStore(String name) {
        ClusterSecretStore store = new ClusterSecretStore();
        store.setMetadata(new ObjectMetaBuilder().withName(name).build());
        return store;
    }
}
