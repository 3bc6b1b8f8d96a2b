package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.generators.v1alpha1.Fake;
import com.github.k8soperators.secretsync.api.generators.v1alpha1.FakeSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.ConditionedStatus;
import com.github.k8soperators.secretsync.api.v1alpha1.GeneratorRef;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.PushRemoteRef;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecret;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretData;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretSpec.DeletionPolicy;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecretSpec.UpdatePolicy;
import com.github.k8soperators.secretsync.api.v1alpha1.RemoteRef;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreRef;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreSpec;
import com.github.k8soperators.secretsync.api.v1alpha1.StoreProvider;
import com.github.k8soperators.secretsync.generator.FakeGenerator;
import com.github.k8soperators.secretsync.generator.GeneratorRegistry;
import com.github.k8soperators.secretsync.provider.Provider;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import com.github.k8soperators.secretsync.provider.StoreContext;
import com.github.k8soperators.secretsync.provider.fake.FakeProvider;
import com.github.k8soperators.secretsync.store.StoreResolver;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import static com.github.k8soperators.secretsync.Fixtures.entry;
import static com.github.k8soperators.secretsync.Fixtures.fakeStore;
import static com.github.k8soperators.secretsync.Fixtures.json;
import static com.github.k8soperators.secretsync.Fixtures.secret;
import static com.github.k8soperators.secretsync.Fixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class PushSecretReconcilerTest {

    static final String NS = "push";
    static final String MOCK = "mock";
    static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    static KubernetesClient client;

    FakeProvider fake;
    SecretsClient remote;
    RequeueBackoff backoff;
    PushSecretReconciler reconciler;
    Context<PushSecret> context;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        fake = new FakeProvider();
        remote = mock(SecretsClient.class);
        Provider mockProvider = mock(Provider.class);
        when(mockProvider.kind()).thenReturn(MOCK);
        when(mockProvider.newClient(any())).thenReturn(remote);

        reconciler = new PushSecretReconciler(client,
                new StoreResolver(client, ""),
                new ProviderRegistry(List.of(fake, mockProvider)),
                new GeneratorRegistry(List.of(new FakeGenerator()), client),
                backoff = new RequeueBackoff(Duration.ofSeconds(5), Duration.ofMinutes(5)));
        reconciler.reconcileTimeout = Duration.ofSeconds(30);
        reconciler.defaultRefreshInterval = Duration.ofHours(1);
        reconciler.clock = Clock.fixed(T0, ZoneOffset.UTC);
        context = mock(Context.class);

        client.resource(mockStore("mock-store")).createOrReplace();
    }

    @Test
    void testPushWritesSourceKey() {
        SecretStore store = client.resource(fakeStore(NS, "written")).createOrReplace();
        client.resource(secret(NS, "written-src", "password", "p4ss")).createOrReplace();
        PushSecret ps = pushSecret("written", "written-src", List.of(ref("written")), new PushSecretData("password", "remote/password"));

        UpdateControl<PushSecret> control = reconciler.reconcile(ps, context);

        assertThat(control.isUpdateStatus()).isTrue();
        assertThat(control.getScheduleDelay()).contains(Duration.ofHours(1).toMillis());
        assertReady(ps, PushSecretReconciler.MESSAGE_SYNCED);
        assertThat(remoteValue(store, "remote/password")).isEqualTo("p4ss");
        assertThat(ps.getStatus().getSyncedPushSecrets())
            .containsOnlyKeys("SecretStore/written")
            .extractingByKey("SecretStore/written")
            .isEqualTo(Map.of("remote/password", new PushSecretData("password", "remote/password")));
        assertThat(ps.getStatus().getSyncedSourceHash()).isNotNull();
    }

    @Test
    void testUnchangedSourceIsNotPushedAgain() {
        client.resource(secret(NS, "steady-src", "password", "p4ss")).createOrReplace();
        PushSecret ps = pushSecret("steady", "steady-src", List.of(ref("mock-store")), new PushSecretData("password", "remote/password"));
        reconciler.reconcile(ps, context);

        UpdateControl<PushSecret> control = reconciler.reconcile(ps, context);

        assertThat(control.isNoUpdate()).isTrue();
        verify(remote, times(1)).pushSecret(any(), any());
    }

    @Test
    void testSourceChangeTriggersPush() {
        SecretStore store = client.resource(fakeStore(NS, "changed")).createOrReplace();
        client.resource(secret(NS, "changed-src", "password", "v1")).createOrReplace();
        PushSecret ps = pushSecret("changed", "changed-src", List.of(ref("changed")), new PushSecretData("password", "remote/password"));
        reconciler.reconcile(ps, context);

        client.resource(secret(NS, "changed-src", "password", "v2")).createOrReplace();
        UpdateControl<PushSecret> control = reconciler.reconcile(ps, context);

        assertThat(control.isUpdateStatus()).isTrue();
        assertThat(remoteValue(store, "remote/password")).isEqualTo("v2");
    }

    @Test
    void testIfNotExistsKeepsExistingRemoteValue() {
        SecretStore store = client.resource(fakeStore(NS, "existing", entry("remote/password", "old"))).createOrReplace();
        client.resource(secret(NS, "existing-src", "password", "new")).createOrReplace();
        PushSecret ps = pushSecret("existing", "existing-src", List.of(ref("existing")), new PushSecretData("password", "remote/password"));
        ps.getSpec().setUpdatePolicy(UpdatePolicy.IfNotExists);

        reconciler.reconcile(ps, context);

        assertReady(ps, PushSecretReconciler.MESSAGE_SYNCED + PushSecretReconciler.MESSAGE_UNCHANGED_SUFFIX);
        assertThat(remoteValue(store, "remote/password")).isEqualTo("old");
        assertThat(ps.getStatus().getSyncedPushSecrets().get("SecretStore/existing")).containsOnlyKeys("remote/password");
    }

    @Test
    void testRemovedEntryIsDeletedOnceUnderDelete() {
        client.resource(secret(NS, "orphan-src", "a", "1", "b", "2")).createOrReplace();
        PushSecret ps = pushSecret("orphan", "orphan-src", List.of(ref("mock-store")),
                new PushSecretData("a", "remote/a"),
                new PushSecretData("b", "remote/b"));
        ps.getSpec().setDeletionPolicy(DeletionPolicy.Delete);
        reconciler.reconcile(ps, context);

        ps.getSpec().setData(List.of(new PushSecretData("a", "remote/a")));
        ps.getMetadata().setGeneration(2L);
        reconciler.reconcile(ps, context);

        ps.getMetadata().setGeneration(3L);
        reconciler.reconcile(ps, context);

        verify(remote, times(1)).deleteSecret(new PushRemoteRef("remote/b", null));
        verify(remote, never()).deleteSecret(new PushRemoteRef("remote/a", null));
        assertThat(ps.getStatus().getSyncedPushSecrets().get("SecretStore/mock-store")).containsOnlyKeys("remote/a");
    }

    @Test
    void testRemovedEntryIsForgottenWithoutDelete() {
        client.resource(secret(NS, "forget-src", "a", "1", "b", "2")).createOrReplace();
        PushSecret ps = pushSecret("forget", "forget-src", List.of(ref("mock-store")),
                new PushSecretData("a", "remote/a"),
                new PushSecretData("b", "remote/b"));
        reconciler.reconcile(ps, context);

        ps.getSpec().setData(List.of(new PushSecretData("a", "remote/a")));
        ps.getMetadata().setGeneration(2L);
        reconciler.reconcile(ps, context);

        verify(remote, never()).deleteSecret(any());
        assertThat(ps.getStatus().getSyncedPushSecrets().get("SecretStore/mock-store")).containsOnlyKeys("remote/a");
    }

    @Test
    void testFailedOrphanDeletionIsRetried() {
        client.resource(secret(NS, "retry-src", "a", "1", "b", "2")).createOrReplace();
        PushSecret ps = pushSecret("retry", "retry-src", List.of(ref("mock-store")),
                new PushSecretData("a", "remote/a"),
                new PushSecretData("b", "remote/b"));
        ps.getSpec().setDeletionPolicy(DeletionPolicy.Delete);
        reconciler.reconcile(ps, context);

        doThrow(SyncException.transientError("backend down")).when(remote).deleteSecret(any());
        ps.getSpec().setData(List.of(new PushSecretData("a", "remote/a")));
        ps.getMetadata().setGeneration(2L);
        UpdateControl<PushSecret> control = reconciler.reconcile(ps, context);

        assertThat(control.getScheduleDelay()).contains(Duration.ofSeconds(5).toMillis());
        assertErrored(ps, "set secret failed: could not delete remote ref remote/b from secretstore mock-store: backend down");
        assertThat(ps.getStatus().getSyncedPushSecrets().get("SecretStore/mock-store")).containsOnlyKeys("remote/a", "remote/b");
    }

    @Test
    void testUnmanagedStoresAreLeftAlone() {
        SecretStore managedA = client.resource(fakeStore(NS, "managed-a")).createOrReplace();
        SecretStore managedB = client.resource(fakeStore(NS, "managed-b")).createOrReplace();
        SecretStore foreignA = client.resource(foreign(fakeStore(NS, "foreign-a"))).createOrReplace();
        client.resource(foreign(fakeStore(NS, "foreign-b"))).createOrReplace();
        client.resource(secret(NS, "mixed-src", "token", "t0k3n")).createOrReplace();

        PushSecret ps = pushSecret("mixed", "mixed-src",
                List.of(ref("managed-a"), ref("foreign-a"), ref("managed-b"), ref("foreign-b")),
                new PushSecretData("token", "remote/token"));
        Map<String, PushSecretData> foreignEntries = new TreeMap<>(Map.of("remote/old", new PushSecretData("old", "remote/old")));
        Map<String, Map<String, PushSecretData>> previous = new TreeMap<>();
        previous.put("SecretStore/foreign-a", foreignEntries);
        ps.getOrCreateStatus().setSyncedPushSecrets(previous);

        reconciler.reconcile(ps, context);

        assertReady(ps, PushSecretReconciler.MESSAGE_SYNCED);
        assertThat(remoteValue(managedA, "remote/token")).isEqualTo("t0k3n");
        assertThat(remoteValue(managedB, "remote/token")).isEqualTo("t0k3n");
        assertThatThrownBy(() -> remoteValue(foreignA, "remote/token"))
            .isInstanceOf(SyncException.class)
            .extracting("kind")
            .isEqualTo(SyncException.Kind.NOT_FOUND);
        assertThat(ps.getStatus().getSyncedPushSecrets())
            .containsOnlyKeys("SecretStore/managed-a", "SecretStore/managed-b", "SecretStore/foreign-a");
        assertThat(ps.getStatus().getSyncedPushSecrets().get("SecretStore/foreign-a")).isEqualTo(foreignEntries);
    }

    @Test
    void testOnlyUnmanagedStoresIsSkipped() {
        client.resource(foreign(fakeStore(NS, "foreign-only"))).createOrReplace();
        client.resource(secret(NS, "foreign-only-src", "token", "t")).createOrReplace();
        PushSecret ps = pushSecret("foreign-only", "foreign-only-src", List.of(ref("foreign-only")), new PushSecretData("token", "remote/token"));

        UpdateControl<PushSecret> control = reconciler.reconcile(ps, context);

        assertThat(control.isNoUpdate()).isTrue();
        assertThat(ps.getStatus().getConditions()).isEmpty();
    }

    @Test
    void testMissingSourceSecret() {
        PushSecret ps = pushSecret("no-source", "absent-src", List.of(ref("mock-store")), new PushSecretData("a", "remote/a"));

        reconciler.reconcile(ps, context);

        assertErrored(ps, PushSecretReconciler.MESSAGE_NO_SOURCE);
    }

    @Test
    void testMissingSourceKey() {
        client.resource(secret(NS, "no-key-src", "a", "1")).createOrReplace();
        PushSecret ps = pushSecret("no-key", "no-key-src", List.of(ref("mock-store")), new PushSecretData("absent", "remote/x"));

        reconciler.reconcile(ps, context);

        assertErrored(ps, "set secret failed: secret key absent does not exist");
        verify(remote, never()).pushSecret(any(), any());
    }

    @Test
    void testMissingStore() {
        client.resource(secret(NS, "no-store-src", "a", "1")).createOrReplace();
        PushSecret ps = pushSecret("no-store", "no-store-src", List.of(ref("nowhere")), new PushSecretData("a", "remote/a"));

        reconciler.reconcile(ps, context);

        assertErrored(ps, "could not get SecretStore \"nowhere\": not found");
    }

    @Test
    void testWriteFailureIsReported() {
        client.resource(secret(NS, "write-fail-src", "a", "1")).createOrReplace();
        doThrow(SyncException.auth("permission denied")).when(remote).pushSecret(any(), any());
        PushSecret ps = pushSecret("write-fail", "write-fail-src", List.of(ref("mock-store")), new PushSecretData("a", "remote/a"));

        reconciler.reconcile(ps, context);

        assertErrored(ps, "set secret failed: could not write remote ref remote/a to target secretstore mock-store: permission denied");
        assertThat(ps.getStatus().getSyncedPushSecrets()).isNullOrEmpty();
    }

    @Test
    void testSelectorNeedsExactlyOneSource() {
        PushSecret ps = pushSecret("bad-selector", "x", List.of(ref("mock-store")), new PushSecretData("a", "remote/a"));
        ps.getSpec().getSelector().setGeneratorRef(new GeneratorRef(HasMetadata.getApiVersion(Fake.class), "Fake", "gen"));

        reconciler.reconcile(ps, context);

        assertErrored(ps, "selector must set exactly one of secret or generatorRef");
    }

    @Test
    void testWholeSecretIsPushedAsJson() {
        SecretStore store = client.resource(fakeStore(NS, "whole")).createOrReplace();
        client.resource(secret(NS, "whole-src", "user", "admin", "password", "p4ss")).createOrReplace();
        PushSecret ps = pushSecret("whole", "whole-src", List.of(ref("whole")), new PushSecretData(null, "remote/all"));

        reconciler.reconcile(ps, context);

        assertThat(json(remoteValue(store, "remote/all"))).isEqualTo(json("{\"password\":\"p4ss\",\"user\":\"admin\"}"));
    }

    @Test
    void testReverseUnicodeRestoresKeys() {
        SecretStore store = client.resource(fakeStore(NS, "unicode")).createOrReplace();
        client.resource(secret(NS, "unicode-src", "tls_U002e_crt", "CERT")).createOrReplace();
        PushSecretData data = new PushSecretData("tls.crt", "remote/cert");
        data.setConversionStrategy(PushSecretData.ConversionStrategy.ReverseUnicode);
        PushSecret ps = pushSecret("unicode", "unicode-src", List.of(ref("unicode")), data);

        reconciler.reconcile(ps, context);

        assertThat(remoteValue(store, "remote/cert")).isEqualTo("CERT");
    }

    @Test
    void testGeneratorSource() {
        Fake generator = new Fake();
        generator.setMetadata(new ObjectMetaBuilder().withNamespace(NS).withName("push-gen").build());
        FakeSpec spec = new FakeSpec();
        spec.setData(Map.of("key", "generated-value"));
        generator.setSpec(spec);
        client.resource(generator).createOrReplace();
        SecretStore store = client.resource(fakeStore(NS, "generated")).createOrReplace();

        PushSecret ps = pushSecret("generated", null, List.of(ref("generated")), new PushSecretData("key", "remote/generated"));
        PushSecretSpec.Selector selector = new PushSecretSpec.Selector();
        selector.setGeneratorRef(new GeneratorRef(HasMetadata.getApiVersion(Fake.class), "Fake", "push-gen"));
        ps.getSpec().setSelector(selector);

        reconciler.reconcile(ps, context);

        assertReady(ps, PushSecretReconciler.MESSAGE_SYNCED);
        assertThat(remoteValue(store, "remote/generated")).isEqualTo("generated-value");
    }

    @Test
    void testCleanupDeletesSyncedEntries() {
        client.resource(secret(NS, "cleanup-src", "a", "1", "b", "2")).createOrReplace();
        PushSecret ps = pushSecret("cleanup", "cleanup-src", List.of(ref("mock-store")),
                new PushSecretData("a", "remote/a"),
                new PushSecretData("b", "remote/b"));
        ps.getSpec().setDeletionPolicy(DeletionPolicy.Delete);
        reconciler.reconcile(ps, context);

        DeleteControl control = reconciler.cleanup(ps, context);

        assertThat(control.isRemoveFinalizer()).isTrue();
        verify(remote).deleteSecret(new PushRemoteRef("remote/a", null));
        verify(remote).deleteSecret(new PushRemoteRef("remote/b", null));
    }

    @Test
    void testCleanupKeepsFinalizerOnFailure() {
        client.resource(secret(NS, "cleanup-fail-src", "a", "1")).createOrReplace();
        PushSecret ps = pushSecret("cleanup-fail", "cleanup-fail-src", List.of(ref("mock-store")), new PushSecretData("a", "remote/a"));
        ps.getSpec().setDeletionPolicy(DeletionPolicy.Delete);
        reconciler.reconcile(ps, context);
        doThrow(SyncException.transientError("backend down")).when(remote).deleteSecret(any());

        DeleteControl control = reconciler.cleanup(ps, context);

        assertThat(control.isRemoveFinalizer()).isFalse();
        assertThat(control.getScheduleDelay()).isPresent();
    }

    @Test
    void testCleanupWithoutDeletePolicyLeavesRemote() {
        client.resource(secret(NS, "cleanup-none-src", "a", "1")).createOrReplace();
        PushSecret ps = pushSecret("cleanup-none", "cleanup-none-src", List.of(ref("mock-store")), new PushSecretData("a", "remote/a"));
        reconciler.reconcile(ps, context);

        assertThat(reconciler.cleanup(ps, context).isRemoveFinalizer()).isTrue();
        verify(remote, never()).deleteSecret(any());
    }

    @Test
    void testCleanupForgetsFailuresWithoutDeletePolicy() {
        client.resource(secret(NS, "forget-src", "a", "1")).createOrReplace();
        doThrow(SyncException.auth("permission denied")).when(remote).pushSecret(any(), any());
        PushSecret ps = pushSecret("forget", "forget-src", List.of(ref("mock-store")), new PushSecretData("a", "remote/a"));
        reconciler.reconcile(ps, context);
        assertThat(backoff.failureCount(ps)).isEqualTo(1);

        assertThat(reconciler.cleanup(ps, context).isRemoveFinalizer()).isTrue();
        assertThat(backoff.failureCount(ps)).isZero();
    }

    @Test
    void testRetriedCleanupForgetsFailures() {
        client.resource(secret(NS, "forget-retry-src", "a", "1")).createOrReplace();
        PushSecret ps = pushSecret("forget-retry", "forget-retry-src", List.of(ref("mock-store")), new PushSecretData("a", "remote/a"));
        ps.getSpec().setDeletionPolicy(DeletionPolicy.Delete);
        reconciler.reconcile(ps, context);
        doThrow(SyncException.transientError("backend down")).doNothing().when(remote).deleteSecret(any());

        assertThat(reconciler.cleanup(ps, context).isRemoveFinalizer()).isFalse();
        assertThat(backoff.failureCount(ps)).isEqualTo(1);
        assertThat(reconciler.cleanup(ps, context).isRemoveFinalizer()).isTrue();
        assertThat(backoff.failureCount(ps)).isZero();
    }

    static PushSecret pushSecret(String name, String sourceSecret, List<SecretStoreRef> stores, PushSecretData... data) {
        PushSecret ps = new PushSecret();
        ps.setMetadata(new ObjectMetaBuilder()
                .withNamespace(NS)
                .withName(name)
                .withUid(UUID.randomUUID().toString())
                .withGeneration(1L)
                .build());
        PushSecretSpec spec = new PushSecretSpec();
        spec.setSecretStoreRefs(new ArrayList<>(stores));
        PushSecretSpec.Selector selector = new PushSecretSpec.Selector();
        if (sourceSecret != null) {
            selector.setSecret(new PushSecretSpec.SecretSelector(sourceSecret));
        }
        spec.setSelector(selector);
        spec.setData(new ArrayList<>(Arrays.asList(data)));
        ps.setSpec(spec);
        return ps;
    }

    static SecretStoreRef ref(String name) {
        return new SecretStoreRef(name, null);
    }

    static SecretStore mockStore(String name) {
        SecretStore store = new SecretStore();
        store.setMetadata(new ObjectMetaBuilder().withNamespace(NS).withName(name).build());
        SecretStoreSpec spec = new SecretStoreSpec();
        spec.setProvider(new StoreProvider(MOCK, json("{}")));
        store.setSpec(spec);
        return store;
    }

    static SecretStore foreign(SecretStore store) {
        store.getSpec().setController("other");
        return store;
    }

    String remoteValue(GenericStore store, String key) {
        StoreContext storeContext = new StoreContext(store, FakeProvider.KIND, client, NS, null, Clock.systemUTC());

        try (SecretsClient secrets = fake.newClient(storeContext)) {
            return text(secrets.getSecret(new RemoteRef(key, null)));
        }
    }

    static void assertReady(PushSecret ps, String message) {
        Condition ready = ps.getStatus().getCondition(ConditionedStatus.CONDITION_READY).orElseThrow();
        assertThat(ready.getStatus()).isEqualTo(ConditionedStatus.STATUS_TRUE);
        assertThat(ready.getReason()).isEqualTo(ConditionedStatus.REASON_SYNCED);
        assertThat(ready.getMessage()).isEqualTo(message);
    }

    static void assertErrored(PushSecret ps, String message) {
        Condition ready = ps.getStatus().getCondition(ConditionedStatus.CONDITION_READY).orElseThrow();
        assertThat(ready.getStatus()).isEqualTo(ConditionedStatus.STATUS_FALSE);
        assertThat(ready.getReason()).isEqualTo(ConditionedStatus.REASON_ERRORED);
        assertThat(ready.getMessage()).isEqualTo(message);
    }
}
