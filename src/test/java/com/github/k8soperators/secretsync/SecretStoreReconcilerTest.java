package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.ClusterSecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.GenericStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStore;
import com.github.k8soperators.secretsync.api.v1alpha1.SecretStoreStatus;
import com.github.k8soperators.secretsync.api.v1alpha1.StoreProvider;
import com.github.k8soperators.secretsync.provider.Provider;
import com.github.k8soperators.secretsync.provider.ProviderRegistry;
import com.github.k8soperators.secretsync.provider.SecretsClient;
import com.github.k8soperators.secretsync.provider.fake.FakeProvider;
import com.github.k8soperators.secretsync.provider.fake.FakeProviderConfig;
import com.github.k8soperators.secretsync.store.StoreResolver;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.github.k8soperators.secretsync.Fixtures.entry;
import static com.github.k8soperators.secretsync.Fixtures.fakeClusterStore;
import static com.github.k8soperators.secretsync.Fixtures.fakeStore;
import static com.github.k8soperators.secretsync.Fixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SecretStoreReconcilerTest {

    KubernetesClient client;
    RequeueBackoff backoff;
    SecretsClient legacyClient;
    SecretStoreReconciler reconciler;

    @BeforeEach
    void setUp() {
        client = mock(KubernetesClient.class);
        backoff = new RequeueBackoff(Duration.ofSeconds(5), Duration.ofMinutes(5));

        legacyClient = mock(SecretsClient.class);
        when(legacyClient.validate()).thenReturn(SecretsClient.ValidationResult.UNKNOWN);
        Provider legacy = mock(Provider.class);
        when(legacy.kind()).thenReturn("legacy");
        when(legacy.capabilities()).thenReturn(Provider.Capabilities.ReadOnly);
        when(legacy.maintenanceStatus()).thenReturn(Provider.MaintenanceStatus.NOT_MAINTAINED);
        when(legacy.newClient(any())).thenReturn(legacyClient);

        reconciler = new SecretStoreReconciler(client,
                new StoreResolver(client, "primary"),
                new ProviderRegistry(List.of(new FakeProvider(), legacy)),
                backoff);
        reconciler.reconcileTimeout = Duration.ofSeconds(30);
    }

    @Test
    void testValidStoreIsReady() {
        SecretStore store = fakeStore("ns", "valid", entry("key", "value"));
        store.getSpec().setRefreshInterval(600);

        UpdateControl<SecretStore> control = reconciler.reconcile(store, context());

        assertThat(control.isUpdateStatus()).isTrue();
        assertThat(control.getScheduleDelay()).contains(Duration.ofMinutes(10).toMillis());
        assertCondition(store, SecretStoreStatus.STATUS_TRUE, SecretStoreStatus.REASON_VALID, AbstractStoreReconciler.MESSAGE_VALID);
        assertThat(store.getStatus().getCapabilities()).isEqualTo("ReadWrite");
    }

    @Test
    void testStoreOfMatchingControllerClassIsValidated() {
        SecretStore store = fakeStore("ns", "primary");
        store.getSpec().setController("primary");

        UpdateControl<SecretStore> control = reconciler.reconcile(store, context());

        assertThat(control.isUpdateStatus()).isTrue();
        assertThat(control.getScheduleDelay()).isEmpty();
        assertCondition(store, SecretStoreStatus.STATUS_TRUE, SecretStoreStatus.REASON_VALID, AbstractStoreReconciler.MESSAGE_VALID);
    }

    @Test
    void testStoreOfOtherControllerIsSkipped() {
        SecretStore store = fakeStore("ns", "other");
        store.getSpec().setController("secondary");

        UpdateControl<SecretStore> control = reconciler.reconcile(store, context());

        assertThat(control.isNoUpdate()).isTrue();
        assertThat(store.getStatus()).isNull();
    }

    @Test
    void testUnknownProviderIsInvalid() {
        SecretStore store = fakeStore("ns", "vault");
        store.getSpec().setProvider(new StoreProvider("vault", json("{\"server\":\"https://vault.local\"}")));

        UpdateControl<SecretStore> control = reconciler.reconcile(store, context());

        assertThat(control.getScheduleDelay()).contains(Duration.ofSeconds(5).toMillis());
        assertCondition(store, SecretStoreStatus.STATUS_FALSE, SecretStoreStatus.REASON_INVALID_PROVIDER_CONFIG,
                "store vault uses unknown provider vault");
    }

    @Test
    void testInvalidConfigurationIsReported() {
        SecretStore store = fakeStore("ns", "bad", entry(null, "value"));

        reconciler.reconcile(store, context());

        assertCondition(store, SecretStoreStatus.STATUS_FALSE, SecretStoreStatus.REASON_INVALID_PROVIDER_CONFIG,
                "fake store bad: entry without key");
    }

    @Test
    void testBackendValidationErrorIsReported() {
        FakeProviderConfig config = new FakeProviderConfig();
        config.setValidationResult(SecretsClient.ValidationResult.ERROR);
        SecretStore store = fakeStore("ns", "unreachable");
        store.getSpec().setProvider(new StoreProvider(FakeProvider.KIND, Serialization.jsonMapper().valueToTree(config)));

        reconciler.reconcile(store, context());

        assertCondition(store, SecretStoreStatus.STATUS_FALSE, SecretStoreStatus.REASON_INVALID_PROVIDER_CONFIG,
                "could not validate fake provider of store unreachable");
    }

    @Test
    void testRepeatedFailuresBackOff() {
        SecretStore store = fakeStore("ns", "flaky", entry(null, "value"));

        reconciler.reconcile(store, context());
        UpdateControl<SecretStore> control = reconciler.reconcile(store, context());

        assertThat(control.getScheduleDelay()).contains(Duration.ofSeconds(10).toMillis());
    }

    @Test
    void testDeletedStoreIsForgotten() {
        SecretStore store = fakeStore("ns", "deleted", entry(null, "value"));
        reconciler.reconcile(store, context());
        assertThat(backoff.failureCount(store)).isEqualTo(1);

        DeleteControl control = reconciler.cleanup(store, context());

        assertThat(control.isRemoveFinalizer()).isTrue();
        assertThat(backoff.failureCount(store)).isZero();
    }

    @Test
    void testUnmaintainedProviderIsFlagged() {
        SecretStore store = fakeStore("ns", "legacy");
        store.getSpec().setProvider(new StoreProvider("legacy", json("{}")));

        reconciler.reconcile(store, context());

        assertCondition(store, SecretStoreStatus.STATUS_TRUE, SecretStoreStatus.REASON_VALID,
                AbstractStoreReconciler.MESSAGE_VALID + AbstractStoreReconciler.MESSAGE_NOT_MAINTAINED);
        assertThat(store.getStatus().getCapabilities()).isEqualTo("ReadOnly");
        verify(legacyClient).close();
    }

    @Test
    void testClusterStoreIsValidated() {
        ClusterSecretStoreReconciler clusterReconciler = new ClusterSecretStoreReconciler(client,
                new StoreResolver(client, ""),
                new ProviderRegistry(List.of(new FakeProvider())),
                backoff);
        clusterReconciler.reconcileTimeout = Duration.ofSeconds(30);
        ClusterSecretStore store = fakeClusterStore("shared", entry("key", "value"));

        @SuppressWarnings("unchecked")
        Context<ClusterSecretStore> context = mock(Context.class);
        UpdateControl<ClusterSecretStore> control = clusterReconciler.reconcile(store, context);

        assertThat(control.isUpdateStatus()).isTrue();
        assertCondition(store, SecretStoreStatus.STATUS_TRUE, SecretStoreStatus.REASON_VALID, AbstractStoreReconciler.MESSAGE_VALID);
    }

    @SuppressWarnings("unchecked")
    static Context<SecretStore> context() {
        return mock(Context.class);
    }

    static void assertCondition(GenericStore store, String status, String reason, String message) {
        Condition ready = store.getOrCreateStatus().getCondition(SecretStoreStatus.CONDITION_READY).orElseThrow();
        assertThat(ready.getStatus()).isEqualTo(status);
        assertThat(ready.getReason()).isEqualTo(reason);
        assertThat(ready.getMessage()).isEqualTo(message);
    }
}
