package com.github.k8soperators.secretsync;

import com.github.k8soperators.secretsync.api.v1alpha1.ExternalSecret;
import com.github.k8soperators.secretsync.api.v1alpha1.PushSecret;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RequeueBackoffTest {

    RequeueBackoff backoff = new RequeueBackoff(Duration.ofSeconds(5), Duration.ofMinutes(1));

    @Test
    void testDelayDoublesUntilCapped() {
        assertThat(backoff.delay(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.delay(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.delay(4)).isEqualTo(Duration.ofSeconds(40));
        assertThat(backoff.delay(5)).isEqualTo(Duration.ofMinutes(1));
        assertThat(backoff.delay(64)).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void testSuccessResetsFailures() {
        ExternalSecret es = new ExternalSecret();
        es.setMetadata(new ObjectMetaBuilder().withNamespace("ns").withName("db").build());

        assertThat(backoff.onFailure(es)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.onFailure(es)).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.failureCount(es)).isEqualTo(2);

        backoff.onSuccess(es);

        assertThat(backoff.failureCount(es)).isZero();
        assertThat(backoff.onFailure(es)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void testKindsAreCountedSeparately() {
        ExternalSecret es = new ExternalSecret();
        es.setMetadata(new ObjectMetaBuilder().withNamespace("ns").withName("db").build());
        PushSecret ps = new PushSecret();
        ps.setMetadata(new ObjectMetaBuilder().withNamespace("ns").withName("db").build());

        backoff.onFailure(es);
        backoff.onFailure(es);

        assertThat(backoff.onFailure(ps)).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void testForgetDropsEntry() {
        ExternalSecret es = new ExternalSecret();
        es.setMetadata(new ObjectMetaBuilder().withNamespace("ns").withName("gone").build());

        backoff.onFailure(es);
        backoff.onFailure(es);
        backoff.forget(es);
        backoff.forget(es);

        assertThat(backoff.size()).isZero();
        assertThat(backoff.onFailure(es)).isEqualTo(Duration.ofSeconds(5));
    }
}
