package com.github.k8soperators.secretsync.api.v1alpha1;

import com.github.k8soperators.secretsync.SyncException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationsTest {

    @Test
    void testBlankUsesDefault() {
        assertThat(Durations.parse(null, Duration.ofHours(1))).isEqualTo(Duration.ofHours(1));
        assertThat(Durations.parse(" ", Duration.ofMinutes(2))).isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void testZeroDisablesRefresh() {
        assertThat(Durations.parse("0", Duration.ofHours(1))).isZero();
    }

    @Test
    void testCompoundDuration() {
        assertThat(Durations.parse("1h30m15s", Duration.ZERO))
            .isEqualTo(Duration.ofHours(1).plusMinutes(30).plusSeconds(15));
        assertThat(Durations.parse("250ms", Duration.ZERO)).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void testInvalidDuration() {
        assertThatThrownBy(() -> Durations.parse("1 hour", Duration.ZERO))
            .isInstanceOf(SyncException.class)
            .hasMessage("invalid duration 1 hour");
        assertThatThrownBy(() -> Durations.parse("10", Duration.ZERO))
            .isInstanceOf(SyncException.class);
    }
}
