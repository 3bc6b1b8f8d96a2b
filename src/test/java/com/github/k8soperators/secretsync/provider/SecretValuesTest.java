package com.github.k8soperators.secretsync.provider;

import com.github.k8soperators.secretsync.SyncException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.k8soperators.secretsync.Fixtures.bytes;
import static com.github.k8soperators.secretsync.Fixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecretValuesTest {

    static final byte[] DOCUMENT = bytes("{\"user\":\"admin\",\"db\":{\"port\":5432},\"a.b\":\"literal\"}");

    @Test
    void testPropertyLookup() {
        assertThat(text(SecretValues.property("k", DOCUMENT, "user"))).isEqualTo("admin");
        assertThat(text(SecretValues.property("k", DOCUMENT, "db.port"))).isEqualTo("5432");
        assertThat(text(SecretValues.property("k", DOCUMENT, "db"))).isEqualTo("{\"port\":5432}");
    }

    @Test
    void testLiteralKeyWinsOverPath() {
        assertThat(text(SecretValues.property("k", DOCUMENT, "a.b"))).isEqualTo("literal");
    }

    @Test
    void testMissingPropertyIsNotFound() {
        assertThatThrownBy(() -> SecretValues.property("k", DOCUMENT, "password"))
            .isInstanceOf(SyncException.class)
            .satisfies(e -> assertThat(((SyncException) e).isNotFound()).isTrue());
    }

    @Test
    void testNoPropertyReturnsWholeValue() {
        assertThat(SecretValues.property("k", bytes("plain"), null)).isEqualTo(bytes("plain"));
    }

    @Test
    void testToMap() {
        Map<String, byte[]> map = SecretValues.toMap("k", DOCUMENT);

        assertThat(map).containsOnlyKeys("user", "db", "a.b");
        assertThat(text(map.get("db"))).isEqualTo("{\"port\":5432}");
    }

    @Test
    void testToMapRequiresObject() {
        assertThatThrownBy(() -> SecretValues.toMap("k", bytes("[1,2]")))
            .isInstanceOf(SyncException.class)
            .extracting("kind").isEqualTo(SyncException.Kind.VALIDATION);
    }
}
