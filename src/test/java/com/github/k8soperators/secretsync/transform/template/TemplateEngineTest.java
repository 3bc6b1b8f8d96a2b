package com.github.k8soperators.secretsync.transform.template;

import com.github.k8soperators.secretsync.SyncException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateEngineTest {

    TemplateEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TemplateEngine(Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC));
    }

    @Test
    void testPipeline() {
        assertThat(engine.render("key", "{{ .key | upper }} was templated", Map.of("key", "value")))
            .isEqualTo("VALUE was templated");
    }

    @Test
    void testTrimMarkers() {
        assertThat(engine.render("t", "a  {{- .v -}}  b", Map.of("v", "1"))).isEqualTo("a1b");
    }

    @Test
    void testCommentsAreDropped() {
        assertThat(engine.render("t", "x{{/* ignored */}}y", Map.of())).isEqualTo("xy");
    }

    @Test
    void testFunctionArguments() {
        Map<String, Object> data = Map.of("user", "admin", "dashed-key", "v");

        assertThat(engine.render("t", "{{ \"foo\" | b64enc }}", data)).isEqualTo("Zm9v");
        assertThat(engine.render("t", "{{ .user | replace \"ad\" \"super\" }}", data)).isEqualTo("supermin");
        assertThat(engine.render("t", "{{ index . \"dashed-key\" }}", data)).isEqualTo("v");
        assertThat(engine.render("t", "{{ .user | quote }}", data)).isEqualTo("\"admin\"");
        assertThat(engine.render("t", "{{ \"\" | default \"fallback\" }}", data)).isEqualTo("fallback");
    }

    @Test
    void testToStringAndPrintf() {
        Map<String, Object> data = Map.of("key", "value", "username", "admin", "password", "s3cret", "port", 5432L);

        assertThat(engine.render("t", "{{ .key | toString | upper }}", data)).isEqualTo("VALUE");
        assertThat(engine.render("t", "{{ printf \"%s:%s\" .username .password }}", data)).isEqualTo("admin:s3cret");
        assertThat(engine.render("t", "{{ (printf \"%s:%s\" .username .password) | b64enc }}", data))
            .isEqualTo("YWRtaW46czNjcmV0");
        assertThat(engine.render("t", "{{ printf \"%v/%d\" .username .port }}", data)).isEqualTo("admin/5432");
    }

    @Test
    void testPrintfBadVerbIsError() {
        assertThatThrownBy(() -> engine.render("t", "{{ printf \"%d\" .key }}", Map.of("key", "v")))
            .isInstanceOf(SyncException.class)
            .hasMessageStartingWith("template t: printf:");
    }

    @Test
    void testFieldOfParenthesizedPipeline() {
        Map<String, Object> data = Map.of("name", "{\"first\": \"Jane\", \"address\": {\"city\": \"Oslo\"}}");

        assertThat(engine.render("t", "{{ (fromJson .name).first }}", data)).isEqualTo("Jane");
        assertThat(engine.render("t", "{{ (fromJson .name).address.city | lower }}", data)).isEqualTo("oslo");
        assertThatThrownBy(() -> engine.render("t", "{{ (fromJson .name).last }}", data))
            .isInstanceOf(SyncException.class)
            .hasMessageContaining("map has no entry for key \"last\"");
    }

    @Test
    void testNowUsesClock() {
        assertThat(engine.render("t", "{{ now | date \"2006-01-02\" }}", Map.of())).isEqualTo("2024-03-05");
    }

    @Test
    void testMissingKeyIsError() {
        assertThatThrownBy(() -> engine.render("target", "{{ .missing }}", Map.of("key", "v")))
            .isInstanceOf(SyncException.class)
            .hasMessage("template target: map has no entry for key \"missing\"")
            .extracting("kind").isEqualTo(SyncException.Kind.VALIDATION);
    }

    @Test
    void testUnknownFunction() {
        assertThatThrownBy(() -> engine.render("t", "{{ .key | nope }}", Map.of("key", "v")))
            .isInstanceOf(SyncException.class)
            .hasMessageContaining("function \"nope\" not defined");
    }

    @Test
    void testUnclosedAction() {
        assertThatThrownBy(() -> engine.render("t", "{{ .key", Map.of("key", "v")))
            .isInstanceOf(SyncException.class)
            .hasMessageStartingWith("template t: ");
    }
}
