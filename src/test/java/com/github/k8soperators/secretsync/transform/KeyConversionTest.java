package com.github.k8soperators.secretsync.transform;

import com.github.k8soperators.secretsync.api.v1alpha1.ConversionStrategy;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KeyConversionTest {

    @Test
    void testUnicodeEncodesDisallowedCharacters() {
        assertThat(KeyConversion.toUnicode("some-array[0].entity")).isEqualTo("some-array_U005b_0_U005d_.entity");
        assertThat(KeyConversion.toUnicode("path/to key")).isEqualTo("path_U002f_to_U0020_key");
        assertThat(KeyConversion.toUnicode("plain_Key-1.txt")).isEqualTo("plain_Key-1.txt");
    }

    @Test
    void testReverseUnicode() {
        assertThat(KeyConversion.fromUnicode("some-array_U005b_0_U005d_.entity")).isEqualTo("some-array[0].entity");
        assertThat(KeyConversion.fromUnicode("emoji_U1f600_")).isEqualTo(new String(Character.toChars(0x1f600)));
    }

    @Test
    void testRoundTripOfPushableKeys() {
        for (String key : List.of("a/b/c", "dots.and-dashes", "with space", "ünïcödé", "$ref{1}")) {
            String encoded = KeyConversion.toUnicode(key);
            assertThat(KeyConversion.fromUnicode(encoded)).isEqualTo(key);
            assertThat(KeyConversion.toUnicode(KeyConversion.fromUnicode(encoded))).isEqualTo(encoded);
        }
    }

    @Test
    void testDefaultStrategyKeepsKeys() {
        Map<String, byte[]> values = Map.of("a/b", bytes("1"));
        assertThat(KeyConversion.convert(values, ConversionStrategy.Default)).containsOnlyKeys("a/b");
    }

    @Test
    void testFoundKeysReplaceSlashes() {
        Map<String, byte[]> values = new LinkedHashMap<>();
        values.put("team/db/password", bytes("1"));
        values.put("team/db user", bytes("2"));

        assertThat(KeyConversion.convertFound(values, ConversionStrategy.Default))
            .containsOnlyKeys("team_db_password", "team_db user");
        assertThat(KeyConversion.convertFound(values, ConversionStrategy.Unicode))
            .containsOnlyKeys("team_U002f_db_U002f_password", "team_U002f_db_U0020_user");
    }

    static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
