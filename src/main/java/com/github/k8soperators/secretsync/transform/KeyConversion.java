package com.github.k8soperators.secretsync.transform;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.ConversionStrategy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps remote keys to keys valid in a Kubernetes {@code Secret} and back.
 * Every code point outside {@code [-._a-zA-Z0-9]} becomes {@code _Uxxxx_}.
 */
public final class KeyConversion {

    static final Pattern ENCODED = Pattern.compile("_U([0-9a-fA-F]{4,6})_");

    private KeyConversion() {
    }

    public static String convert(String key, ConversionStrategy strategy) {
        return strategy == ConversionStrategy.Unicode ? toUnicode(key) : key;
    }

    public static Map<String, byte[]> convert(Map<String, byte[]> values, ConversionStrategy strategy) {
        if (strategy != ConversionStrategy.Unicode) {
            return values;
        }

        Map<String, byte[]> result = new LinkedHashMap<>();
        values.forEach((key, value) -> result.put(toUnicode(key), value));
        return result;
    }

    /**
     * Keys discovered by a find may contain path separators; {@code Default}
     * replaces them with {@code _}, {@code Unicode} encodes every disallowed
     * character.
     */
    public static Map<String, byte[]> convertFound(Map<String, byte[]> values, ConversionStrategy strategy) {
        if (strategy == ConversionStrategy.Unicode) {
            return convert(values, strategy);
        }

        Map<String, byte[]> result = new LinkedHashMap<>();
        values.forEach((key, value) -> result.put(key.replace('/', '_'), value));
        return result;
    }

    public static String toUnicode(String key) {
        StringBuilder result = new StringBuilder(key.length());

        key.codePoints().forEach(cp -> {
            if (isAllowed(cp)) {
                result.appendCodePoint(cp);
            } else {
                result.append(String.format("_U%04x_", cp));
            }
        });

        return result.toString();
    }

    public static String fromUnicode(String key) {
        Matcher matcher = ENCODED.matcher(key);
        StringBuilder result = new StringBuilder(key.length());

        while (matcher.find()) {
            int cp = Integer.parseInt(matcher.group(1), 16);

            if (!Character.isValidCodePoint(cp)) {
                throw SyncException.validation("key %s contains invalid code point %s", key, matcher.group());
            }

            matcher.appendReplacement(result, Matcher.quoteReplacement(new String(Character.toChars(cp))));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    static boolean isAllowed(int cp) {
        return cp == '-' || cp == '.' || cp == '_'
                || (cp >= 'a' && cp <= 'z')
                || (cp >= 'A' && cp <= 'Z')
                || (cp >= '0' && cp <= '9');
    }
}
