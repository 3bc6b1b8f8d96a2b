package com.github.k8soperators.secretsync.transform;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.v1alpha1.DecodingStrategy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decoding of fetched values according to a {@link DecodingStrategy}.
 */
public final class Decoding {

    // Padded encodings only: unpadded text is treated as a raw value.
    static final Pattern STANDARD = Pattern.compile("[A-Za-z0-9+/]*={0,2}");
    static final Pattern URL_SAFE = Pattern.compile("[A-Za-z0-9_-]*={0,2}");

    private Decoding() {
    }

    public static byte[] decode(String key, byte[] value, DecodingStrategy strategy) {
        switch (strategy) {
        case Base64:
            return decode(key, value, STANDARD, Base64.getDecoder(), strategy);
        case Base64URL:
            return decode(key, value, URL_SAFE, Base64.getUrlDecoder(), strategy);
        case Auto:
            return auto(value);
        case None:
        default:
            return value;
        }
    }

    public static Map<String, byte[]> decode(Map<String, byte[]> values, DecodingStrategy strategy) {
        if (strategy == DecodingStrategy.None) {
            return values;
        }

        Map<String, byte[]> result = new LinkedHashMap<>();
        values.forEach((key, value) -> result.put(key, decode(key, value, strategy)));
        return result;
    }

    static byte[] decode(String key, byte[] value, Pattern alphabet, Base64.Decoder decoder, DecodingStrategy strategy) {
        if (value.length % 4 != 0) {
            throw SyncException.validation("value of %s is not valid %s: length %d is not a multiple of 4",
                    key, strategy, value.length);
        }
        if (!alphabet.matcher(new String(value, StandardCharsets.ISO_8859_1)).matches()) {
            throw SyncException.validation("value of %s is not valid %s: illegal character or padding", key, strategy);
        }
        try {
            return decoder.decode(value);
        } catch (IllegalArgumentException e) {
            throw SyncException.validation("value of %s is not valid %s: %s", key, strategy, e.getMessage());
        }
    }

    /**
     * Standard alphabet first, then URL-safe, then the raw bytes.
     */
    static byte[] auto(byte[] value) {
        String text = new String(value, StandardCharsets.ISO_8859_1);

        if (isEncoded(text, STANDARD)) {
            return Base64.getDecoder().decode(value);
        }
        if (isEncoded(text, URL_SAFE)) {
            return Base64.getUrlDecoder().decode(value);
        }
        return value;
    }

    static boolean isEncoded(String text, Pattern alphabet) {
        return !text.isEmpty()
                && text.length() % 4 == 0
                && alphabet.matcher(text).matches();
    }
}
