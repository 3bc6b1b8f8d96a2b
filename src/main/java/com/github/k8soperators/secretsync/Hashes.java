package com.github.k8soperators.secretsync;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hashes recorded on targets and in status to detect drift.
 */
public final class Hashes {

    private Hashes() {
    }

    public static String sha256(byte[] value) {
        return String.format("%064x", new BigInteger(1, digest().digest(value)));
    }

    /**
     * Order-independent hash of a data map.
     */
    public static String ofData(Map<String, byte[]> data) {
        MessageDigest digest = digest();

        new TreeMap<>(data).forEach((key, value) -> {
            digest.update(key.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(value);
            digest.update((byte) 0);
        });

        return String.format("%064x", new BigInteger(1, digest.digest())).substring(0, 32);
    }

    /**
     * Order-independent hash of string maps, e.g. labels and annotations.
     */
    @SafeVarargs
    public static String ofStrings(Map<String, String>... maps) {
        MessageDigest digest = digest();

        for (Map<String, String> map : maps) {
            if (map != null) {
                new TreeMap<>(map).forEach((key, value) -> {
                    digest.update(key.getBytes(StandardCharsets.UTF_8));
                    digest.update((byte) 0);
                    digest.update(String.valueOf(value).getBytes(StandardCharsets.UTF_8));
                    digest.update((byte) 0);
                });
            }
            digest.update((byte) 1);
        }

        return String.format("%064x", new BigInteger(1, digest.digest())).substring(0, 16);
    }

    static MessageDigest digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
