package com.github.k8soperators.secretsync.generator;

import com.github.k8soperators.secretsync.SyncException;
import com.github.k8soperators.secretsync.api.generators.v1alpha1.Password;
import com.github.k8soperators.secretsync.api.generators.v1alpha1.PasswordSpec;

import javax.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates a random password under the key {@code password}.
 */
@ApplicationScoped
public class PasswordGenerator implements Generator<Password> {

    public static final String KEY = "password";

    static final int DEFAULT_LENGTH = 24;
    static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String DIGITS = "0123456789";
    static final String SYMBOLS = "~!@#$%^&*()_+`-={}|[]\\:\"<>?,./";

    private final SecureRandom random = new SecureRandom();

    @Override
    public Class<Password> resourceType() {
        return Password.class;
    }

    @Override
    public GeneratorResult generate(Password resource) {
        PasswordSpec spec = Optional.ofNullable(resource.getSpec()).orElseGet(PasswordSpec::new);
        String password = generate(spec);
        return new GeneratorResult(Map.of(KEY, password.getBytes(StandardCharsets.UTF_8)));
    }

    String generate(PasswordSpec spec) {
        int length = Objects.requireNonNullElse(spec.getLength(), DEFAULT_LENGTH);
        int digits = Objects.requireNonNullElse(spec.getDigits(), length / 4);
        int symbols = Objects.requireNonNullElse(spec.getSymbols(), length / 4);
        String symbolCharacters = Objects.requireNonNullElse(spec.getSymbolCharacters(), SYMBOLS);
        boolean allowRepeat = Boolean.TRUE.equals(spec.getAllowRepeat());
        String letters = Boolean.TRUE.equals(spec.getNoUpper()) ? LOWER : LOWER + UPPER;
        int letterCount = length - digits - symbols;

        if (length <= 0 || digits < 0 || symbols < 0 || letterCount < 0) {
            throw SyncException.validation("password length %d cannot hold %d digits and %d symbols", length, digits, symbols);
        }

        if (symbols > 0 && symbolCharacters.isEmpty()) {
            throw SyncException.validation("password requires %d symbols but symbolCharacters is empty", symbols);
        }

        List<Character> chars = new ArrayList<>(length);
        pick(chars, letters, letterCount, allowRepeat);
        pick(chars, DIGITS, digits, allowRepeat);
        pick(chars, symbolCharacters, symbols, allowRepeat);
        Collections.shuffle(chars, random);

        StringBuilder result = new StringBuilder(length);
        chars.forEach(result::append);
        return result.toString();
    }

    void pick(List<Character> target, String pool, int count, boolean allowRepeat) {
        List<Character> available = new ArrayList<>(pool.length());
        pool.chars().distinct().forEach(c -> available.add((char) c));

        if (!allowRepeat && count > available.size()) {
            throw SyncException.validation("cannot pick %d distinct characters from %d without repeats", count, available.size());
        }

        for (int i = 0; i < count; i++) {
            int index = random.nextInt(available.size());
            target.add(allowRepeat ? available.get(index) : available.remove(index));
        }
    }
}
