package com.github.k8soperators.secretsync.api.v1alpha1;

import com.github.k8soperators.secretsync.SyncException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval strings such as {@code 1h}, {@code 30m}, {@code 1h30m15s}
 * or {@code 0}.
 */
public final class Durations {

    private static final Pattern PART = Pattern.compile("(\\d+)(ms|h|m|s)");

    private Durations() {
    }

    public static Duration parse(String value, Duration defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        String trimmed = value.trim();

        if ("0".equals(trimmed)) {
            return Duration.ZERO;
        }

        Matcher matcher = PART.matcher(trimmed);
        Duration result = Duration.ZERO;
        int position = 0;

        while (matcher.find()) {
            if (matcher.start() != position) {
                throw SyncException.validation("invalid duration %s", value);
            }

            long amount = Long.parseLong(matcher.group(1));

            switch (matcher.group(2)) {
            case "h":
                result = result.plusHours(amount);
                break;
            case "m":
                result = result.plusMinutes(amount);
                break;
            case "s":
                result = result.plusSeconds(amount);
                break;
            default:
                result = result.plusMillis(amount);
                break;
            }

            position = matcher.end();
        }

        if (position == 0 || position != trimmed.length()) {
            throw SyncException.validation("invalid duration %s", value);
        }

        return result;
    }
}
