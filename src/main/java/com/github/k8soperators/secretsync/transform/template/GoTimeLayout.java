package com.github.k8soperators.secretsync.transform.template;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Translates reference-time layouts ({@code 2006-01-02T15:04:05Z07:00}) into
 * {@link DateTimeFormatter} patterns.
 */
final class GoTimeLayout {

    private static final String[][] ELEMENTS = {
        { "January", "MMMM" },
        { "Monday", "EEEE" },
        { "Z07:00", "XXX" },
        { "-07:00", "xxx" },
        { "-0700", "xx" },
        { "2006", "yyyy" },
        { ".000", ".SSS" },
        { "Jan", "MMM" },
        { "Mon", "EEE" },
        { "MST", "zzz" },
        { "01", "MM" },
        { "02", "dd" },
        { "15", "HH" },
        { "03", "hh" },
        { "04", "mm" },
        { "05", "ss" },
        { "06", "yy" },
        { "PM", "a" },
    };

    private GoTimeLayout() {
    }

    static DateTimeFormatter toFormatter(String layout) {
        StringBuilder pattern = new StringBuilder();
        int i = 0;

        next:
        while (i < layout.length()) {
            for (String[] element : ELEMENTS) {
                if (layout.startsWith(element[0], i)) {
                    pattern.append(element[1]);
                    i += element[0].length();
                    continue next;
                }
            }

            char c = layout.charAt(i++);

            if (c == '\'') {
                pattern.append("''");
            } else if (Character.isLetter(c)) {
                pattern.append('\'').append(c).append('\'');
            } else {
                pattern.append(c);
            }
        }

        return DateTimeFormatter.ofPattern(pattern.toString(), Locale.ROOT);
    }
}
