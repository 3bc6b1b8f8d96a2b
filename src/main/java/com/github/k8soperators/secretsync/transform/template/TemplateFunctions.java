package com.github.k8soperators.secretsync.transform.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.k8soperators.secretsync.Hashes;
import io.fabric8.kubernetes.client.utils.Serialization;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Base64;
import java.util.Collection;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Built-in functions available to every template. None of them performs I/O.
 */
public final class TemplateFunctions {

    private TemplateFunctions() {
    }

    public static Map<String, TemplateFunction> defaults(Clock clock) {
        Map<String, TemplateFunction> functions = new TreeMap<>();

        functions.put("toString", args -> string(one("toString", args)));
        functions.put("printf", TemplateFunctions::printf);
        functions.put("upper", args -> string(one("upper", args)).toUpperCase(Locale.ROOT));
        functions.put("lower", args -> string(one("lower", args)).toLowerCase(Locale.ROOT));
        functions.put("title", args -> title(string(one("title", args))));
        functions.put("trim", args -> string(one("trim", args)).strip());
        functions.put("trimPrefix", args -> {
            arity("trimPrefix", args, 2);
            String prefix = string(args.get(0));
            String value = string(args.get(1));
            return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
        });
        functions.put("trimSuffix", args -> {
            arity("trimSuffix", args, 2);
            String suffix = string(args.get(0));
            String value = string(args.get(1));
            return value.endsWith(suffix) ? value.substring(0, value.length() - suffix.length()) : value;
        });
        functions.put("replace", args -> {
            arity("replace", args, 3);
            return string(args.get(2)).replace(string(args.get(0)), string(args.get(1)));
        });
        functions.put("quote", args -> args.stream()
                .map(arg -> "\"" + string(arg).replace("\\", "\\\\").replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(" ")));
        functions.put("squote", args -> args.stream()
                .map(arg -> "'" + string(arg) + "'")
                .collect(Collectors.joining(" ")));
        functions.put("b64enc", args -> Base64.getEncoder().encodeToString(bytes(one("b64enc", args))));
        functions.put("b64dec", args -> b64dec(string(one("b64dec", args))));
        functions.put("toJson", args -> toJson(one("toJson", args)));
        functions.put("fromJson", args -> fromJson(string(one("fromJson", args))));
        functions.put("toYaml", args -> toYaml(one("toYaml", args)));
        functions.put("index", TemplateFunctions::index);
        functions.put("default", args -> {
            if (args.isEmpty() || args.size() > 2) {
                throw new TemplateException("wrong number of args for default: want 1 or 2 got %d", args.size());
            }
            Object value = args.size() == 2 ? args.get(1) : null;
            return isEmpty(value) ? args.get(0) : value;
        });
        functions.put("sha256sum", args -> Hashes.sha256(bytes(one("sha256sum", args))));
        functions.put("now", args -> {
            arity("now", args, 0);
            return ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        });
        functions.put("date", args -> {
            arity("date", args, 2);
            return GoTimeLayout.toFormatter(string(args.get(0))).format(time(args.get(1)));
        });

        return functions;
    }

    static void arity(String name, List<Object> args, int expected) {
        if (args.size() != expected) {
            throw new TemplateException("wrong number of args for %s: want %d got %d", name, expected, args.size());
        }
    }

    static Object one(String name, List<Object> args) {
        arity(name, args, 1);
        return args.get(0);
    }

    /**
     * Text form of a value as printed by an action.
     */
    static String string(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }

    static byte[] bytes(Object value) {
        return value instanceof byte[] ? (byte[]) value : string(value).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Go-style formatting: {@code %v} prints any value like {@code %s}; the
     * other verbs follow {@link String#format}.
     */
    static String printf(List<Object> args) {
        if (args.isEmpty()) {
            throw new TemplateException("wrong number of args for printf: want at least 1 got 0");
        }

        String format = string(args.get(0)).replace("%v", "%s");
        Object[] values = args.subList(1, args.size()).stream()
                .map(arg -> arg instanceof byte[] || arg == null ? string(arg) : arg)
                .toArray();

        try {
            return String.format(Locale.ROOT, format, values);
        } catch (IllegalFormatException e) {
            throw new TemplateException("printf: %s", e.getMessage());
        }
    }

    static String title(String value) {
        StringBuilder result = new StringBuilder(value.length());
        boolean wordStart = true;

        for (char c : value.toCharArray()) {
            result.append(wordStart ? Character.toTitleCase(c) : c);
            wordStart = Character.isWhitespace(c);
        }

        return result.toString();
    }

    static String b64dec(String value) {
        try {
            return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new TemplateException("b64dec: %s", e.getMessage());
        }
    }

    static String toJson(Object value) {
        try {
            return Serialization.jsonMapper().writeValueAsString(value instanceof byte[] ? string(value) : value);
        } catch (JsonProcessingException e) {
            throw new TemplateException("toJson: " + e.getOriginalMessage(), e);
        }
    }

    static Object fromJson(String value) {
        try {
            return Serialization.jsonMapper().readValue(value, Object.class);
        } catch (JsonProcessingException e) {
            throw new TemplateException("fromJson: " + e.getOriginalMessage(), e);
        }
    }

    static String toYaml(Object value) {
        try {
            String yaml = Serialization.yamlMapper().writeValueAsString(value instanceof byte[] ? string(value) : value);
            if (yaml.startsWith("---\n")) {
                yaml = yaml.substring(4);
            }
            return yaml.endsWith("\n") ? yaml.substring(0, yaml.length() - 1) : yaml;
        } catch (JsonProcessingException e) {
            throw new TemplateException("toYaml: " + e.getOriginalMessage(), e);
        }
    }

    static Object index(List<Object> args) {
        if (args.isEmpty()) {
            throw new TemplateException("wrong number of args for index: want at least 1 got 0");
        }

        Object current = args.get(0);

        for (Object key : args.subList(1, args.size())) {
            if (current instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) current;
                if (!map.containsKey(string(key))) {
                    throw new TemplateException("map has no entry for key \"%s\"", string(key));
                }
                current = map.get(string(key));
            } else if (current instanceof List && key instanceof Number) {
                List<?> list = (List<?>) current;
                int i = ((Number) key).intValue();
                if (i < 0 || i >= list.size()) {
                    throw new TemplateException("index out of range: %d", i);
                }
                current = list.get(i);
            } else {
                throw new TemplateException("can't index item of type %s", current == null ? "nil" : current.getClass().getSimpleName());
            }
        }

        return current;
    }

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isEmpty();
        }
        if (value instanceof byte[]) {
            return ((byte[]) value).length == 0;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() == 0;
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        return false;
    }

    static TemporalAccessor time(Object value) {
        if (value instanceof TemporalAccessor) {
            return value instanceof Instant ? ((Instant) value).atZone(ZoneOffset.UTC) : (TemporalAccessor) value;
        }
        if (value instanceof Number) {
            return Instant.ofEpochSecond(((Number) value).longValue()).atZone(ZoneOffset.UTC);
        }
        try {
            return ZonedDateTime.parse(string(value));
        } catch (java.time.format.DateTimeParseException e) {
            throw new TemplateException("date: cannot interpret %s as a time", string(value));
        }
    }
}
