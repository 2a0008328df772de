package io.atelier.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Settings lookup: environment variable, then system property of the same name, then the default.
 * Unparseable numbers fall back to the default with a warning.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, Integer::valueOf, defaultValue);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, Long::valueOf, defaultValue);
    }

    private static <T> T parse(String key, Function<String, T> parser, T defaultValue) {
        String raw = get(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number, using {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private Env() {}
}
