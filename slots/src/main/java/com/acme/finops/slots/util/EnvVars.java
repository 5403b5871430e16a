package com.acme.finops.slots.util;

import java.util.Map;

/**
 * Environment lookups with defaulting and clamping. Blank values count as unset.
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    /** Malformed numbers fall back to {@code defaultValue}; out-of-range ones are clamped. */
    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }
}
