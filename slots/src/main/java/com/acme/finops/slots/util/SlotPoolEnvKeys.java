package com.acme.finops.slots.util;

/**
 * Environment variable names read by {@link SlotPoolConfig#fromEnv()}.
 */
public final class SlotPoolEnvKeys {
    public static final String SLOTS_POOL_CAPACITY = "SLOTS_POOL_CAPACITY";
    public static final String SLOTS_WINDOW_WORDS = "SLOTS_WINDOW_WORDS";

    public static final String SLOTS_METRICS_ENABLED = "SLOTS_METRICS_ENABLED";
    public static final String SLOTS_METRICS_LOG_INTERVAL_SEC = "SLOTS_METRICS_LOG_INTERVAL_SEC";

    private SlotPoolEnvKeys() {
    }
}
