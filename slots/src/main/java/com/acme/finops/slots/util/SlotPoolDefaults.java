package com.acme.finops.slots.util;

/**
 * Defaults and bounds used when the corresponding environment variable is not set.
 */
public final class SlotPoolDefaults {

    // ---- Pool ----
    public static final int DEFAULT_POOL_CAPACITY = 1024;
    public static final int MAX_POOL_CAPACITY = 1 << 24;

    // ---- Duplicate window ----
    public static final int DEFAULT_WINDOW_WORDS = 3;
    public static final int MAX_WINDOW_WORDS = 1024;

    // ---- Metrics ----
    public static final long DEFAULT_METRICS_LOG_INTERVAL_SEC = 30L;
    public static final long MAX_METRICS_LOG_INTERVAL_SEC = 3600L;

    private SlotPoolDefaults() {
    }
}
