package com.acme.finops.slots.util;

import com.acme.finops.slots.telemetry.AtomicSlotPoolMetrics;
import com.acme.finops.slots.telemetry.NoopSlotPoolMetrics;
import com.acme.finops.slots.telemetry.SlotPoolMetrics;

import java.util.Map;

public record SlotPoolConfig(int poolCapacity,
                             int windowWords,
                             boolean metricsEnabled,
                             long metricsLogIntervalSec) {

    public SlotPoolConfig {
        if (poolCapacity < 0) {
            throw new IllegalArgumentException("poolCapacity must be >= 0, got " + poolCapacity);
        }
        if (windowWords <= 0) {
            throw new IllegalArgumentException("windowWords must be positive, got " + windowWords);
        }
        if (metricsLogIntervalSec <= 0) {
            throw new IllegalArgumentException("metricsLogIntervalSec must be positive, got " + metricsLogIntervalSec);
        }
    }

    /** Counting metrics when {@code metricsEnabled}, otherwise the shared no-op sink. */
    public SlotPoolMetrics newMetrics() {
        return metricsEnabled ? new AtomicSlotPoolMetrics() : NoopSlotPoolMetrics.INSTANCE;
    }

    public static SlotPoolConfig defaults() {
        return fromEnv(Map.of());
    }

    public static SlotPoolConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static SlotPoolConfig fromEnv(Map<String, String> env) {
        return new SlotPoolConfig(
            EnvVars.getIntClamped(env, SlotPoolEnvKeys.SLOTS_POOL_CAPACITY,
                SlotPoolDefaults.DEFAULT_POOL_CAPACITY, 0, SlotPoolDefaults.MAX_POOL_CAPACITY),
            EnvVars.getIntClamped(env, SlotPoolEnvKeys.SLOTS_WINDOW_WORDS,
                SlotPoolDefaults.DEFAULT_WINDOW_WORDS, 1, SlotPoolDefaults.MAX_WINDOW_WORDS),
            EnvVars.getBoolean(env, SlotPoolEnvKeys.SLOTS_METRICS_ENABLED, false),
            EnvVars.getLongClamped(env, SlotPoolEnvKeys.SLOTS_METRICS_LOG_INTERVAL_SEC,
                SlotPoolDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1L, SlotPoolDefaults.MAX_METRICS_LOG_INTERVAL_SEC)
        );
    }
}
