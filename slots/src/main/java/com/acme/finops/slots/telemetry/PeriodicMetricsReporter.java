package com.acme.finops.slots.telemetry;

import com.acme.finops.slots.util.JsonCodec;
import com.acme.finops.slots.util.SlotPoolConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs a JSON line with the pool counters at a fixed interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicSlotPoolMetrics metrics;
    private final Supplier<Map<String, Long>> gaugesSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicSlotPoolMetrics metrics, long intervalSeconds) {
        this(metrics, intervalSeconds, Map::of);
    }

    /**
     * @param gaugesSupplier extra point-in-time values (for example a pool's
     *                       {@code inUse}) sampled on every tick
     */
    public PeriodicMetricsReporter(AtomicSlotPoolMetrics metrics,
                                   long intervalSeconds,
                                   Supplier<Map<String, Long>> gaugesSupplier) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.gaugesSupplier = gaugesSupplier == null ? Map::of : gaugesSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "slots-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Builds an unstarted reporter ticking every {@code metricsLogIntervalSec}, or
     * returns {@code null} when metrics are disabled or {@code metrics} does not count.
     */
    public static PeriodicMetricsReporter fromConfig(SlotPoolConfig config,
                                                     SlotPoolMetrics metrics,
                                                     Supplier<Map<String, Long>> gaugesSupplier) {
        if (!config.metricsEnabled() || !(metrics instanceof AtomicSlotPoolMetrics atomic)) {
            return null;
        }
        LOG.fine(() -> "Metrics reporter interval=" + config.metricsLogIntervalSec() + "s");
        return new PeriodicMetricsReporter(atomic, config.metricsLogIntervalSec(), gaugesSupplier);
    }

    public long intervalSeconds() {
        return intervalSeconds;
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    Map<String, Object> payload() {
        AtomicSlotPoolMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "slots");
        payload.put("type", "slot_pool_metrics");
        payload.put("reserved", s.reserved());
        payload.put("released", s.released());
        payload.put("exhausted", s.exhausted());
        payload.put("contendedRetries", s.contendedRetries());
        payload.put("inUseApprox", s.inUseApprox());
        Map<String, Long> gauges = gaugesSupplier.get();
        if (gauges != null && !gauges.isEmpty()) {
            payload.put("gauges", gauges);
        }
        return payload;
    }

    private void emit() {
        try {
            LOG.info(JsonCodec.render(payload()));
        } catch (Throwable t) {
            // a failed tick must not cancel the schedule
            LOG.warning("Metrics reporter failure: " + t.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
