package com.acme.finops.slots.telemetry;

import com.acme.finops.slots.memory.SlotPool;
import com.acme.finops.slots.util.JsonCodec;
import com.acme.finops.slots.util.SlotPoolConfig;
import com.acme.finops.slots.util.SlotPoolEnvKeys;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodicMetricsReporterTest {

    @Test
    void payloadShouldCarryCountersAndPoolGauges() throws Exception {
        AtomicSlotPoolMetrics metrics = new AtomicSlotPoolMetrics();
        SlotPool<String> pool = new SlotPool<>(2, metrics);
        int key = pool.insert("a");
        pool.insert("b");
        pool.insert("c");
        pool.take(key);

        try (PeriodicMetricsReporter reporter = new PeriodicMetricsReporter(metrics, 60,
            () -> Map.of("inUse", pool.stats().inUse(), "capacity", (long) pool.capacity()))) {
            JsonNode json = JsonCodec.readTree(JsonCodec.writeString(reporter.payload()));

            assertEquals("slot_pool_metrics", json.get("type").asText());
            assertEquals(2L, json.get("reserved").asLong());
            assertEquals(1L, json.get("released").asLong());
            assertEquals(1L, json.get("exhausted").asLong());
            assertEquals(1L, json.get("inUseApprox").asLong());
            assertEquals(1L, json.get("gauges").get("inUse").asLong());
            assertEquals(2L, json.get("gauges").get("capacity").asLong());
        }
    }

    @Test
    void payloadShouldOmitEmptyGaugesAndClampInterval() {
        try (PeriodicMetricsReporter reporter = new PeriodicMetricsReporter(new AtomicSlotPoolMetrics(), 0)) {
            assertEquals(1L, reporter.intervalSeconds());
            Map<String, Object> payload = reporter.payload();
            assertFalse(payload.containsKey("gauges"));
            assertTrue(JsonCodec.render(payload).startsWith("{\"component\":\"slots\""));
        }
    }

    @Test
    void shouldStartAndCloseWithoutError() {
        PeriodicMetricsReporter reporter = new PeriodicMetricsReporter(new AtomicSlotPoolMetrics(), 3600, null);
        reporter.start();
        reporter.close();
    }

    @Test
    void shouldBuildReporterOnlyWhenMetricsAreEnabled() {
        SlotPoolConfig disabled = SlotPoolConfig.defaults();
        assertNull(PeriodicMetricsReporter.fromConfig(disabled, disabled.newMetrics(), null));

        SlotPoolConfig enabled = SlotPoolConfig.fromEnv(Map.of(
            SlotPoolEnvKeys.SLOTS_METRICS_ENABLED, "true",
            SlotPoolEnvKeys.SLOTS_METRICS_LOG_INTERVAL_SEC, "7"
        ));
        assertNull(PeriodicMetricsReporter.fromConfig(enabled, NoopSlotPoolMetrics.INSTANCE, null));

        SlotPoolMetrics metrics = enabled.newMetrics();
        SlotPool<String> pool = SlotPool.fromConfig(enabled, metrics);
        pool.insert("a");
        try (PeriodicMetricsReporter reporter = PeriodicMetricsReporter.fromConfig(enabled, metrics,
            () -> Map.of("inUse", pool.stats().inUse()))) {
            assertNotNull(reporter);
            assertEquals(7L, reporter.intervalSeconds());
            Map<String, Object> payload = reporter.payload();
            assertEquals(1L, payload.get("reserved"));
            assertEquals(Map.of("inUse", 1L), payload.get("gauges"));
        }
    }

    @Test
    void shouldKeepTickingAfterAnErrorInOneTick() throws Exception {
        CountDownLatch ticks = new CountDownLatch(2);
        try (PeriodicMetricsReporter reporter = new PeriodicMetricsReporter(new AtomicSlotPoolMetrics(), 1, () -> {
            ticks.countDown();
            throw new AssertionError("gauge failure");
        })) {
            reporter.start();
            assertTrue(ticks.await(10, TimeUnit.SECONDS), "reporter stopped after a failed tick");
        }
    }
}
