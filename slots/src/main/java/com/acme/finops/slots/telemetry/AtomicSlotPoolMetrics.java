package com.acme.finops.slots.telemetry;

import java.util.concurrent.atomic.LongAdder;

/**
 * Contention-friendly counters. One instance may be shared by several pools to
 * get process-wide totals.
 */
public final class AtomicSlotPoolMetrics implements SlotPoolMetrics {
    private final LongAdder reserved = new LongAdder();
    private final LongAdder released = new LongAdder();
    private final LongAdder exhausted = new LongAdder();
    private final LongAdder contendedRetries = new LongAdder();

    @Override
    public void incReserved(long n) {
        reserved.add(Math.max(0L, n));
    }

    @Override
    public void incReleased(long n) {
        released.add(Math.max(0L, n));
    }

    @Override
    public void incExhausted(long n) {
        exhausted.add(Math.max(0L, n));
    }

    @Override
    public void incContendedRetries(long n) {
        contendedRetries.add(Math.max(0L, n));
    }

    public Snapshot snapshot() {
        long r = reserved.sum();
        long rel = released.sum();
        return new Snapshot(r, rel, exhausted.sum(), contendedRetries.sum(), Math.max(0L, r - rel));
    }

    public record Snapshot(long reserved,
                           long released,
                           long exhausted,
                           long contendedRetries,
                           long inUseApprox) {}
}
