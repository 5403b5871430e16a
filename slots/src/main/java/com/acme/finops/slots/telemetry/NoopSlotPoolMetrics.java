package com.acme.finops.slots.telemetry;

public final class NoopSlotPoolMetrics implements SlotPoolMetrics {
    public static final NoopSlotPoolMetrics INSTANCE = new NoopSlotPoolMetrics();

    private NoopSlotPoolMetrics() {
    }

    @Override
    public void incReserved(long n) {
    }

    @Override
    public void incReleased(long n) {
    }

    @Override
    public void incExhausted(long n) {
    }

    @Override
    public void incContendedRetries(long n) {
    }
}
