package com.acme.finops.slots.telemetry;

public interface SlotPoolMetrics {
    void incReserved(long n);
    void incReleased(long n);
    void incExhausted(long n);
    void incContendedRetries(long n);
}
