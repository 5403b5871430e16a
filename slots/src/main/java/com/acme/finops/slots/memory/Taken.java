package com.acme.finops.slots.memory;

/**
 * Result of {@link Occupied#take()}: the removed value plus the still-held slot.
 * Closing it closes {@code reserved}, which returns the key to the free list.
 */
public record Taken<T>(T value, Reserved<T> reserved) implements AutoCloseable {
    @Override
    public void close() {
        reserved.close();
    }
}
