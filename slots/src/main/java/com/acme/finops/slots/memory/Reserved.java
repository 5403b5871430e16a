package com.acme.finops.slots.memory;

import java.util.Objects;

/**
 * Guard over a claimed, still empty slot.
 *
 * <p>Consumed by {@link #insert} or by {@link #close()}; closing returns the key to
 * the pool's free list. Must be used and closed on the thread that obtained it.
 */
public final class Reserved<T> implements AutoCloseable {
    private SlotRef<T> ref;

    Reserved(SlotRef<T> ref) {
        this.ref = ref;
    }

    public int key() {
        return live().key();
    }

    /**
     * Stores {@code item} and converts this guard into an {@link Occupied} guard
     * over the same lock. This guard is consumed.
     */
    public Occupied<T> insert(T item) {
        Objects.requireNonNull(item, "item");
        SlotRef<T> held = live();
        held.slot(new Slot.Occupied<>(item));
        ref = null;
        return new Occupied<>(held);
    }

    public boolean isConsumed() {
        return ref == null;
    }

    @Override
    public void close() {
        SlotRef<T> held = ref;
        if (held == null) {
            return;
        }
        held.requireOwner();
        ref = null;
        held.release();
    }

    private SlotRef<T> live() {
        SlotRef<T> held = ref;
        if (held == null) {
            throw new IllegalStateException("Reserved guard already consumed");
        }
        held.requireOwner();
        return held;
    }
}
