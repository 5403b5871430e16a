package com.acme.finops.slots.memory;

import java.util.Objects;

/**
 * Guard over a slot holding a value. Closing it only unlocks the slot: the value
 * stays stored and later {@link SlotPool#get} calls see it. {@link #take()} empties
 * the slot and hands back a {@link Reserved} guard for the same key.
 */
public final class Occupied<T> implements AutoCloseable {
    private SlotRef<T> ref;

    Occupied(SlotRef<T> ref) {
        this.ref = ref;
    }

    public int key() {
        return live().key();
    }

    public T get() {
        return occupant(live()).value();
    }

    /** Replaces the stored value, returning the previous one. */
    public T set(T item) {
        Objects.requireNonNull(item, "item");
        SlotRef<T> held = live();
        T previous = occupant(held).value();
        held.slot(new Slot.Occupied<>(item));
        return previous;
    }

    /**
     * Removes the value. The slot stays locked and claimed by the returned
     * {@link Reserved}; this guard is consumed.
     */
    public Taken<T> take() {
        SlotRef<T> held = live();
        T value = occupant(held).value();
        held.slot(SlotPool.claimed());
        ref = null;
        return new Taken<>(value, new Reserved<>(held));
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
            throw new IllegalStateException("Occupied guard already consumed");
        }
        held.requireOwner();
        return held;
    }

    private static <T> Slot.Occupied<T> occupant(SlotRef<T> held) {
        if (held.slot() instanceof Slot.Occupied<T> occupied) {
            return occupied;
        }
        throw SlotPool.corrupted(held.key(), "Occupied guard found an empty slot");
    }
}
