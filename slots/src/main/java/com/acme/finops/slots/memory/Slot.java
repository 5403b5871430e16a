package com.acme.finops.slots.memory;

/**
 * Contents of one pool slot. Only read or replaced while the slot's lock is held.
 */
sealed interface Slot<T> permits Slot.Occupied, Slot.Vacant {

    /** Marker {@code next} for a vacant slot claimed by a live guard. */
    int CLAIMED = -1;

    record Occupied<T>(T value) implements Slot<T> {}

    /**
     * Free-list link. {@code next} is the next vacant key, the pool capacity
     * at the end of the list, or {@link #CLAIMED} while a guard owns the slot.
     */
    record Vacant<T>(int next) implements Slot<T> {
        boolean isClaimed() {
            return next == CLAIMED;
        }
    }
}
