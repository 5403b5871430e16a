package com.acme.finops.slots.memory;

/**
 * Thrown when the pool detects a broken internal invariant (free-list head out of
 * range, a guard observing its slot in the wrong state). The pool must not be
 * used after this; continuing risks handing the same key to two owners.
 */
public final class SlotPoolCorruptedException extends IllegalStateException {
    private final int key;

    public SlotPoolCorruptedException(int key, String message) {
        super(message + ", key=" + key);
        this.key = key;
    }

    public int key() {
        return key;
    }
}
