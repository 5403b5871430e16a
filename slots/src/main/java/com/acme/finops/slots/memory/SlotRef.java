package com.acme.finops.slots.memory;

/**
 * Exclusive hold on one locked slot, shared by {@link Reserved} and {@link Occupied}.
 * Ownership moves between guards by handing this object over; it is released once.
 */
final class SlotRef<T> {
    private final SlotPool<T> pool;
    private final SlotPool.Cell<T> cell;
    private final int key;

    SlotRef(SlotPool<T> pool, SlotPool.Cell<T> cell, int key) {
        this.pool = pool;
        this.cell = cell;
        this.key = key;
    }

    int key() {
        return key;
    }

    Slot<T> slot() {
        return cell.slot;
    }

    void slot(Slot<T> slot) {
        cell.slot = slot;
    }

    /**
     * Unlocks the slot. A slot left vacant is pushed onto the free list first,
     * while the lock is still held, so a reserver that read this key as the
     * new head only sees it after the link is in place.
     */
    void release() {
        requireOwner();
        try {
            if (cell.slot instanceof Slot.Vacant) {
                pool.pushFree(cell, key);
            }
        } finally {
            cell.lock.unlock();
        }
    }

    /**
     * Guards are confined to the thread holding the slot lock. Checked before a
     * guard changes any state, so a foreign close leaves the pool untouched.
     */
    void requireOwner() {
        if (!cell.lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Slot " + key + " is locked by another thread");
        }
    }
}
