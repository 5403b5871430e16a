package com.acme.finops.slots.memory;

import com.acme.finops.slots.telemetry.NoopSlotPoolMetrics;
import com.acme.finops.slots.telemetry.SlotPoolMetrics;
import com.acme.finops.slots.util.SlotPoolConfig;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Fixed-capacity slot pool keyed by small integer indices.
 *
 * <p>Every slot has its own lock; vacant slots are threaded into a singly linked
 * free list whose head is a single {@link AtomicInteger}. Threads claim a slot with
 * {@link #reserve()}, fill it, and hand the key to other threads which open it with
 * {@link #get(int)}. No operation ever holds two slot locks, so slots cannot
 * deadlock against each other.
 *
 * <h3>Free-list protocol</h3>
 * <ul>
 *   <li><b>Pop</b> ({@link #reserve()}): read head {@code k}, lock slot {@code k},
 *       and only if it is still {@code Vacant(next)} CAS the head {@code k → next}.
 *       A slot found occupied, or a lost CAS, unlocks and retries with a fresh head.</li>
 *   <li><b>Push</b> (closing a guard over an empty slot): while holding the slot's
 *       lock, link {@code next = head} and CAS the head to the key, looping until
 *       the CAS wins.</li>
 *   <li>A slot's {@code next} is only written under its lock, and a slot can only be
 *       popped or pushed by its lock holder. So once the pop CAS sees {@code head == k}
 *       the {@code next} read under the lock is current.</li>
 *   <li>The head is never written with a plain store after construction. A plain
 *       store would drop a concurrently pushed key from the list.</li>
 * </ul>
 *
 * <p>Keys are addresses, not identities: a released key is handed out again.
 * Callers that need to detect reuse must pair the key with their own generation tag.
 */
public final class SlotPool<T> {
    private static final Logger LOG = Logger.getLogger(SlotPool.class.getName());

    private static final Slot.Vacant<?> CLAIMED_SLOT = new Slot.Vacant<>(Slot.CLAIMED);

    private final Cell<T>[] cells;
    private final int capacity;
    private final AtomicInteger head;
    private final SlotPoolMetrics metrics;

    private final AtomicLong reserveCount = new AtomicLong();
    private final AtomicLong releaseCount = new AtomicLong();
    private final AtomicLong exhaustedCount = new AtomicLong();
    private final AtomicLong contendedRetries = new AtomicLong();

    public SlotPool(int capacity) {
        this(capacity, NoopSlotPoolMetrics.INSTANCE);
    }

    /**
     * Creates a pool of {@code capacity} vacant slots linked {@code 0 → 1 → … → capacity-1}.
     *
     * @param capacity number of slots, fixed for the pool's lifetime (may be 0)
     * @param metrics  counter sink, possibly shared between pools
     */
    @SuppressWarnings("unchecked")
    public SlotPool(int capacity, SlotPoolMetrics metrics) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.cells = (Cell<T>[]) new Cell<?>[capacity];
        for (int i = 0; i < capacity; i++) {
            cells[i] = new Cell<>(new Slot.Vacant<>(i + 1));
        }
        // capacity doubles as the end-of-list sentinel, so an empty pool starts full
        this.head = new AtomicInteger(0);
        LOG.fine(() -> "SlotPool created with capacity=" + capacity);
    }

    public static <T> SlotPool<T> fromConfig(SlotPoolConfig config, SlotPoolMetrics metrics) {
        Objects.requireNonNull(config, "config");
        return new SlotPool<>(config.poolCapacity(), metrics);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Claims one vacant slot.
     *
     * <p>Blocks only while another thread holds the lock of the slot at the head of
     * the free list. Does not wait for a slot to become free.
     *
     * @return a guard owning the slot, or {@code null} if every slot is in use
     */
    public Reserved<T> reserve() {
        for (;;) {
            int key = head.get();
            if (key == capacity) {
                exhaustedCount.incrementAndGet();
                metrics.incExhausted(1);
                return null;
            }
            if (key < 0 || key > capacity) {
                throw corrupted(key, "Free-list head out of range");
            }

            Cell<T> cell = cells[key];
            cell.lock.lock();
            Slot<T> slot = cell.slot;
            if (slot instanceof Slot.Vacant<T> vacant) {
                if (vacant.isClaimed()) {
                    cell.lock.unlock();
                    throw corrupted(key, "Free-list head points at a claimed slot");
                }
                if (head.compareAndSet(key, vacant.next())) {
                    cell.slot = claimed();
                    reserveCount.incrementAndGet();
                    metrics.incReserved(1);
                    return new Reserved<>(new SlotRef<>(this, cell, key));
                }
            }
            // Occupied: another reserver popped this key first.
            // Vacant with a lost CAS: the key is no longer at the head.
            cell.lock.unlock();
            contendedRetries.incrementAndGet();
            metrics.incContendedRetries(1);
        }
    }

    /**
     * Opens the value stored under {@code key}, blocking while another guard holds it.
     *
     * @return a guard over the value, or {@code null} if the key is out of range or empty
     * @throws IllegalStateException if the calling thread already holds a guard for {@code key}
     */
    public Occupied<T> get(int key) {
        Cell<T> cell = lockCell(key);
        if (cell == null) {
            return null;
        }
        if (!(cell.slot instanceof Slot.Occupied)) {
            // Vacant slots are already linked; unlock without touching the free list.
            cell.lock.unlock();
            return null;
        }
        return new Occupied<>(new SlotRef<>(this, cell, key));
    }

    /**
     * Removes and returns the value stored under {@code key}; the key is back on the
     * free list when this returns.
     *
     * @return the removed value, or {@code null} if the key is out of range or empty
     */
    public T take(int key) {
        Occupied<T> occupied = get(key);
        if (occupied == null) {
            return null;
        }
        try (Taken<T> taken = occupied.take()) {
            return taken.value();
        }
    }

    /**
     * Reserves a slot and stores {@code item} in it.
     *
     * @return the assigned key, or {@code -1} if the pool is full
     */
    public int insert(T item) {
        Objects.requireNonNull(item, "item");
        Reserved<T> reserved = reserve();
        if (reserved == null) {
            return -1;
        }
        try (Occupied<T> occupied = reserved.insert(item)) {
            return occupied.key();
        }
    }

    /** Snapshot check; the answer may be stale by the time it is returned. */
    public boolean isFull() {
        return head.get() == capacity;
    }

    public SlotPoolStats stats() {
        long reserved = reserveCount.get();
        long released = releaseCount.get();
        return new SlotPoolStats(
            capacity,
            reserved,
            released,
            exhaustedCount.get(),
            contendedRetries.get(),
            Math.max(0L, reserved - released)
        );
    }

    /** Links {@code key} in as the new free-list head. Caller holds the slot's lock. */
    void pushFree(Cell<T> cell, int key) {
        int current;
        do {
            current = head.get();
            cell.slot = new Slot.Vacant<>(current);
        } while (!head.compareAndSet(current, key));
        releaseCount.incrementAndGet();
        metrics.incReleased(1);
    }

    private Cell<T> lockCell(int key) {
        if (key < 0 || key >= capacity) {
            return null;
        }
        Cell<T> cell = cells[key];
        if (cell.lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Slot " + key + " is already guarded by the current thread");
        }
        cell.lock.lock();
        return cell;
    }

    @SuppressWarnings("unchecked")
    static <T> Slot<T> claimed() {
        return (Slot<T>) (Slot<?>) CLAIMED_SLOT;
    }

    static SlotPoolCorruptedException corrupted(int key, String message) {
        SlotPoolCorruptedException e = new SlotPoolCorruptedException(key, message);
        LOG.severe(e.getMessage());
        return e;
    }

    /** One slot and its lock. {@code slot} is guarded by {@code lock}. */
    static final class Cell<T> {
        final ReentrantLock lock = new ReentrantLock();
        Slot<T> slot;

        Cell(Slot<T> slot) {
            this.slot = slot;
        }
    }
}
