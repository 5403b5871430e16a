package com.acme.finops.slots.memory;

public record SlotPoolStats(int capacity,
                            long reserveCount,
                            long releaseCount,
                            long exhaustedCount,
                            long contendedRetries,
                            long inUse) {}
