package com.suko.lendpool;

import java.time.Duration;

/**
 * Mutable counters behind {@link PoolStats}. Not thread-safe: every call happens under the
 * owning pool's lock.
 */
final class StatsTracker {
    private boolean enabled = true;

    private long hits;
    private long misses;
    private long cleanups;
    private int peakUsage;
    private long waitCount;
    private long timeoutCount;
    private long totalWaitNanos;
    private long maxWaitNanos;

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    void recordHit() {
        if (enabled) hits++;
    }

    void recordMiss() {
        if (enabled) misses++;
    }

    void recordCleanups(int removed) {
        if (enabled) cleanups += removed;
    }

    void recordUsage(int inUse) {
        if (enabled && inUse > peakUsage) {
            peakUsage = inUse;
        }
    }

    void recordWait(long waitedNanos) {
        if (!enabled) {
            return;
        }
        waitCount++;
        totalWaitNanos += waitedNanos;
        if (waitedNanos > maxWaitNanos) {
            maxWaitNanos = waitedNanos;
        }
    }

    void recordTimeout() {
        if (enabled) timeoutCount++;
    }

    void reset() {
        hits = 0;
        misses = 0;
        cleanups = 0;
        peakUsage = 0;
        waitCount = 0;
        timeoutCount = 0;
        totalWaitNanos = 0;
        maxWaitNanos = 0;
    }

    PoolStats snapshot() {
        if (!enabled) {
            return PoolStats.EMPTY;
        }
        return new PoolStats(hits, misses, cleanups, peakUsage, waitCount, timeoutCount,
                Duration.ofNanos(totalWaitNanos), Duration.ofNanos(maxWaitNanos));
    }
}
