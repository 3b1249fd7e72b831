package com.suko.lendpool;

import java.time.Duration;

/**
 * Point-in-time counters of an {@link ObjectPool}.
 */
public final class PoolStats {

    /** Returned while statistics are disabled. */
    public static final PoolStats EMPTY = new PoolStats(0, 0, 0, 0, 0, 0, Duration.ZERO, Duration.ZERO);

    /** Requests served with an idle object. */
    public final long hits;
    /** Requests that had to create a new object. */
    public final long misses;
    /** Idle objects evicted by the idle reaper. */
    public final long cleanups;
    /** Highest number of objects lent out at the same time. */
    public final int peakUsage;
    /** Requests that had to block before being served or timing out. */
    public final long waitCount;
    public final long timeoutCount;
    public final Duration totalWaitTime;
    public final Duration maxWaitTime;

    public PoolStats(long hits, long misses, long cleanups, int peakUsage, long waitCount,
                     long timeoutCount, Duration totalWaitTime, Duration maxWaitTime) {
        this.hits = hits;
        this.misses = misses;
        this.cleanups = cleanups;
        this.peakUsage = peakUsage;
        this.waitCount = waitCount;
        this.timeoutCount = timeoutCount;
        this.totalWaitTime = totalWaitTime;
        this.maxWaitTime = maxWaitTime;
    }

    /**
     * @return fraction of served objects that were reused, or 0 before the first request
     */
    public double hitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public Duration averageWaitTime() {
        return waitCount == 0 ? Duration.ZERO : totalWaitTime.dividedBy(waitCount);
    }

    @Override
    public String toString() {
        return "PoolStats{" +
                "hits=" + hits +
                ", misses=" + misses +
                ", cleanups=" + cleanups +
                ", peakUsage=" + peakUsage +
                ", waitCount=" + waitCount +
                ", timeoutCount=" + timeoutCount +
                ", totalWaitTime=" + totalWaitTime +
                ", maxWaitTime=" + maxWaitTime +
                '}';
    }
}
