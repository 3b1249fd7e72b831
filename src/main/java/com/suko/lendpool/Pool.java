package com.suko.lendpool;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal lending interface for bounded object pools.
 *
 * @param <T> the type of objects to pool
 */
public interface Pool<T> {

    /**
     * Acquires an object, blocking until one can be lent to a caller of the given priority.
     *
     * @param priority the service order among blocked callers
     * @return a loan that must be closed to return the object
     * @throws PoolExhaustedException if the pool has no capacity at all
     */
    Pooled<T> acquire(Priority priority);

    default Pooled<T> acquire() {
        return acquire(Priority.NORMAL);
    }

    /**
     * Acquires an object, waiting at most {@code timeout}.
     *
     * @param timeout the longest time to wait; zero or negative makes a single attempt
     * @param priority the service order among blocked callers
     * @return the loan, or empty if the wait expired
     */
    Optional<Pooled<T>> tryAcquireFor(Duration timeout, Priority priority);

    default Optional<Pooled<T>> tryAcquireFor(Duration timeout) {
        return tryAcquireFor(timeout, Priority.NORMAL);
    }

    /**
     * Attempts to acquire an object without waiting.
     *
     * @return the loan, or empty if nothing can be lent right now
     */
    default Optional<Pooled<T>> tryAcquire() {
        return tryAcquireFor(Duration.ZERO, Priority.NORMAL);
    }

    /**
     * Returns how many more objects could be lent before callers start blocking.
     */
    int available();

    /**
     * Returns the number of idle objects held by the pool.
     */
    int size();
}
