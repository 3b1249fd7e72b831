package com.suko.lendpool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A bounded, blocking object pool that lends {@link Resettable} objects through {@link Pooled}
 * handles.
 *
 * <p>The pool never holds more than {@code capacity} objects, counting both idle objects and
 * objects lent out. Objects are created lazily by the creator on a miss, reset and kept when
 * their handle is closed, and evicted by the idle reaper once they stay unused for longer than
 * {@link PoolConfig#getMaxIdleTime()}. When nothing can be lent, callers block; among blocked
 * callers the one with the highest {@link Priority} is served first.
 *
 * <p>All state is guarded by a single {@link ReentrantLock}. The creator, validator, destroyer
 * and {@link Resettable#reset()} are invoked while that lock is held and must not call back
 * into the pool.
 *
 * @param <T> the type of objects to pool
 */
public class ObjectPool<T extends Resettable> implements Pool<T>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ObjectPool.class);

    private static final long NO_TIMEOUT = -1L;

    private final ReentrantLock lock = new ReentrantLock();
    private final WaitQueue waiters = new WaitQueue(lock);
    private final IdleObjects<T> idle = new IdleObjects<>();
    private final StatsTracker stats = new StatsTracker();
    private final Supplier<? extends T> creator;

    private PoolConfig<T> config;
    private int capacity;
    // capacity not taken by idle or lent objects
    private int availableSlots;
    private long lastCleanupNanos;
    private boolean closed;

    public ObjectPool(int capacity, Supplier<? extends T> creator) {
        this(capacity, 0, creator, PoolConfig.defaults());
    }

    public ObjectPool(int capacity, int prefill, Supplier<? extends T> creator) {
        this(capacity, prefill, creator, PoolConfig.defaults());
    }

    /**
     * Creates a new pool.
     *
     * @param capacity the maximum number of objects alive at once, idle or lent
     * @param prefill the number of idle objects to create eagerly
     * @param creator the factory invoked on a miss
     * @param config the runtime configuration
     */
    public ObjectPool(int capacity, int prefill, Supplier<? extends T> creator, PoolConfig<T> config) {
        if (creator == null) {
            throw new IllegalArgumentException("Creator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (prefill < 0 || prefill > capacity) {
            throw new IllegalArgumentException(
                    "Prefill must be between 0 and capacity (" + capacity + "), was " + prefill);
        }

        this.creator = creator;
        this.config = config;
        this.capacity = capacity;
        this.availableSlots = capacity;
        this.lastCleanupNanos = System.nanoTime();
        this.stats.setEnabled(config.isEnableStats());

        fill(prefill);
        log.info("Object pool initialized: capacity={}, prefill={}, {}", capacity, prefill, config);
    }

    @Override
    public Pooled<T> acquire(Priority priority) {
        requirePriority(priority);
        lock.lock();
        try {
            ensureOpen();
            awaitTurn(priority, 1, null, NO_TIMEOUT, true);
            return lend(take(null));
        } finally {
            wakeNextIfSpare();
            lock.unlock();
        }
    }

    @Override
    public Optional<Pooled<T>> tryAcquireFor(Duration timeout, Priority priority) {
        if (timeout == null) {
            throw new IllegalArgumentException("Timeout cannot be null");
        }
        requirePriority(priority);
        long timeoutNanos = timeout.isNegative() ? 0L : saturatedNanos(timeout);

        lock.lock();
        try {
            ensureOpen();
            if (!awaitTurn(priority, 1, null, timeoutNanos, false)) {
                return Optional.empty();
            }
            return Optional.of(lend(take(null)));
        } finally {
            wakeNextIfSpare();
            lock.unlock();
        }
    }

    public Pooled<T> acquireValidated(Predicate<? super T> predicate) {
        return acquireValidated(predicate, Priority.NORMAL);
    }

    /**
     * Acquires an idle object accepted by {@code predicate}, or a newly created one when a slot
     * is free. Idle objects the predicate rejects are never lent; if nothing qualifies and the
     * pool is full, the caller waits.
     *
     * @param predicate selects acceptable idle objects
     * @param priority the service order among blocked callers
     * @return a loan that must be closed to return the object
     */
    public Pooled<T> acquireValidated(Predicate<? super T> predicate, Priority priority) {
        if (predicate == null) {
            throw new IllegalArgumentException("Predicate cannot be null");
        }
        requirePriority(priority);
        lock.lock();
        try {
            ensureOpen();
            awaitTurn(priority, 1, predicate, NO_TIMEOUT, true);
            return lend(take(predicate));
        } finally {
            wakeNextIfSpare();
            lock.unlock();
        }
    }

    public List<Pooled<T>> acquireBatch(int count) {
        return acquireBatch(count, Priority.NORMAL);
    }

    /**
     * Acquires {@code count} objects as one unit, blocking until all of them can be lent.
     * Idle objects are used before new ones are created.
     *
     * @param count the number of objects, zero yields an empty list
     * @param priority the service order among blocked callers
     * @return the loans, each of which must be closed
     * @throws PoolExhaustedException if {@code count} exceeds the capacity
     */
    public List<Pooled<T>> acquireBatch(int count, Priority priority) {
        if (count < 0) {
            throw new IllegalArgumentException("Batch size must be >= 0");
        }
        requirePriority(priority);
        if (count == 0) {
            return new ArrayList<>();
        }

        lock.lock();
        try {
            ensureOpen();
            awaitTurn(priority, count, null, NO_TIMEOUT, true);

            List<IdleObjects.Entry<T>> reused = new ArrayList<>(count);
            List<T> created = new ArrayList<>();
            try {
                while (reused.size() + created.size() < count) {
                    IdleObjects.Entry<T> entry = takeIdle(null);
                    if (entry != null) {
                        reused.add(entry);
                    } else {
                        created.add(create());
                    }
                }
            } catch (RuntimeException | Error e) {
                // all or nothing: reused objects keep their idle time, new ones start idling now
                for (int i = reused.size() - 1; i >= 0; i--) {
                    idle.restore(reused.get(i));
                }
                long now = System.nanoTime();
                for (T object : created) {
                    idle.add(object, now);
                }
                throw e;
            }

            List<Pooled<T>> batch = new ArrayList<>(count);
            for (IdleObjects.Entry<T> entry : reused) {
                stats.recordHit();
                batch.add(lend(entry.object));
            }
            for (T object : created) {
                stats.recordMiss();
                batch.add(lend(object));
            }
            return batch;
        } finally {
            wakeNextIfSpare();
            lock.unlock();
        }
    }

    /**
     * Eagerly creates idle objects from free slots.
     *
     * @param count the number of objects to create
     * @throws IllegalArgumentException if fewer than {@code count} slots are free
     */
    public void prefill(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Prefill count must be >= 0");
        }
        lock.lock();
        try {
            ensureOpen();
            fill(count);
        } finally {
            wakeNextIfSpare();
            lock.unlock();
        }
    }

    /**
     * Destroys every idle object. Objects currently lent out are not affected.
     */
    public void clear() {
        lock.lock();
        try {
            List<T> removed = idle.removeAll();
            availableSlots += removed.size();
            removed.forEach(this::destroy);
            log.info("Cleared {} idle objects (inUse={})", removed.size(), inUse());
            waiters.signalEligible();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Changes the capacity. Shrinking gives up free slots first and then destroys idle objects.
     *
     * @param newCapacity the new capacity, at least the number of objects lent out
     * @throws IllegalArgumentException if {@code newCapacity} is below {@link #inUseCount()}
     */
    public void resize(int newCapacity) {
        lock.lock();
        try {
            ensureOpen();
            int inUse = inUse();
            if (newCapacity < 0 || newCapacity < inUse) {
                throw new IllegalArgumentException(
                        "Cannot resize to " + newCapacity + " while " + inUse + " objects are in use");
            }

            int oldCapacity = capacity;
            if (newCapacity >= oldCapacity) {
                availableSlots += newCapacity - oldCapacity;
            } else {
                int excess = oldCapacity - newCapacity;
                int fromSlots = Math.min(excess, availableSlots);
                availableSlots -= fromSlots;
                idle.removeOldest(excess - fromSlots).forEach(this::destroy);
            }
            capacity = newCapacity;

            log.info("Pool resized from {} to {} (inUse={}, idle={})", oldCapacity, newCapacity, inUse, idle.size());
            waiters.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies {@code action} to every idle object. Objects lent out are never visited.
     */
    public void applyToAll(Consumer<? super T> action) {
        if (action == null) {
            throw new IllegalArgumentException("Action cannot be null");
        }
        lock.lock();
        try {
            idle.forEach(action);
        } finally {
            lock.unlock();
        }
    }

    public int runCleanup() {
        return runCleanup(false);
    }

    /**
     * Evicts idle objects that have been unused for at least the configured max idle time.
     * Does nothing while auto-cleanup is disabled.
     *
     * @param force sweep even if the cleanup interval has not elapsed since the last sweep
     * @return the number of objects evicted
     */
    public int runCleanup(boolean force) {
        lock.lock();
        try {
            return sweep(force);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Schedules a sweep every cleanup interval of the current configuration. Cancel the
     * returned future to stop it; later changes to the interval are not picked up.
     *
     * @param executor the executor running the sweeps
     * @return the scheduled task
     */
    public ScheduledFuture<?> scheduleCleanup(ScheduledExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        long periodNanos;
        lock.lock();
        try {
            periodNanos = Math.max(1L, saturatedNanos(config.getCleanupInterval()));
        } finally {
            lock.unlock();
        }
        return executor.scheduleAtFixedRate(() -> runCleanup(true), periodNanos, periodNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @return a snapshot of the counters, or {@link PoolStats#EMPTY} while stats are disabled
     */
    public PoolStats getStats() {
        lock.lock();
        try {
            return stats.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public void resetStats() {
        lock.lock();
        try {
            stats.reset();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the configuration. Takes effect for every later operation, including the next
     * release of objects currently lent out.
     */
    public void reconfigure(PoolConfig<T> newConfig) {
        if (newConfig == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        lock.lock();
        try {
            boolean cleanupTurnedOn = newConfig.isEnableAutoCleanup() && !config.isEnableAutoCleanup();
            config = newConfig;
            stats.setEnabled(newConfig.isEnableStats());
            if (cleanupTurnedOn) {
                // idle time is tracked from the moment eviction is switched on
                long now = System.nanoTime();
                idle.touchAll(now);
                lastCleanupNanos = now;
            }
            log.info("Pool reconfigured: {}", newConfig);
        } finally {
            lock.unlock();
        }
    }

    public PoolConfig<T> getConfig() {
        lock.lock();
        try {
            return config;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int available() {
        lock.lock();
        try {
            return availableSlots + idle.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int inUseCount() {
        lock.lock();
        try {
            return inUse();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        lock.lock();
        try {
            return capacity;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of callers currently blocked in an acquire.
     */
    public int waitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Destroys all idle objects and fails every blocked caller. Objects still lent out are
     * destroyed when their handles are closed.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            List<T> removed = idle.removeAll();
            availableSlots += removed.size();
            removed.forEach(this::destroy);
            waiters.signalAll();
            log.info("Object pool closed ({} idle objects destroyed, {} still in use)", removed.size(), inUse());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a request for {@code count} objects (or one object matching {@code filter})
     * can be served at {@code priority}.
     *
     * @param timeoutNanos {@link #NO_TIMEOUT} to wait indefinitely, zero for a single attempt
     * @param strict fail with {@link PoolExhaustedException} when the request exceeds capacity
     * @return true if the request can be served now, false on timeout or interruption
     */
    private boolean awaitTurn(Priority priority, int count, Predicate<? super T> filter,
                              long timeoutNanos, boolean strict) {
        if (strict) {
            requireSatisfiable(count);
        }
        if (canServe(priority, count, filter)) {
            return true;
        }
        if (timeoutNanos == 0L) {
            stats.recordWait(0L);
            stats.recordTimeout();
            return false;
        }

        WaitQueue.Ticket ticket = waiters.enqueue(priority);
        long start = System.nanoTime();
        long remaining = timeoutNanos;
        boolean served = false;
        boolean timedOut = false;
        try {
            while (true) {
                if (timeoutNanos == NO_TIMEOUT) {
                    ticket.awaitUninterruptibly();
                } else {
                    if (remaining <= 0L) {
                        timedOut = true;
                        return false;
                    }
                    try {
                        remaining = ticket.awaitNanos(remaining);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        timedOut = true;
                        return false;
                    }
                }

                ensureOpen();
                if (strict) {
                    requireSatisfiable(count);
                }
                if (canServe(priority, count, filter)) {
                    served = true;
                    return true;
                }
            }
        } finally {
            waiters.remove(ticket);
            stats.recordWait(System.nanoTime() - start);
            if (timedOut) {
                stats.recordTimeout();
            }
            if (!served) {
                // leaving may unblock a lower priority waiter
                waiters.signalEligible();
            }
        }
    }

    private boolean canServe(Priority priority, int count, Predicate<? super T> filter) {
        if (!waiters.mayProceed(priority)) {
            return false;
        }
        if (filter != null) {
            return availableSlots > 0 || idle.anyMatch(filter);
        }
        return idle.size() + availableSlots >= count;
    }

    private void requireSatisfiable(int count) {
        if (count > capacity) {
            throw new PoolExhaustedException(capacity == 0
                    ? "Pool has no capacity"
                    : "Requested " + count + " objects but pool capacity is " + capacity);
        }
    }

    /**
     * Takes an idle object (a hit) or creates one (a miss). The caller has checked that one of
     * the two is possible.
     */
    private T take(Predicate<? super T> filter) {
        IdleObjects.Entry<T> entry = takeIdle(filter);
        if (entry != null) {
            stats.recordHit();
            return entry.object;
        }

        T created = create();
        stats.recordMiss();
        return created;
    }

    private IdleObjects.Entry<T> takeIdle(Predicate<? super T> filter) {
        sweep(false);

        IdleObjects.Entry<T> entry;
        while ((entry = idle.poll(filter)) != null) {
            if (isValid(entry.object, config.isValidateOnAcquire())) {
                return entry;
            }
            discard(entry.object, "failed validation on acquire");
        }
        return null;
    }

    private Pooled<T> lend(T object) {
        stats.recordUsage(inUse());
        return new Pooled<>(object, this::release);
    }

    private T create() {
        if (availableSlots <= 0) {
            throw new IllegalStateException("No free slot to create an object");
        }
        availableSlots--;

        T object;
        try {
            object = creator.get();
        } catch (RuntimeException | Error e) {
            availableSlots++;
            log.debug("Object creation failed, slot returned to the pool (free={})", availableSlots);
            throw e;
        }
        if (object == null) {
            availableSlots++;
            throw new IllegalStateException("Creator returned null");
        }
        log.debug("Created pooled object (inUse={}, idle={}, free={})", inUse(), idle.size(), availableSlots);
        return object;
    }

    private void fill(int count) {
        if (count > availableSlots) {
            throw new IllegalArgumentException(
                    "Cannot prefill " + count + " objects, only " + availableSlots + " slots are free");
        }
        long now = System.nanoTime();
        for (int i = 0; i < count; i++) {
            idle.add(create(), now);
        }
    }

    /**
     * Return path of every {@link Pooled} handle. Objects that fail validation or reset are
     * destroyed and their slot is freed. Only an {@link Error} from the validator or reset
     * propagates, after the slot has been freed.
     */
    private void release(T object) {
        lock.lock();
        try {
            if (closed) {
                discard(object, "pool closed");
                return;
            }
            boolean reusable = false;
            try {
                reusable = isValid(object, config.isValidateOnRelease()) && idle.size() < capacity
                        && resetQuietly(object);
            } finally {
                // the slot comes back even when the validator or reset throws an Error
                if (reusable) {
                    idle.add(object, System.nanoTime());
                } else {
                    discard(object, "rejected on release");
                }
                waiters.signalEligible();
            }
        } finally {
            lock.unlock();
        }
    }

    private int sweep(boolean force) {
        if (!config.isEnableAutoCleanup()) {
            return 0;
        }
        long now = System.nanoTime();
        if (!force && now - lastCleanupNanos < saturatedNanos(config.getCleanupInterval())) {
            return 0;
        }
        lastCleanupNanos = now;

        List<T> expired = idle.removeExpired(now, saturatedNanos(config.getMaxIdleTime()));
        if (expired.isEmpty()) {
            return 0;
        }
        availableSlots += expired.size();
        stats.recordCleanups(expired.size());
        expired.forEach(this::destroy);
        log.debug("Evicted {} idle objects (idle={}, free={})", expired.size(), idle.size(), availableSlots);
        waiters.signalEligible();
        return expired.size();
    }

    private boolean isValid(T object, boolean enabled) {
        Predicate<? super T> validator = config.getValidator();
        if (!enabled || validator == null) {
            return true;
        }
        try {
            return validator.test(object);
        } catch (RuntimeException e) {
            log.warn("Validator threw, treating object as invalid", e);
            return false;
        }
    }

    private boolean resetQuietly(T object) {
        try {
            object.reset();
            return true;
        } catch (RuntimeException e) {
            log.warn("Reset failed, discarding object", e);
            return false;
        }
    }

    private void discard(T object, String reason) {
        availableSlots++;
        destroy(object);
        log.debug("Discarded pooled object: {} (free={})", reason, availableSlots);
    }

    private void destroy(T object) {
        Consumer<? super T> destroyer = config.getDestroyer();
        if (destroyer == null) {
            return;
        }
        try {
            destroyer.accept(object);
        } catch (RuntimeException e) {
            log.warn("Error destroying pooled object: {}", e.getMessage());
        }
    }

    private void wakeNextIfSpare() {
        if (!waiters.isEmpty() && idle.size() + availableSlots > 0) {
            waiters.signalEligible();
        }
    }

    private int inUse() {
        return capacity - availableSlots - idle.size();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Pool is closed");
        }
    }

    private static void requirePriority(Priority priority) {
        if (priority == null) {
            throw new IllegalArgumentException("Priority cannot be null");
        }
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
