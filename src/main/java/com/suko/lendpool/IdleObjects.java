package com.suko.lendpool;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Idle objects of a pool together with the time each one became idle. Newest entries sit at
 * the head so that lending reuses recently returned (warm) objects and eviction finds the
 * oldest ones at the tail.
 *
 * <p>Not thread-safe; guarded by the owning pool's lock.
 */
final class IdleObjects<T> {

    static final class Entry<T> {
        final T object;
        long idleSince;

        Entry(T object, long idleSince) {
            this.object = object;
            this.idleSince = idleSince;
        }
    }

    private final ArrayDeque<Entry<T>> entries = new ArrayDeque<>();

    int size() {
        return entries.size();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    void add(T object, long nowNanos) {
        entries.addFirst(new Entry<>(object, nowNanos));
    }

    /**
     * Removes and returns the most recently idled object matching {@code filter}
     * ({@code null} matches anything), or {@code null} if there is none.
     */
    T take(Predicate<? super T> filter) {
        Entry<T> entry = poll(filter);
        return entry == null ? null : entry.object;
    }

    /**
     * Like {@link #take} but keeps the idle time, so the entry can be {@link #restore restored}.
     */
    Entry<T> poll(Predicate<? super T> filter) {
        if (filter == null) {
            return entries.pollFirst();
        }
        for (Iterator<Entry<T>> it = entries.iterator(); it.hasNext(); ) {
            Entry<T> entry = it.next();
            if (filter.test(entry.object)) {
                it.remove();
                return entry;
            }
        }
        return null;
    }

    /**
     * Puts back an entry taken from the head. Restoring in reverse order of polling rebuilds
     * the original order.
     */
    void restore(Entry<T> entry) {
        entries.addFirst(entry);
    }

    boolean anyMatch(Predicate<? super T> filter) {
        for (Entry<T> entry : entries) {
            if (filter.test(entry.object)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every object that has been idle for at least {@code maxIdleNanos}.
     */
    List<T> removeExpired(long nowNanos, long maxIdleNanos) {
        List<T> expired = new ArrayList<>();
        entries.removeIf(entry -> {
            if (nowNanos - entry.idleSince >= maxIdleNanos) {
                expired.add(entry.object);
                return true;
            }
            return false;
        });
        return expired;
    }

    /**
     * Removes up to {@code count} objects, oldest first.
     */
    List<T> removeOldest(int count) {
        List<T> removed = new ArrayList<>(Math.min(count, entries.size()));
        while (removed.size() < count && !entries.isEmpty()) {
            removed.add(entries.pollLast().object);
        }
        return removed;
    }

    List<T> removeAll() {
        return removeOldest(entries.size());
    }

    /**
     * Restarts the idle clock of every entry.
     */
    void touchAll(long nowNanos) {
        for (Entry<T> entry : entries) {
            entry.idleSince = nowNanos;
        }
    }

    void forEach(Consumer<? super T> action) {
        for (Entry<T> entry : entries) {
            action.accept(entry.object);
        }
    }
}
