package com.suko.lendpool;

import java.util.Comparator;
import java.util.TreeSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Callers blocked on a pool, ordered by priority (highest first) and then by arrival.
 *
 * <p>Every waiter parks on its own {@link Condition} of the pool lock, so a state change can
 * wake exactly the waiters allowed to proceed instead of the whole crowd. Only waiters of the
 * highest waiting priority are ever eligible; each one re-checks availability on wake-up.
 *
 * <p>All methods must be called with the pool lock held.
 */
final class WaitQueue {

    private static final Comparator<Ticket> SERVICE_ORDER = Comparator
            .comparing((Ticket t) -> t.priority).reversed()
            .thenComparingLong(t -> t.sequence);

    final class Ticket {
        final Priority priority;
        final long sequence;
        private final Condition condition;

        private Ticket(Priority priority, long sequence) {
            this.priority = priority;
            this.sequence = sequence;
            this.condition = lock.newCondition();
        }

        void awaitUninterruptibly() {
            condition.awaitUninterruptibly();
        }

        /**
         * @return the remaining wait time, zero or negative once the timeout elapsed
         */
        long awaitNanos(long nanos) throws InterruptedException {
            return condition.awaitNanos(nanos);
        }
    }

    private final ReentrantLock lock;
    private final TreeSet<Ticket> tickets = new TreeSet<>(SERVICE_ORDER);
    private long nextSequence;

    WaitQueue(ReentrantLock lock) {
        this.lock = lock;
    }

    Ticket enqueue(Priority priority) {
        Ticket ticket = new Ticket(priority, nextSequence++);
        tickets.add(ticket);
        return ticket;
    }

    void remove(Ticket ticket) {
        tickets.remove(ticket);
    }

    boolean isEmpty() {
        return tickets.isEmpty();
    }

    int size() {
        return tickets.size();
    }

    /**
     * @return the highest priority currently waiting, or {@code null} if nobody waits
     */
    Priority highest() {
        return tickets.isEmpty() ? null : tickets.first().priority;
    }

    /**
     * Whether a request of {@code priority} may be served now without overtaking a waiter of
     * strictly higher priority.
     */
    boolean mayProceed(Priority priority) {
        Priority top = highest();
        return top == null || priority.isAtLeast(top);
    }

    /**
     * Wakes the waiters of the highest waiting priority, oldest first.
     */
    void signalEligible() {
        if (tickets.isEmpty()) {
            return;
        }
        Priority top = tickets.first().priority;
        for (Ticket ticket : tickets) {
            if (ticket.priority != top) {
                break;
            }
            ticket.condition.signal();
        }
    }

    /**
     * Wakes every waiter; used when capacity changes or the pool closes.
     */
    void signalAll() {
        for (Ticket ticket : tickets) {
            ticket.condition.signal();
        }
    }
}
