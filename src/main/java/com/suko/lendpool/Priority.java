package com.suko.lendpool;

/**
 * Service order for callers blocked on an exhausted pool. Declared from lowest to highest.
 *
 * <p>A priority never preempts an object that is already lent out; it only decides which
 * waiter gets the next object that becomes free.
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Priority other) {
        return compareTo(other) >= 0;
    }
}
