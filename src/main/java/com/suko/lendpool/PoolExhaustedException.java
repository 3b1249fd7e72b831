package com.suko.lendpool;

/**
 * Thrown when a request can never be satisfied by the pool as currently sized, for example a
 * batch larger than the capacity. Ordinary contention never raises it: callers block instead.
 */
public class PoolExhaustedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public PoolExhaustedException(String message) {
        super(message);
    }
}
