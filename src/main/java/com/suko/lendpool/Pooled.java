package com.suko.lendpool;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A single loan of a pooled object. The loan ends when {@link #close()} is called, which hands
 * the object back to its pool exactly once; further calls are ignored. Intended for
 * try-with-resources:
 *
 * <pre>{@code
 * try (Pooled<Buffer> lease = pool.acquire()) {
 *     lease.get().write(data);
 * }
 * }</pre>
 *
 * <p>May be closed from a thread other than the one that acquired it.
 *
 * @param <T> the type of the pooled object
 */
public final class Pooled<T> implements AutoCloseable {
    private final T object;
    private final Consumer<T> releaser;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Pooled(T object, Consumer<T> releaser) { // Package private
        this.object = object;
        this.releaser = releaser;
    }

    public T get() {
        if (closed.get()) throw new IllegalStateException("Already closed");
        return object;
    }

    public boolean isReleased() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            releaser.accept(object);
        }
    }
}
