package com.suko.lendpool;

/**
 * Capability required from every pooled type: the object can be put back into a clean,
 * reusable state.
 *
 * <p>The pool calls {@link #reset()} each time it takes an object back into its idle set.
 * Implementations must leave the object indistinguishable from a freshly created one and
 * must not touch anything outside their own fields.
 */
public interface Resettable {

    /**
     * Restores this object to its initial state.
     */
    void reset();
}
