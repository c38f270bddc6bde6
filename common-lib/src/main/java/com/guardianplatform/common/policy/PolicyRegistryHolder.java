package com.guardianplatform.common.policy;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * The single mutable handle to the current {@link PolicyRegistry}.
 *
 * <p>Readers call {@link #current()} and never block. Writers are serialized by a lock,
 * compute a complete new snapshot, and publish it with one reference swap, so an
 * in-flight evaluation sees either the old rule set or the new one, never a mix.
 */
public final class PolicyRegistryHolder {

    private final AtomicReference<PolicyRegistry> ref;
    private final ReentrantLock writeLock = new ReentrantLock();

    public PolicyRegistryHolder(PolicyRegistry initial) {
        this.ref = new AtomicReference<>(initial);
    }

    public PolicyRegistry current() {
        return ref.get();
    }

    /**
     * Applies {@code edit} to the current snapshot and publishes the result. If
     * {@code edit} throws, nothing is published.
     *
     * @return the newly published snapshot
     */
    public PolicyRegistry update(UnaryOperator<PolicyRegistry> edit) {
        writeLock.lock();
        try {
            PolicyRegistry next = edit.apply(ref.get());
            ref.set(next);
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    public PolicyRegistry replace(PolicyRegistry next) {
        return update(ignored -> next);
    }
}
