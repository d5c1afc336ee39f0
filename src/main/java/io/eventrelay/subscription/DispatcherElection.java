package io.eventrelay.subscription;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Single-slot gate shared by every dispatcher bound to one subscription.
 * At most one holder at a time; the holder must {@link #resign()} to let a waiter in.
 */
@Slf4j
public final class DispatcherElection {

    private static final long RECHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final Lock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private boolean held;

    /**
     * Blocks until this caller holds the slot, or {@code abandon} reports true.
     * {@code abandon} is re-evaluated at least every 50ms.
     *
     * @return true if the slot was won, false if the wait was abandoned
     */
    public boolean elect(final BooleanSupplier abandon) throws InterruptedException {
        lock.lock();
        try {
            while (held) {
                if (abandon.getAsBoolean()) return false;
                released.awaitNanos(RECHECK_NANOS);
            }
            if (abandon.getAsBoolean()) return false;
            held = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Frees the slot. Must only be called by the current holder. */
    public void resign() {
        lock.lock();
        try {
            if (!held) {
                log.warn("Resign called on an election nobody holds");
                return;
            }
            held = false;
            released.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeld() {
        lock.lock();
        try {
            return held;
        } finally {
            lock.unlock();
        }
    }
}
