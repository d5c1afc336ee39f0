package io.eventrelay.events.poller;

import io.eventrelay.core.model.Event;
import io.eventrelay.offset.OffsetStore;
import io.eventrelay.store.EventStore;
import io.eventrelay.subscription.FirstEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reads pages of events past a tracked offset and hands them to a {@link NewEventsHandler}.
 * <p>
 * The polling offset is the sequence of the last event handed to the handler. It advances
 * when a page is read, can be rewound by the handler while it runs, and is committed to the
 * {@link OffsetStore} after every handled page (unless the poller is ephemeral).
 * </p>
 * <p>
 * {@link #close()} is cooperative: a handler that blocks must observe its own cancellation
 * for the poller thread to exit.
 * </p>
 */
@Slf4j
public final class EventPoller {

    private final EventStore store;
    private final OffsetStore offsets;
    private final EventPollerConfig conf;
    private final NewEventsHandler handler;

    private final Lock lock = new ReentrantLock();
    private final Condition wake = lock.newCondition();
    private boolean tapped;
    private long pollingOffset = -1L;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final CountDownLatch closed = new CountDownLatch(1);

    public EventPoller(final EventStore store,
                       final OffsetStore offsets,
                       final EventPollerConfig conf,
                       final NewEventsHandler handler) {
        this.store = store;
        this.offsets = offsets;
        this.conf = conf;
        this.handler = handler;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        if (closing.get()) {
            closed.countDown();
            return;
        }
        final Thread t = new Thread(this::run, "event-poller-" + conf.offsetNamespace() + ":" + conf.offsetName());
        t.setDaemon(true);
        t.start();
    }

    /** Shoulder tap: new events may be available, skip the remainder of any idle wait. */
    public void newEvents() {
        lock.lock();
        try {
            tapped = true;
            wake.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long getPollingOffset() {
        lock.lock();
        try {
            return pollingOffset;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the read position back so the next page starts at {@code offset} (inclusive).
     * Never moves forwards.
     */
    public void rewindPollingOffset(final long offset) {
        lock.lock();
        try {
            final long target = offset - 1;
            if (target < pollingOffset) {
                log.debug("Rewinding polling offset {}:{} from {} to {}", conf.offsetNamespace(), conf.offsetName(), pollingOffset, target);
                pollingOffset = target;
            }
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        closing.set(true);
        lock.lock();
        try {
            wake.signalAll();
        } finally {
            lock.unlock();
        }
        // never started: nothing will count the latch down for us
        if (started.compareAndSet(false, true)) {
            closed.countDown();
        }
    }

    public boolean isClosed() {
        return closed.getCount() == 0;
    }

    public void awaitClosed() throws InterruptedException {
        closed.await();
    }

    public boolean awaitClosed(final Duration timeout) throws InterruptedException {
        return closed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void run() {
        try {
            if (!restoreOffset()) return;
            log.info("Event poller {}:{} started at offset {}", conf.offsetNamespace(), conf.offsetName(), getPollingOffset());
            eventLoop();
        } catch (final Throwable t) {
            log.error("Event poller {}:{} terminated unexpectedly", conf.offsetNamespace(), conf.offsetName(), t);
        } finally {
            log.info("Event poller {}:{} stopped", conf.offsetNamespace(), conf.offsetName());
            closed.countDown();
        }
    }

    private boolean restoreOffset() {
        for (int attempt = 1; ; attempt++) {
            if (closing.get()) return false;
            try {
                final long offset = loadOffset();
                lock.lock();
                try {
                    pollingOffset = offset;
                } finally {
                    lock.unlock();
                }
                return true;
            } catch (final RuntimeException e) {
                if (attempt >= conf.startupOffsetRetryAttempts()) {
                    log.error("Failed to restore offset {}:{} after {} attempts", conf.offsetNamespace(), conf.offsetName(), attempt, e);
                    return false;
                }
                log.warn("Failed to restore offset {}:{} (attempt {}): {}", conf.offsetNamespace(), conf.offsetName(), attempt, e.toString());
                if (!sleepUnlessClosed(conf.retry().calculateDelayMs(attempt))) return false;
            }
        }
    }

    private long loadOffset() {
        final long latest = store.getLatestSequence(conf.limitNamespace());
        if (conf.ephemeral()) return latest;

        final OptionalLong stored = offsets.fetch(conf.offsetType(), conf.offsetNamespace(), conf.offsetName());
        if (stored.isPresent()) return stored.getAsLong();

        final long initial = conf.firstEvent() == FirstEvent.OLDEST ? -1L : latest;
        offsets.commit(conf.offsetType(), conf.offsetNamespace(), conf.offsetName(), initial);
        return initial;
    }

    private void eventLoop() {
        while (!closing.get()) {
            final List<Event> events = readPage();
            if (events == null) return;

            boolean repoll = false;
            if (!events.isEmpty()) {
                advancePollingOffset(events.get(events.size() - 1).sequence());
                final Boolean result = dispatchWithRetry(events);
                if (result == null) return;
                repoll = result;
                commitOffset();
            }

            if (!repoll && events.size() < conf.eventBatchSize()) {
                waitForShoulderTapOrPollTimeout();
            }
        }
    }

    /* Returns null once closed (or out of attempts). */
    private List<Event> readPage() {
        for (int attempt = 1; ; attempt++) {
            if (closing.get()) return null;
            try {
                return store.getEvents(conf.limitNamespace(), getPollingOffset(), conf.eventBatchSize());
            } catch (final RuntimeException e) {
                if (!conf.retry().shouldRetry(attempt)) {
                    log.error("Giving up reading events for {}:{} after {} attempts", conf.offsetNamespace(), conf.offsetName(), attempt, e);
                    return null;
                }
                log.warn("Failed to read events for {}:{} (attempt {}): {}", conf.offsetNamespace(), conf.offsetName(), attempt, e.toString());
                if (!sleepUnlessClosed(conf.retry().calculateDelayMs(attempt))) return null;
            }
        }
    }

    /* Returns null once closed (or out of attempts). */
    private Boolean dispatchWithRetry(final List<Event> events) {
        for (int attempt = 1; ; attempt++) {
            try {
                return handler.handle(events);
            } catch (final RuntimeException e) {
                if (closing.get()) {
                    log.debug("Batch abandoned on close: {}", e.toString());
                    return null;
                }
                if (!conf.retry().shouldRetry(attempt)) {
                    log.error("Giving up dispatching batch for {}:{} after {} attempts", conf.offsetNamespace(), conf.offsetName(), attempt, e);
                    return null;
                }
                log.warn("Batch dispatch failed for {}:{} (attempt {}): {}", conf.offsetNamespace(), conf.offsetName(), attempt, e.toString());
                if (!sleepUnlessClosed(conf.retry().calculateDelayMs(attempt))) return null;
            }
        }
    }

    private void advancePollingOffset(final long offset) {
        lock.lock();
        try {
            pollingOffset = offset;
        } finally {
            lock.unlock();
        }
    }

    private void commitOffset() {
        if (conf.ephemeral()) return;
        final long offset = getPollingOffset();
        try {
            offsets.commit(conf.offsetType(), conf.offsetNamespace(), conf.offsetName(), offset);
        } catch (final RuntimeException e) {
            // next handled page commits again
            log.warn("Failed to commit offset {}:{}={}: {}", conf.offsetNamespace(), conf.offsetName(), offset, e.toString());
        }
    }

    private void waitForShoulderTapOrPollTimeout() {
        lock.lock();
        try {
            long remaining = conf.eventPollTimeout().toNanos();
            while (!tapped && !closing.get() && remaining > 0) {
                remaining = wake.awaitNanos(remaining);
            }
            tapped = false;
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            closing.set(true);
        } finally {
            lock.unlock();
        }
    }

    /* Returns false if the poller was closed (or interrupted) while sleeping. */
    private boolean sleepUnlessClosed(final long delayMs) {
        lock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(delayMs);
            while (!closing.get() && remaining > 0) {
                remaining = wake.awaitNanos(remaining);
            }
            return !closing.get();
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            closing.set(true);
            return false;
        } finally {
            lock.unlock();
        }
    }
}
