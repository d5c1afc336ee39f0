package io.eventrelay.events.dispatcher;

import io.eventrelay.config.impl.RelayConfig;
import io.eventrelay.core.model.DataRef;
import io.eventrelay.core.model.Event;
import io.eventrelay.core.model.EventDelivery;
import io.eventrelay.core.model.EventDeliveryResponse;
import io.eventrelay.core.model.Message;
import io.eventrelay.core.model.SubscriptionRef;
import io.eventrelay.error.DispatcherClosingException;
import io.eventrelay.events.poller.EventPoller;
import io.eventrelay.events.poller.EventPollerConfig;
import io.eventrelay.offset.OffsetStore;
import io.eventrelay.store.EventStore;
import io.eventrelay.subscription.DispatcherElection;
import io.eventrelay.subscription.Subscription;
import io.eventrelay.subscription.SubscriptionDefinition;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delivers the events of one subscription over one connection.
 * <p>
 * Pages read by the poller are enriched with the message/data they reference, filtered
 * against the subscription, then dispatched in windows of at most {@code readAhead + 1}
 * in-flight events. Acks free window capacity; a nack clears the window and rewinds the
 * poller so everything from the rejected event onwards is redelivered.
 * </p>
 * <p>
 * Several dispatchers may be bound to the same subscription; only the one holding the
 * subscription's {@link DispatcherElection} polls.
 * </p>
 */
@Slf4j
public final class EventDispatcher {

    private static final long CLOSE_CHECK_MILLIS = 50;
    static final int MAX_READ_AHEAD = 65_535;

    private final EventStore store;
    @Getter private final String connectionId;
    @Getter private final Subscription subscription;
    @Getter private final String namespace;
    @Getter private final int readAhead;
    private final DeliveryTransport transport;
    private final EventPoller eventPoller;
    private final String tag;

    private final Lock mux = new ReentrantLock();
    private final Map<UUID, Event> inflight = new HashMap<>();
    /* responses taken out of inflight, not yet consumed by the dispatch loop */
    private int pendingSignals;
    private final SynchronousQueue<AckNack> acksNacks = new SynchronousQueue<>();

    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final ExecutorService electionExecutor;

    public EventDispatcher(final EventStore store,
                           final OffsetStore offsets,
                           final RelayConfig config,
                           final String connectionId,
                           final Subscription subscription,
                           final DeliveryTransport transport) {
        final SubscriptionDefinition def = subscription.getDefinition();
        this.store = store;
        this.connectionId = connectionId;
        this.subscription = subscription;
        this.namespace = def.namespace();
        this.transport = transport;
        this.tag = String.format("ed[%s] sub=%s", connectionId, subscription);

        final Integer override = def.options().readAhead();
        final int requested = override != null ? override : config.getDefaultReadAhead();
        this.readAhead = Math.min(MAX_READ_AHEAD, Math.max(0, requested));

        this.eventPoller = new EventPoller(store, offsets, EventPollerConfig.forSubscription(config, def), this::bufferedDelivery);
        this.electionExecutor = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "event-dispatcher-" + connectionId);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        electionExecutor.submit(this::electAndStart);
    }

    /** Shoulder tap for the underlying poller. */
    public void newEvents() {
        eventPoller.newEvents();
    }

    private void electAndStart() {
        log.debug("{} attempting to become leader", tag);
        final DispatcherElection election = subscription.getDispatcherElection();
        try {
            if (!election.elect(eventPoller::isClosed)) {
                log.debug("{} closed before we became leader", tag);
                return;
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            return;
        }

        log.debug("{} became leader", tag);
        try {
            eventPoller.start();
            eventPoller.awaitClosed();
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            // unelect ourselves on close, to let another dispatcher in
            election.resign();
            log.debug("{} resigned leadership", tag);
        }
    }

    List<EventDelivery> enrichEvents(final List<Event> events) {
        final Set<UUID> refIds = new LinkedHashSet<>();
        for (final Event e : events) {
            if (e.reference() != null) refIds.add(e.reference());
        }

        final Map<UUID, Message> messages = new HashMap<>();
        final Map<UUID, DataRef> dataRefs = new HashMap<>();
        if (!refIds.isEmpty()) {
            for (final Message msg : store.getMessagesByIds(namespace, refIds)) {
                messages.putIfAbsent(msg.id(), msg);
            }
            for (final DataRef dr : store.getDataRefsByIds(namespace, refIds)) {
                dataRefs.putIfAbsent(dr.id(), dr);
            }
        }

        final SubscriptionRef ref = subscription.getDefinition().ref();
        final List<EventDelivery> enriched = new ArrayList<>(events.size());
        for (final Event e : events) {
            final UUID r = e.reference();
            enriched.add(new EventDelivery(e, ref,
                    r == null ? null : messages.get(r),
                    r == null ? null : dataRefs.get(r)));
        }
        return enriched;
    }

    List<EventDelivery> filterEvents(final List<EventDelivery> candidates) {
        final List<EventDelivery> matching = new ArrayList<>(candidates.size());
        for (final EventDelivery event : candidates) {
            if (subscription.matches(event)) matching.add(event);
        }
        return matching;
    }

    /*
     * Runs on the poller thread for each page. The page is already in memory, but only
     * readAhead + 1 events may be in flight at once, so we stay here until every matching
     * event has been dispatched and resolved, or a nack forces a rewind.
     */
    boolean bufferedDelivery(final List<Event> events) {
        if (events.isEmpty()) return false;

        final List<EventDelivery> candidates = enrichEvents(events);
        final List<EventDelivery> matching = filterEvents(candidates);
        int next = 0;
        int dispatched = 0;
        boolean rewound = false;

        while (true) {
            List<EventDelivery> dispatchable = List.of();
            final int inflightCount;
            mux.lock();
            try {
                inflightCount = inflight.size();
                if (!rewound) {
                    final int dispatchCount = Math.min(matching.size() - next, 1 + readAhead - inflightCount);
                    if (dispatchCount > 0) {
                        dispatchable = matching.subList(next, next + dispatchCount);
                        next += dispatchCount;
                    }
                }
                final boolean settled = (rewound || next >= matching.size())
                        && inflight.isEmpty() && pendingSignals == 0;
                if (dispatchable.isEmpty() && settled) break;
            } finally {
                mux.unlock();
            }

            log.debug("{} event state: candidates={} matched={} inflight={} queued={} dispatched={} dispatchable={}",
                    tag, candidates.size(), matching.size(), inflightCount, matching.size() - next, dispatched, dispatchable.size());
            try {
                for (final EventDelivery event : dispatchable) {
                    deliverEvent(event);
                    dispatched++;
                }
            } catch (final RuntimeException e) {
                // the poller retries the whole page, so nothing from this attempt stays in flight
                clearInflight();
                throw e;
            }

            // block until we're closed, or woken due to a delivery response
            final AckNack an = awaitAckNack();
            if (an.isNack()) {
                mux.lock();
                try {
                    // redeliver everything from this offset onwards, even if later events were acked
                    // rewind stores offset - 1, so an offset equal to the nacked one is still ahead of it
                    if (eventPoller.getPollingOffset() >= an.offset()) {
                        eventPoller.rewindPollingOffset(an.offset());
                    }
                    inflight.clear();
                } finally {
                    mux.unlock();
                }
                rewound = true;
            }
        }

        return rewound;
    }

    void deliverEvent(final EventDelivery event) {
        mux.lock();
        try {
            inflight.put(event.id(), event.event());
        } finally {
            mux.unlock();
        }
        log.debug("{} dispatching event: {}/{} [{}]: ref={}/{}", tag,
                String.format("%010d", event.sequence()), event.id(), event.type(), event.namespace(), event.reference());
        try {
            transport.deliver(connectionId, event, this::deliveryResponse);
        } catch (final RuntimeException e) {
            mux.lock();
            try {
                inflight.remove(event.id());
            } finally {
                mux.unlock();
            }
            throw e;
        }
    }

    /**
     * Entry point for the consumer's ack/nack. Blocks until the dispatch loop has taken the
     * response. Responses for events no longer in flight are ignored.
     *
     * @throws DispatcherClosingException if the dispatcher closes before the response is consumed
     */
    public void deliveryResponse(final EventDeliveryResponse response) {
        final Event event;
        mux.lock();
        try {
            event = inflight.remove(response.id());
            if (event != null) pendingSignals++;
        } finally {
            mux.unlock();
        }

        if (event == null) {
            log.warn("{} response for event not in flight: {} rejected={} info='{}' (likely previous reject)",
                    tag, response.id(), response.rejected(), response.info());
            return;
        }

        log.debug("{} response for event: {}/{} [{}]: ref={}/{} rejected={} info='{}'", tag,
                String.format("%010d", event.sequence()), event.id(), event.type(), event.namespace(), event.reference(),
                response.rejected(), response.info());

        // no real work here, just hand over to the dispatch loop
        final AckNack an = new AckNack(response.rejected(), event.sequence());
        try {
            while (!acksNacks.offer(an, CLOSE_CHECK_MILLIS, TimeUnit.MILLISECONDS)) {
                if (closing.get()) {
                    releasePendingSignal();
                    throw new DispatcherClosingException();
                }
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            releasePendingSignal();
            throw new DispatcherClosingException();
        }
    }

    private AckNack awaitAckNack() {
        try {
            while (true) {
                if (closing.get()) throw new DispatcherClosingException();
                final AckNack an = acksNacks.poll(CLOSE_CHECK_MILLIS, TimeUnit.MILLISECONDS);
                if (an != null) {
                    releasePendingSignal();
                    return an;
                }
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DispatcherClosingException();
        }
    }

    private void releasePendingSignal() {
        mux.lock();
        try {
            pendingSignals--;
        } finally {
            mux.unlock();
        }
    }

    private void clearInflight() {
        mux.lock();
        try {
            inflight.clear();
        } finally {
            mux.unlock();
        }
    }

    int inflightCount() {
        mux.lock();
        try {
            return inflight.size();
        } finally {
            mux.unlock();
        }
    }

    EventPoller eventPoller() {
        return eventPoller;
    }

    /**
     * Stops delivery. On return no poller callback is running and, if this dispatcher was
     * leader, the election slot has been released.
     */
    public void close() throws InterruptedException {
        // poller first, so a handler failing on closing is seen as abandoned rather than retried
        eventPoller.close();
        closing.set(true);
        eventPoller.awaitClosed();
        electionExecutor.shutdown();
        if (!electionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("{} election thread did not terminate within 5s", tag);
        }
    }
}
