package io.eventrelay.syncasync.impl;

import io.eventrelay.config.impl.RelayConfig;
import io.eventrelay.core.model.EventDelivery;
import io.eventrelay.core.model.EventType;
import io.eventrelay.core.model.Message;
import io.eventrelay.core.model.MessageHeader;
import io.eventrelay.core.model.MessageInOut;
import io.eventrelay.error.BridgeClosedException;
import io.eventrelay.error.ErrorCode;
import io.eventrelay.error.ReplyResolutionException;
import io.eventrelay.error.RequestTimeoutException;
import io.eventrelay.error.ValidationException;
import io.eventrelay.events.EventManager;
import io.eventrelay.store.EventStore;
import io.eventrelay.syncasync.DataService;
import io.eventrelay.syncasync.MessageData;
import io.eventrelay.syncasync.MessagingService;
import io.eventrelay.syncasync.SyncAsyncBridge;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link SyncAsyncBridge} that keeps a namespace -> request id -> waiter table and resolves
 * waiters from the system events of each namespace it has been used with.
 * <p>
 * The request id is assigned and the waiter registered before the message is sent, so a
 * reply can never be observed ahead of its waiter.
 * </p>
 */
@Slf4j
public final class CorrelatingSyncAsyncBridge implements SyncAsyncBridge {

    private final EventStore store;
    private final DataService data;
    private final EventManager events;
    private final MessagingService messaging;
    private final Duration defaultTimeout;

    private final Object inflightMux = new Object();
    private final Map<String, Map<UUID, InflightRequest>> inflight = new HashMap<>();
    private boolean closed;

    private final Object listenerMux = new Object();
    private final Set<String> listenersAdded = new HashSet<>();

    public CorrelatingSyncAsyncBridge(final EventStore store,
                                      final DataService data,
                                      final EventManager events,
                                      final MessagingService messaging,
                                      final RelayConfig config) {
        this(store, data, events, messaging, config.getRequestTimeout());
    }

    public CorrelatingSyncAsyncBridge(final EventStore store,
                                      final DataService data,
                                      final EventManager events,
                                      final MessagingService messaging,
                                      final Duration defaultTimeout) {
        this.store = Objects.requireNonNull(store, "store");
        this.data = Objects.requireNonNull(data, "data");
        this.events = Objects.requireNonNull(events, "events");
        this.messaging = Objects.requireNonNull(messaging, "messaging");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    }

    @Override
    public MessageInOut requestReply(final String namespace, final MessageInOut request) {
        return requestReply(namespace, request, defaultTimeout);
    }

    @Override
    public MessageInOut requestReply(final String namespace, final MessageInOut request, final Duration timeout) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");

        final MessageHeader header = request.header();
        if (header.tag() == null || header.tag().isEmpty()) {
            throw new ValidationException(ErrorCode.REQUEST_REPLY_TAG_REQUIRED);
        }
        if (header.cid() != null) {
            throw new ValidationException(ErrorCode.REQUEST_CANNOT_SET_CID);
        }

        setupNamespaceListener(namespace);

        final UUID requestId = UUID.randomUUID();
        final MessageInOut toSend = request.withMessage(request.message().withId(requestId));
        final InflightRequest waiter = addInflight(namespace, requestId);
        try {
            messaging.sendMessageWithId(namespace, toSend);
            log.debug("Sent request {} tag='{}' in namespace '{}', awaiting reply", requestId, header.tag(), namespace);
            return waiter.getResponse().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            log.debug("Timed out waiting for reply to request {} in namespace '{}'", requestId, namespace);
            throw new RequestTimeoutException(namespace, requestId);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestTimeoutException(namespace, requestId);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException(e.getCause());
        } finally {
            removeInflight(namespace, requestId);
        }
    }

    private void setupNamespaceListener(final String namespace) {
        synchronized (listenerMux) {
            if (listenersAdded.contains(namespace)) return;
            events.addSystemEventListener(namespace, this::eventCallback);
            listenersAdded.add(namespace);
        }
    }

    private InflightRequest addInflight(final String namespace, final UUID id) {
        synchronized (inflightMux) {
            if (closed) throw new BridgeClosedException();
            final InflightRequest waiter = new InflightRequest(namespace, id);
            inflight.computeIfAbsent(namespace, ns -> new HashMap<>()).put(id, waiter);
            return waiter;
        }
    }

    private InflightRequest removeInflight(final String namespace, final UUID id) {
        synchronized (inflightMux) {
            final Map<UUID, InflightRequest> inflightNS = inflight.get(namespace);
            if (inflightNS == null) return null;
            final InflightRequest removed = inflightNS.remove(id);
            if (inflightNS.isEmpty()) inflight.remove(namespace);
            return removed;
        }
    }

    int inflightCount(final String namespace) {
        synchronized (inflightMux) {
            final Map<UUID, InflightRequest> inflightNS = inflight.get(namespace);
            return inflightNS == null ? 0 : inflightNS.size();
        }
    }

    /* for tests that need a waiter without a send */
    InflightRequest registerInflight(final String namespace, final UUID id) {
        return addInflight(namespace, id);
    }

    void eventCallback(final EventDelivery event) {
        final String namespace = event.namespace();
        if (event.reference() == null) return;
        synchronized (inflightMux) {
            final Map<UUID, InflightRequest> inflightNS = inflight.get(namespace);
            if (inflightNS == null || inflightNS.isEmpty() || event.type() != EventType.MESSAGE_CONFIRMED) {
                // nothing could match: skip the lookup
                return;
            }
        }

        final Message msg = store.getMessageById(namespace, event.reference());
        if (msg == null) {
            log.debug("Confirmed message {} not found in namespace '{}'", event.reference(), namespace);
            return;
        }
        final UUID cid = msg.header().cid();
        if (cid == null) return;

        final InflightRequest waiter = removeInflight(namespace, cid);
        if (waiter != null) {
            log.debug("Reply {} received for request {} in namespace '{}'", msg.id(), cid, namespace);
            resolveInflight(waiter, msg);
        }
    }

    void resolveInflight(final InflightRequest waiter, final Message reply) {
        final MessageData md;
        try {
            md = data.getMessageData(reply, true);
        } catch (final RuntimeException e) {
            log.error("Failed to read data for reply {} to request {}", reply.id(), waiter.getId(), e);
            waiter.fail(new ReplyResolutionException(reply.id(), waiter.getId(), e));
            return;
        }
        waiter.resolve(MessageInOut.of(reply, md.data()));
    }

    @Override
    public void close() {
        final List<InflightRequest> outstanding = new ArrayList<>();
        synchronized (inflightMux) {
            if (closed) return;
            closed = true;
            inflight.values().forEach(m -> outstanding.addAll(m.values()));
            inflight.clear();
        }
        final BridgeClosedException ex = new BridgeClosedException();
        outstanding.forEach(w -> w.fail(ex));
        log.info("Sync/async bridge closed, failed {} outstanding request(s)", outstanding.size());
    }
}
