package io.eventrelay.events.system;

import io.eventrelay.core.model.EventDelivery;
import io.eventrelay.core.model.EventDeliveryResponse;
import io.eventrelay.events.EventManager;
import io.eventrelay.events.SystemEventListener;
import io.eventrelay.events.dispatcher.DeliveryResponseHandler;
import io.eventrelay.events.dispatcher.DeliveryTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Delivers a dispatcher's events to in-process {@link SystemEventListener}s.
 * <p>
 * Listeners run on a dedicated callback thread, one event at a time. The delivery is
 * acked once every listener of the event's namespace returned, or nacked with the failure
 * message if one of them threw.
 * </p>
 */
@Slf4j
public final class SystemEventManager implements EventManager, DeliveryTransport, AutoCloseable {

    private final ConcurrentMap<String, CopyOnWriteArrayList<SystemEventListener>> listeners = new ConcurrentHashMap<>();
    private final ExecutorService callbacks = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "system-event-callbacks");
        t.setDaemon(true);
        return t;
    });

    @Override
    public void addSystemEventListener(final String namespace, final SystemEventListener listener) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(listener, "listener");

        final CopyOnWriteArrayList<SystemEventListener> nsListeners =
                listeners.computeIfAbsent(namespace, ns -> new CopyOnWriteArrayList<>());
        if (nsListeners.addIfAbsent(listener)) {
            log.info("Added system event listener for namespace '{}'", namespace);
        }
    }

    @Override
    public void deliver(final String connectionId,
                       final EventDelivery delivery,
                       final DeliveryResponseHandler responses) {
        try {
            callbacks.execute(() -> dispatchToListeners(delivery, responses));
        } catch (final RejectedExecutionException e) {
            throw new IllegalStateException("System event manager is closed", e);
        }
    }

    private void dispatchToListeners(final EventDelivery delivery, final DeliveryResponseHandler responses) {
        EventDeliveryResponse response = EventDeliveryResponse.ack(delivery.id());
        final List<SystemEventListener> nsListeners = delivery.namespace() == null
                ? List.of()
                : listeners.getOrDefault(delivery.namespace(), new CopyOnWriteArrayList<>());
        for (final SystemEventListener l : nsListeners) {
            try {
                l.onEvent(delivery);
            } catch (final RuntimeException e) {
                log.warn("System event listener rejected {} [{}]: {}", delivery.id(), delivery.type(), e.toString());
                response = EventDeliveryResponse.nack(delivery.id(), e.getMessage());
                break;
            }
        }
        try {
            responses.onResponse(response);
        } catch (final RuntimeException e) {
            log.debug("Response for {} not accepted: {}", delivery.id(), e.toString());
        }
    }

    @Override
    public void close() throws InterruptedException {
        callbacks.shutdownNow();
        if (!callbacks.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("System event callback thread did not terminate within 5s");
        }
    }
}
