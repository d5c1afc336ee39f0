package io.eventrelay.store.impl;

import io.eventrelay.core.model.Data;
import io.eventrelay.core.model.DataRef;
import io.eventrelay.core.model.Event;
import io.eventrelay.core.model.EventType;
import io.eventrelay.core.model.Message;
import io.eventrelay.store.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-process event log. Sequences start at 0 and are assigned on append.
 */
@Slf4j
public final class InMemoryEventStore implements EventStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Event> events = new ArrayList<>();
    private final Map<UUID, Message> messages = new ConcurrentHashMap<>();
    private final Map<UUID, Data> data = new ConcurrentHashMap<>();
    private final List<Runnable> newEventListeners = new CopyOnWriteArrayList<>();

    /** Registers a hook run after each append, typically a poller's shoulder tap. */
    public void onNewEvent(final Runnable listener) {
        newEventListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public Event appendEvent(final EventType type, final String namespace, final UUID reference) {
        final Event event;
        lock.writeLock().lock();
        try {
            event = new Event(UUID.randomUUID(), events.size(), type, namespace, reference);
            events.add(event);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Appended event {}/{} [{}] ref={}", event.sequence(), event.id(), type, reference);
        newEventListeners.forEach(Runnable::run);
        return event;
    }

    public void putMessage(final Message message) {
        Objects.requireNonNull(message.id(), "message id");
        messages.put(message.id(), message);
    }

    public void putData(final Data row) {
        Objects.requireNonNull(row.id(), "data id");
        data.put(row.id(), row);
    }

    public Data getData(final UUID id) {
        return data.get(id);
    }

    @Override
    public List<Event> getEvents(final String namespace, final long afterSequence, final int limit) {
        lock.readLock().lock();
        try {
            final List<Event> page = new ArrayList<>(Math.min(limit, events.size()));
            final int from = (int) Math.max(0L, afterSequence + 1);
            for (int i = from; i < events.size() && page.size() < limit; i++) {
                final Event e = events.get(i);
                if (namespace == null || namespace.equals(e.namespace())) {
                    page.add(e);
                }
            }
            return page;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long getLatestSequence(final String namespace) {
        lock.readLock().lock();
        try {
            for (int i = events.size() - 1; i >= 0; i--) {
                final Event e = events.get(i);
                if (namespace == null || namespace.equals(e.namespace())) return e.sequence();
            }
            return -1L;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Message> getMessagesByIds(final String namespace, final Collection<UUID> ids) {
        return ids.stream()
                .map(messages::get)
                .filter(Objects::nonNull)
                .filter(m -> namespace.equals(m.header().namespace()))
                .toList();
    }

    @Override
    public List<DataRef> getDataRefsByIds(final String namespace, final Collection<UUID> ids) {
        return ids.stream()
                .map(data::get)
                .filter(Objects::nonNull)
                .filter(d -> namespace.equals(d.namespace()))
                .map(Data::toRef)
                .toList();
    }

    @Override
    public Message getMessageById(final String namespace, final UUID id) {
        if (id == null) return null;
        final Message m = messages.get(id);
        if (m == null || !Objects.equals(namespace, m.header().namespace())) return null;
        return m;
    }
}
