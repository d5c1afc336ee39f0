package io.eventrelay.store;

import io.eventrelay.core.model.DataRef;
import io.eventrelay.core.model.Event;
import io.eventrelay.core.model.Message;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of the persistent event log and the records it references.
 * All lookups are namespace scoped; "not found" is an empty result or null, never an exception.
 */
public interface EventStore {

    /**
     * Page of events with {@code sequence > afterSequence}, ascending by sequence.
     *
     * @param namespace only events in this namespace, or all namespaces when null
     */
    List<Event> getEvents(String namespace, long afterSequence, int limit);

    /**
     * Highest sequence written in the namespace (all namespaces when null), -1 when empty.
     */
    long getLatestSequence(String namespace);

    List<Message> getMessagesByIds(String namespace, Collection<UUID> ids);

    List<DataRef> getDataRefsByIds(String namespace, Collection<UUID> ids);

    /**
     * @return the message, or null when it does not exist (yet)
     */
    Message getMessageById(String namespace, UUID id);
}
