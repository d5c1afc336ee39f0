package io.eventrelay.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, sequenced fact from the event log.
 *
 * @param reference id of the message or data record the event is about, may be null
 */
public record Event(UUID id, long sequence, EventType type, String namespace, UUID reference) {
    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
    }
}
