package io.eventrelay.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * An {@link Event} enriched with the message and data it references, for one delivery attempt.
 *
 * @param message the referenced message, null if the reference is not a message
 * @param data    the referenced data row, null if the reference is not data
 */
public record EventDelivery(Event event, SubscriptionRef subscription, Message message, DataRef data) {
    public EventDelivery {
        Objects.requireNonNull(event, "event");
    }

    public static EventDelivery of(final Event event) {
        return new EventDelivery(event, null, null, null);
    }

    public UUID id() {
        return event.id();
    }

    public long sequence() {
        return event.sequence();
    }

    public EventType type() {
        return event.type();
    }

    public String namespace() {
        return event.namespace();
    }

    public UUID reference() {
        return event.reference();
    }
}
