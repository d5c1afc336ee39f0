package io.eventrelay.core.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A message as persisted: header plus references to its data.
 */
public record Message(MessageHeader header, List<DataRef> data) {
    public Message {
        Objects.requireNonNull(header, "header");
        data = data == null ? List.of() : List.copyOf(data);
    }

    public UUID id() {
        return header.id();
    }

    public Message withId(final UUID id) {
        return new Message(header.withId(id), data);
    }
}
