package io.eventrelay.core.model;

import java.util.UUID;

/**
 * A stored data row. {@code value} holds the serialized JSON payload.
 */
public record Data(UUID id, String namespace, String hash, String value) {

    public DataRef toRef() {
        return new DataRef(id, hash);
    }
}
