package io.eventrelay.core.model;

import java.util.UUID;

/**
 * Data materialized inside an outbound message.
 */
public record InlineData(UUID id, String hash, String value) {

    public static InlineData of(final Data data) {
        return new InlineData(data.id(), data.hash(), data.value());
    }
}
