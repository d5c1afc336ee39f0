package io.eventrelay.core.model;

import java.util.UUID;

/**
 * Reference from a message to one of its data rows.
 */
public record DataRef(UUID id, String hash) {
}
