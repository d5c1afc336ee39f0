package io.eventrelay.core.model;

import java.util.UUID;

/**
 * Identity of the subscription an event is delivered under.
 */
public record SubscriptionRef(UUID id, String namespace, String name) {
}
