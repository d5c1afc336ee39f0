package io.eventrelay.subscription;

import io.eventrelay.core.model.SubscriptionRef;

import java.util.Objects;
import java.util.UUID;

/**
 * Stored definition of a subscription.
 *
 * @param ephemeral an ephemeral subscription starts at the newest event and never commits offsets
 */
public record SubscriptionDefinition(UUID id,
                                     String namespace,
                                     String name,
                                     SubscriptionFilter filter,
                                     SubscriptionOptions options,
                                     boolean ephemeral) {
    public SubscriptionDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        if (filter == null) filter = SubscriptionFilter.matchAll();
        if (options == null) options = SubscriptionOptions.defaults();
    }

    public SubscriptionRef ref() {
        return new SubscriptionRef(id, namespace, name);
    }
}
