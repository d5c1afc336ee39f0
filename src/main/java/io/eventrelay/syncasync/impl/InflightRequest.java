package io.eventrelay.syncasync.impl;

import io.eventrelay.core.model.MessageInOut;
import lombok.Getter;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Waiter for the reply to one outstanding request.
 */
@Getter
final class InflightRequest {

    private final String namespace;
    private final UUID id;
    private final CompletableFuture<MessageInOut> response = new CompletableFuture<>();

    InflightRequest(final String namespace, final UUID id) {
        this.namespace = namespace;
        this.id = id;
    }

    boolean resolve(final MessageInOut reply) {
        return response.complete(reply);
    }

    boolean fail(final Throwable cause) {
        return response.completeExceptionally(cause);
    }
}
