package io.eventrelay.core.model;

import java.util.UUID;

/**
 * Ack (or nack, when {@code rejected}) returned by a consumer for a delivered event.
 *
 * @param id   id of the delivered event
 * @param info free-form diagnostic supplied by the consumer
 */
public record EventDeliveryResponse(UUID id, boolean rejected, String info, SubscriptionRef subscription) {

    public static EventDeliveryResponse ack(final UUID id) {
        return new EventDeliveryResponse(id, false, null, null);
    }

    public static EventDeliveryResponse nack(final UUID id, final String info) {
        return new EventDeliveryResponse(id, true, info, null);
    }
}
