package io.eventrelay.events.dispatcher;

import io.eventrelay.core.model.EventDeliveryResponse;

/**
 * Where a transport reports the consumer's ack or nack for a delivered event.
 */
@FunctionalInterface
public interface DeliveryResponseHandler {
    void onResponse(EventDeliveryResponse response);
}
