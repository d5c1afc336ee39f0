package io.eventrelay.events.dispatcher;

import io.eventrelay.core.model.EventDelivery;

/**
 * Carries deliveries to the consumer on a connection.
 * <p>
 * Implementations must not report the response from inside {@link #deliver}: the calling
 * thread is the dispatch loop, which only consumes responses after the hand-off returns.
 * </p>
 */
public interface DeliveryTransport {

    /**
     * @param responses sink for the consumer's ack/nack of this delivery
     * @throws RuntimeException if the hand-off failed; the dispatcher aborts the batch
     */
    void deliver(String connectionId, EventDelivery delivery, DeliveryResponseHandler responses);
}
