package io.eventrelay.events;

import io.eventrelay.core.model.EventDelivery;

/**
 * In-process consumer of system events.
 */
@FunctionalInterface
public interface SystemEventListener {

    /**
     * @throws RuntimeException to reject the event; it will be redelivered
     */
    void onEvent(EventDelivery event);
}
