package io.eventrelay.events.poller;

import io.eventrelay.core.model.Event;

import java.util.List;

/**
 * Receives each non-empty page read by an {@link EventPoller}. Runs on the poller thread.
 */
@FunctionalInterface
public interface NewEventsHandler {

    /**
     * @return true to read the next page immediately instead of waiting for new events
     * @throws RuntimeException to have the poller retry the same page after a backoff
     */
    boolean handle(List<Event> events);
}
