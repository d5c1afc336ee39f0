package io.eventrelay.syncasync;

import io.eventrelay.core.model.Message;

/**
 * Materializes the data referenced by a message.
 */
public interface DataService {

    /**
     * @param allowPartial return the rows that are available even if some are missing
     * @throws RuntimeException if the lookup failed
     */
    MessageData getMessageData(Message message, boolean allowPartial);
}
