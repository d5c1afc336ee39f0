package io.eventrelay.syncasync;

import io.eventrelay.core.model.Message;
import io.eventrelay.core.model.MessageInOut;

/**
 * Sends messages whose id has already been assigned by the caller.
 */
public interface MessagingService {

    /**
     * @return the message as sent
     * @throws RuntimeException if the send failed
     */
    Message sendMessageWithId(String namespace, MessageInOut message);
}
