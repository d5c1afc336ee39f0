package io.eventrelay.syncasync;

import io.eventrelay.core.model.MessageInOut;

import java.time.Duration;

/**
 * Turns "send a message, later observe the confirmed reply" into a blocking call.
 */
public interface SyncAsyncBridge extends AutoCloseable {

    /**
     * Same as {@link #requestReply(String, MessageInOut, Duration)} with the configured default timeout.
     */
    MessageInOut requestReply(String namespace, MessageInOut request);

    /**
     * Sends {@code request} and blocks until a confirmed message whose correlation id is the
     * request's id arrives, then returns it with its data inline.
     *
     * @param request must carry a tag and must not carry a correlation id; its id is assigned here
     * @throws io.eventrelay.error.ValidationException      if the request is malformed; nothing is sent
     * @throws io.eventrelay.error.RequestTimeoutException  if no reply arrived within {@code timeout}
     * @throws io.eventrelay.error.ReplyResolutionException if the reply's data could not be loaded
     * @throws io.eventrelay.error.BridgeClosedException    if the bridge is or becomes closed
     */
    MessageInOut requestReply(String namespace, MessageInOut request, Duration timeout);

    @Override
    void close();
}
