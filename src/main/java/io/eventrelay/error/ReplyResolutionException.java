package io.eventrelay.error;

import java.util.UUID;

/**
 * The reply message was found but its data could not be loaded.
 */
public class ReplyResolutionException extends EventRelayException {

    public ReplyResolutionException(final UUID replyId, final UUID requestId, final Throwable cause) {
        super(ErrorCode.REPLY_DATA_RESOLUTION_FAILED, cause, replyId, requestId);
    }
}
