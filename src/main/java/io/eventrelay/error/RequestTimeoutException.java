package io.eventrelay.error;

import lombok.Getter;

import java.util.UUID;

/**
 * No correlated reply arrived before the caller's deadline.
 */
@Getter
public class RequestTimeoutException extends EventRelayException {

    private final String namespace;
    private final UUID requestId;

    public RequestTimeoutException(final String namespace, final UUID requestId) {
        super(ErrorCode.REQUEST_REPLY_TIMEOUT, requestId, namespace);
        this.namespace = namespace;
        this.requestId = requestId;
    }
}
