package io.eventrelay.error;

import lombok.Getter;

/**
 * Root of all errors raised by the relay itself. Failures of collaborators
 * (stores, messaging, data) are propagated as thrown and never wrapped in this type,
 * except where a waiter must be failed with a cause attached.
 */
@Getter
public class EventRelayException extends RuntimeException {

    private final ErrorCode errorCode;

    public EventRelayException(final ErrorCode errorCode, final Object... args) {
        super(errorCode.format(args));
        this.errorCode = errorCode;
    }

    public EventRelayException(final ErrorCode errorCode, final Throwable cause, final Object... args) {
        super(errorCode.format(args), cause);
        this.errorCode = errorCode;
    }
}
