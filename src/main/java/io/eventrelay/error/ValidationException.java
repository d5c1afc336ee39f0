package io.eventrelay.error;

/**
 * A request was malformed. Raised before any side effect and never worth retrying.
 */
public class ValidationException extends EventRelayException {

    public ValidationException(final ErrorCode errorCode, final Object... args) {
        super(errorCode, args);
    }
}
