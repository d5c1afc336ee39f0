package io.eventrelay.error;

public class DispatcherClosingException extends EventRelayException {

    public DispatcherClosingException() {
        super(ErrorCode.DISPATCHER_CLOSING);
    }
}
