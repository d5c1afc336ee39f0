package io.eventrelay.error;

public class BridgeClosedException extends EventRelayException {

    public BridgeClosedException() {
        super(ErrorCode.BRIDGE_CLOSED);
    }
}
