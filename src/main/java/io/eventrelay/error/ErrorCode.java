package io.eventrelay.error;

import lombok.Getter;

/**
 * Stable, externally visible error codes. Codes never change once published;
 * the message template may.
 */
@Getter
public enum ErrorCode {
    DISPATCHER_CLOSING("ER10182", "Event dispatcher closing"),
    REQUEST_REPLY_TIMEOUT("ER10260", "Timed out waiting for reply to request %s in namespace '%s'"),
    REQUEST_REPLY_TAG_REQUIRED("ER10261", "A tag must be set on a request message"),
    REQUEST_CANNOT_SET_CID("ER10262", "The request message must not have a correlation id (cid) set"),
    REPLY_DATA_RESOLUTION_FAILED("ER10263", "Failed to resolve data for reply %s to request %s"),
    BRIDGE_CLOSED("ER10264", "Sync/async bridge closed");

    private final String code;
    private final String template;

    ErrorCode(final String code, final String template) {
        this.code = code;
        this.template = template;
    }

    public String format(final Object... args) {
        return code + ": " + String.format(template, args);
    }
}
