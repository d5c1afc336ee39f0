package io.eventrelay.offset;

public enum OffsetType {
    SUBSCRIPTION
}
