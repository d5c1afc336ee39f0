package io.eventrelay.core.model;

/**
 * Kinds of event written to the event log.
 */
public enum EventType {
    MESSAGE_CONFIRMED,
    MESSAGE_REJECTED,
    DATA_ARRIVED_BROADCAST
}
