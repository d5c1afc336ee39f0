package io.eventrelay.subscription;

/**
 * Where a new durable subscription starts reading when it has no committed offset.
 */
public enum FirstEvent {
    /** Only events written after the subscription is first started. */
    NEWEST,
    /** Every event in the log. */
    OLDEST
}
