package io.eventrelay.subscription;

/**
 * @param readAhead  overrides the configured default read-ahead when non-null
 * @param firstEvent start position when no offset is stored, NEWEST when null
 */
public record SubscriptionOptions(Integer readAhead, FirstEvent firstEvent) {

    public static SubscriptionOptions defaults() {
        return new SubscriptionOptions(null, FirstEvent.NEWEST);
    }

    public static SubscriptionOptions readAhead(final int readAhead) {
        return new SubscriptionOptions(readAhead, FirstEvent.NEWEST);
    }
}
