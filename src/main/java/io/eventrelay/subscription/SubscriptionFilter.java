package io.eventrelay.subscription;

/**
 * Regular expressions an event must match to be delivered. A null or empty
 * expression matches everything.
 *
 * @param events  matched against the event type name
 * @param topics  matched against the message topic
 * @param context matched against the message context
 * @param group   matched against the message group
 */
public record SubscriptionFilter(String events, String topics, String context, String group) {

    public static SubscriptionFilter matchAll() {
        return new SubscriptionFilter(null, null, null, null);
    }

    public static SubscriptionFilter events(final String events) {
        return new SubscriptionFilter(events, null, null, null);
    }
}
