package io.eventrelay.subscription;

import io.eventrelay.core.model.EventDelivery;
import io.eventrelay.core.model.Message;
import io.eventrelay.core.model.MessageHeader;
import lombok.Getter;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A subscription definition with its filters compiled, plus the election gate
 * shared by all dispatchers bound to it.
 */
@Getter
public final class Subscription {

    private final SubscriptionDefinition definition;
    private final Pattern eventMatcher;
    private final Pattern topicFilter;
    private final Pattern contextFilter;
    private final Pattern groupFilter;
    private final DispatcherElection dispatcherElection = new DispatcherElection();

    private Subscription(final SubscriptionDefinition definition) {
        this.definition = definition;
        final SubscriptionFilter f = definition.filter();
        this.eventMatcher = compile("events", f.events());
        this.topicFilter = compile("topics", f.topics());
        this.contextFilter = compile("context", f.context());
        this.groupFilter = compile("group", f.group());
    }

    public static Subscription compile(final SubscriptionDefinition definition) {
        return new Subscription(definition);
    }

    /**
     * True if the delivery passes every configured filter. Deliveries without a
     * message are matched with empty topic, context and group.
     */
    public boolean matches(final EventDelivery delivery) {
        if (eventMatcher != null && !eventMatcher.matcher(delivery.type().name()).find()) {
            return false;
        }
        final Message msg = delivery.message();
        final MessageHeader header = msg == null ? null : msg.header();
        final String topic = header == null ? "" : nullToEmpty(header.topic());
        final String context = header == null ? "" : nullToEmpty(header.context());
        final String group = header == null ? "" : nullToEmpty(header.group());

        if (topicFilter != null && !topicFilter.matcher(topic).find()) return false;
        if (contextFilter != null && !contextFilter.matcher(context).find()) return false;
        return groupFilter == null || groupFilter.matcher(group).find();
    }

    private static Pattern compile(final String field, final String regex) {
        if (regex == null || regex.isEmpty()) return null;
        try {
            return Pattern.compile(regex);
        } catch (final PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid " + field + " filter regex: " + regex, e);
        }
    }

    private static String nullToEmpty(final String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        return definition.id() + "/" + definition.namespace() + ":" + definition.name();
    }
}
