package io.eventrelay.events.poller;

import io.eventrelay.config.impl.RelayConfig;
import io.eventrelay.offset.OffsetType;
import io.eventrelay.retry.RetryPolicy;
import io.eventrelay.subscription.FirstEvent;
import io.eventrelay.subscription.SubscriptionDefinition;

import java.time.Duration;
import java.util.Objects;

/**
 * @param limitNamespace             only events of this namespace are read, all when null
 * @param startupOffsetRetryAttempts attempts to restore the offset before the poller gives up
 * @param ephemeral                  start at the newest event and never commit offsets
 */
public record EventPollerConfig(String limitNamespace,
                                int eventBatchSize,
                                Duration eventPollTimeout,
                                int startupOffsetRetryAttempts,
                                RetryPolicy retry,
                                OffsetType offsetType,
                                String offsetNamespace,
                                String offsetName,
                                boolean ephemeral,
                                FirstEvent firstEvent) {
    public EventPollerConfig {
        if (eventBatchSize <= 0) throw new IllegalArgumentException("eventBatchSize must be > 0");
        if (startupOffsetRetryAttempts <= 0) throw new IllegalArgumentException("startupOffsetRetryAttempts must be > 0");
        Objects.requireNonNull(eventPollTimeout, "eventPollTimeout");
        Objects.requireNonNull(retry, "retry");
        Objects.requireNonNull(offsetType, "offsetType");
        Objects.requireNonNull(offsetName, "offsetName");
        if (firstEvent == null) firstEvent = FirstEvent.NEWEST;
    }

    public static EventPollerConfig forSubscription(final RelayConfig cfg, final SubscriptionDefinition def) {
        return new EventPollerConfig(
                def.namespace(),
                cfg.getEventBatchSize(),
                cfg.getPollTimeout(),
                cfg.getStartupOffsetRetryAttempts(),
                cfg.getRetryPolicy(),
                OffsetType.SUBSCRIPTION,
                def.namespace(),
                def.name(),
                def.ephemeral(),
                def.options().firstEvent());
    }
}
