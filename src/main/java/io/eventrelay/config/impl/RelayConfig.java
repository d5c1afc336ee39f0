package io.eventrelay.config.impl;

import io.eventrelay.retry.RetryPolicy;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable config holder loaded from eventrelay.yaml. Every key is optional.
 */
@Getter
public final class RelayConfig {

    private int defaultReadAhead = 0;

    private int eventBatchSize = 5;
    private long pollTimeoutMs = 30_000L;
    private long retryInitialDelayMs = 100L;
    private long retryMaxDelayMs = 30_000L;
    private double retryFactor = 2.0d;

    private int startupOffsetRetryAttempts = 5;

    private long requestTimeoutMs = 120_000L;

    private RelayConfig() {
    }

    public static RelayConfig defaults() {
        return new RelayConfig();
    }

    public static RelayConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    public static RelayConfig load(final InputStream in) {
        final Map<String, Object> m = new Yaml().load(in);
        final RelayConfig cfg = new RelayConfig();
        if (m == null) return cfg;

        final Map<String, Object> subs = section(m, "subscriptionDefaults");
        cfg.defaultReadAhead = intValue(subs, "readAhead", cfg.defaultReadAhead);

        final Map<String, Object> ed = section(m, "eventDispatcher");
        cfg.eventBatchSize = intValue(ed, "bufferLength", cfg.eventBatchSize);
        cfg.pollTimeoutMs  = longValue(ed, "pollTimeoutMs", cfg.pollTimeoutMs);

        final Map<String, Object> retry = section(ed, "retry");
        cfg.retryInitialDelayMs = longValue(retry, "initialDelayMs", cfg.retryInitialDelayMs);
        cfg.retryMaxDelayMs     = longValue(retry, "maxDelayMs", cfg.retryMaxDelayMs);
        cfg.retryFactor         = doubleValue(retry, "factor", cfg.retryFactor);

        final Map<String, Object> orchestrator = section(m, "orchestrator");
        cfg.startupOffsetRetryAttempts = intValue(orchestrator, "startupAttempts", cfg.startupOffsetRetryAttempts);

        final Map<String, Object> syncAsync = section(m, "syncAsync");
        cfg.requestTimeoutMs = longValue(syncAsync, "requestTimeoutMs", cfg.requestTimeoutMs);

        if (cfg.eventBatchSize <= 0) throw new IllegalArgumentException("eventDispatcher.bufferLength must be > 0");
        if (cfg.retryFactor < 1.0d) throw new IllegalArgumentException("eventDispatcher.retry.factor must be >= 1.0");

        return cfg;
    }

    public Duration getPollTimeout() {
        return Duration.ofMillis(pollTimeoutMs);
    }

    public Duration getRequestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    /** Unlimited-attempt policy used by the poller for reads and batch dispatch. */
    public RetryPolicy getRetryPolicy() {
        return RetryPolicy.exponential(0, retryInitialDelayMs, retryMaxDelayMs, retryFactor);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(final Map<String, Object> parent, final String key) {
        final Object v = parent.get(key);
        return v instanceof Map ? (Map<String, Object>) v : Map.of();
    }

    private static int intValue(final Map<String, Object> m, final String key, final int dflt) {
        final Object v = m.get(key);
        return v == null ? dflt : ((Number) v).intValue();
    }

    private static long longValue(final Map<String, Object> m, final String key, final long dflt) {
        final Object v = m.get(key);
        return v == null ? dflt : ((Number) v).longValue();
    }

    private static double doubleValue(final Map<String, Object> m, final String key, final double dflt) {
        final Object v = m.get(key);
        return v == null ? dflt : ((Number) v).doubleValue();
    }
}
