package io.eventrelay.retry;

import lombok.Getter;
import lombok.ToString;

/**
 * Backoff policy: the delay grows by {@code factor} per attempt, capped at {@code maxDelayMs}.
 * A {@code maxAttempts} of zero means retry until the caller gives up.
 */
@Getter
@ToString
public final class RetryPolicy {

    private final int maxAttempts;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double factor;

    private RetryPolicy(final int maxAttempts,
                        final long initialDelayMs,
                        final long maxDelayMs,
                        final double factor) {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts must be >= 0");
        if (initialDelayMs < 0) throw new IllegalArgumentException("initialDelayMs must be >= 0");
        if (maxDelayMs < initialDelayMs) throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs");
        if (factor < 1.0d) throw new IllegalArgumentException("factor must be >= 1.0");
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.factor = factor;
    }

    public static RetryPolicy fixed(final int maxAttempts, final long delayMs) {
        return new RetryPolicy(maxAttempts, delayMs, delayMs, 1.0d);
    }

    public static RetryPolicy exponential(final int maxAttempts,
                                          final long initialDelayMs,
                                          final long maxDelayMs,
                                          final double factor) {
        return new RetryPolicy(maxAttempts, initialDelayMs, maxDelayMs, factor);
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt the attempt number (1-based)
     * @return delay in milliseconds
     */
    public long calculateDelayMs(final int attempt) {
        if (attempt <= 0) return 0L;

        double delay = initialDelayMs;
        for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
            delay *= factor;
        }
        return (long) Math.min(delay, (double) maxDelayMs);
    }

    /**
     * @param attempt current attempt number (1-based)
     * @return true if another attempt is allowed after this one failed
     */
    public boolean shouldRetry(final int attempt) {
        return maxAttempts == 0 || attempt < maxAttempts;
    }
}
