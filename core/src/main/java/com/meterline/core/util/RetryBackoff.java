package com.meterline.core.util;

import java.time.Duration;

/**
 * Linear retry schedule for durable work items.
 * <p>
 * <b>Formula:</b> {@code delay = step * attempt}, where {@code attempt} is the number of
 * failed attempts so far (1-based). With the default 300 s step the schedule is
 * 5 min, 10 min, 15 min...
 * </p>
 */
public final class RetryBackoff {
    private RetryBackoff() {
    }

    public static final Duration DEFAULT_STEP = Duration.ofSeconds(300);

    /**
     * @param attempt failed attempts so far (values below 1 are treated as 1)
     * @param step    delay added per attempt
     * @return delay before the next attempt
     */
    public static Duration next(int attempt, Duration step) {
        return step.multipliedBy(Math.max(1, attempt));
    }

    /**
     * Epoch millis of the next attempt.
     */
    public static long nextRetryAt(long now, int attempt, Duration step) {
        return now + next(attempt, step).toMillis();
    }

    public static Duration next(int attempt) {
        return next(attempt, DEFAULT_STEP);
    }
}
