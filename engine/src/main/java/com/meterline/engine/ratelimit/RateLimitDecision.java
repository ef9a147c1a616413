package com.meterline.engine.ratelimit;

/**
 * Outcome of one rate-limit check.
 */
public interface RateLimitDecision {

    boolean allowed();

    /**
     * @param count     requests counted in the current window, including this one
     * @param remaining requests left in the window
     */
    record Allowed(long count, long remaining) implements RateLimitDecision {
        @Override
        public boolean allowed() {
            return true;
        }
    }

    /**
     * @param retryAfterSeconds seconds until the window resets, at least 1
     */
    record RateLimited(long count, long limit, long retryAfterSeconds) implements RateLimitDecision {
        @Override
        public boolean allowed() {
            return false;
        }
    }
}
