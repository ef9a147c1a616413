package com.meterline.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RetryBackoffTest {

    @Test
    void testDelayGrowsLinearly() {
        assertEquals(Duration.ofMinutes(5), RetryBackoff.next(1));
        assertEquals(Duration.ofMinutes(10), RetryBackoff.next(2));
        assertEquals(Duration.ofMinutes(15), RetryBackoff.next(3));
    }

    @Test
    void testAttemptBelowOneCountsAsOne() {
        assertEquals(Duration.ofSeconds(2), RetryBackoff.next(0, Duration.ofSeconds(2)));
    }

    @Test
    void testNextRetryAtAddsDelayToNow() {
        assertEquals(1_000 + 6_000, RetryBackoff.nextRetryAt(1_000, 3, Duration.ofSeconds(2)));
    }
}
