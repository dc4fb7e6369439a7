package com.webharvest.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void shouldRetry_onlyOn_429_5xx_or_minus1_and_respect_maxAttempts() {
        var p = DefaultRetryPolicy.fromRetryCount(2, Duration.ofMillis(250));

        assertEquals(3, p.maxAttempts(), "retry count 2 → 3 attempts");

        int[] retryables = {429, 500, 502, 503, 599, -1};
        for (int sc : retryables) {
            assertTrue(p.shouldRetry(sc, 1), "should retry on first failure for " + sc);
            assertTrue(p.shouldRetry(sc, 2), "should retry on second failure for " + sc);
            assertFalse(p.shouldRetry(sc, 3), "must stop retrying at attempt=3 for " + sc);
        }

        int[] nonRetry = {200, 204, 301, 302, 304, 400, 401, 403, 404, 418};
        for (int sc : nonRetry) {
            assertFalse(p.shouldRetry(sc, 1), "must not retry for non-retryable code " + sc);
        }
    }

    @Test
    void zero_retries_means_single_attempt() {
        var p = DefaultRetryPolicy.fromRetryCount(0, Duration.ofSeconds(1));
        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(503, 1));
    }

    @Test
    void default_is_three_retries_from_two_seconds() {
        var p = new DefaultRetryPolicy();
        assertEquals(4, p.maxAttempts());
        assertBetween(p.nextDelay(1).toMillis(), 1800, 2200, "default first backoff");
    }

    @Test
    void backoff_is_exponential_with_jitter_plus_minus_10_percent() {
        var p = new DefaultRetryPolicy(4, 250);

        // 250 → 500 → 1000 (ms), each with ±10% jitter
        assertBetween(p.nextDelay(1).toMillis(), 225, 275, "attempt=1 backoff");
        assertBetween(p.nextDelay(2).toMillis(), 450, 550, "attempt=2 backoff");
        assertBetween(p.nextDelay(3).toMillis(), 900, 1100, "attempt=3 backoff");
    }

    @Test
    void zero_base_never_waits() {
        var p = new DefaultRetryPolicy(3, 0);
        assertEquals(Duration.ZERO, p.nextDelay(2));
    }

    // ---- helpers ----
    private static void assertBetween(long actual, long min, long max, String label) {
        assertTrue(actual >= min && actual <= max,
                () -> label + " out of range: " + actual + "ms (expected " + min + "~" + max + "ms)");
    }
}
