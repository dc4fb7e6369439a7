package com.webharvest.core.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** 429/5xx/전송 오류에서만 재시도. base → 2×base → 4×base ... (±10% Jitter) */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    /** 재시도 3회, 기준 2초 */
    public DefaultRetryPolicy() { this(4, 2000); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
    }

    /** retry.count 는 재시도 횟수이므로 시도 수는 +1 */
    public static DefaultRetryPolicy fromRetryCount(int retryCount, Duration baseDelay) {
        return new DefaultRetryPolicy(retryCount + 1, baseDelay.toMillis());
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        if (attempt >= maxAttempts) return false;
        return isRetryable(statusCode);
    }

    public static boolean isRetryable(int statusCode) {
        return statusCode == 429 || statusCode >= 500 || statusCode == -1;
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(Math.max(attempt - 1, 0), 20);   // 1,2,4...
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
