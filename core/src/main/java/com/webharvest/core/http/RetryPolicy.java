package com.webharvest.core.http;

import java.time.Duration;

/** 작업 하나의 재시도 판단. attempt 는 1부터 센다. */
public interface RetryPolicy {
    /** @param statusCode HTTP 상태, 전송 오류면 -1 */
    boolean shouldRetry(int statusCode, int attempt);

    /** attempt 번째 실패 뒤 기다릴 시간 */
    Duration nextDelay(int attempt);

    /** 최초 시도 포함 최대 시도 수 */
    int maxAttempts();
}
