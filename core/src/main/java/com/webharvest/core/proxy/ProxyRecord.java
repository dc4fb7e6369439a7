package com.webharvest.core.proxy;

/**
 * 프록시 하나의 상태 스냅샷 (불변). 살아있는 상태는 {@link ProxyPool} 만 가진다.
 *
 * @param lastUsedAt   마지막 acquire 시각(ms), 없으면 -1
 * @param avgLatencyMs 지수이동평균 지연, 측정 전이면 NaN
 */
public record ProxyRecord(String address,
                          ProxyState state,
                          int consecutiveFailures,
                          long lastUsedAt,
                          double avgLatencyMs) {

    public boolean isActive() {
        return state == ProxyState.ACTIVE;
    }

    public boolean hasLatency() {
        return !Double.isNaN(avgLatencyMs);
    }
}
