package com.webharvest.core.proxy;

/**
 * 풀 통계. 지연 항목은 활성 프록시 중 측정값이 있는 것만 대상이며 없으면 null.
 */
public record ProxyPoolStats(int total,
                             int active,
                             int dead,
                             String fastestProxy,
                             Double fastestLatencyMs,
                             String slowestProxy,
                             Double slowestLatencyMs,
                             Double averageLatencyMs) {}
