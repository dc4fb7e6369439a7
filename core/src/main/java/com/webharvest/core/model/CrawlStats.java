package com.webharvest.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 카운터 누적기 (스레드 세이프). 크롤 1회당 하나. */
public final class CrawlStats {
    private final AtomicLong pagesCompleted = new AtomicLong(0);   // 결과 기록 수(성공+실패)
    private final AtomicLong pagesFailed    = new AtomicLong(0);
    private final AtomicLong fetchAttempts  = new AtomicLong(0);   // 네트워크 시도(재시도 포함)
    private final AtomicLong retriesTotal   = new AtomicLong(0);
    private final AtomicLong cacheHits      = new AtomicLong(0);
    private final AtomicLong linksRejected  = new AtomicLong(0);   // 필터/도메인/robots/중복
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void pageCompleted(boolean failed) {
        pagesCompleted.incrementAndGet();
        if (failed) pagesFailed.incrementAndGet();
    }
    public void addFetchAttempt() { fetchAttempts.incrementAndGet(); }
    public void addRetry() { retriesTotal.incrementAndGet(); }
    public void addCacheHit() { cacheHits.incrementAndGet(); }
    public void addRejected() { linksRejected.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(pagesCompleted.get(), pagesFailed.get(), fetchAttempts.get(),
                retriesTotal.get(), cacheHits.get(), linksRejected.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public record Snapshot(long pagesCompleted,
                           long pagesFailed,
                           long fetchAttempts,
                           long retriesTotal,
                           long cacheHits,
                           long linksRejected,
                           int maxObservedConcurrency) {}
}
