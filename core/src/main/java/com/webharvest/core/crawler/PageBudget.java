package com.webharvest.core.crawler;

/**
 * 페이지 예산. 작업을 꺼내기 전에 슬롯을 예약하므로 결과 수는 maxPages 를 넘지 않는다.
 * 예약과 완료 카운트는 같은 모니터 안에서만 바뀐다.
 */
final class PageBudget {
    private final int maxPages;
    private int reserved;
    private int completed;

    PageBudget(int maxPages) {
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        this.maxPages = maxPages;
    }

    synchronized boolean tryReserve() {
        if (reserved >= maxPages) return false;
        reserved++;
        return true;
    }

    /** 예약했지만 작업을 받지 못했을 때 */
    synchronized void release() {
        if (reserved > completed) reserved--;
    }

    /** @return 완료 후 누적 페이지 수 */
    synchronized int complete() {
        return ++completed;
    }

    int maxPages() {
        return maxPages;
    }
}
