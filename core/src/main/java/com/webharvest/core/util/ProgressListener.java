package com.webharvest.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (페이지 예산 대비)
     * @param phase    현재는 "crawl" 만 사용
     * @param done     완료된 페이지 수
     * @param total    페이지 예산(maxPages)
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
