package com.webharvest.core.api;

import com.webharvest.core.model.CrawlResult;

import java.util.List;

/** 크롤러 최소 계약: 시드에서 시작해 결과 목록을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    List<CrawlResult> crawl() throws InterruptedException;
    @Override default void close() {}
}
