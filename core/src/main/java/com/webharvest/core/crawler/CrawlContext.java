package com.webharvest.core.crawler;

import com.webharvest.core.cache.ResponseCache;
import com.webharvest.core.crawler.robots.RobotsRepository;
import com.webharvest.core.http.DomainCookieJar;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlResult;
import com.webharvest.core.model.CrawlStats;
import com.webharvest.core.proxy.ProxyPool;
import com.webharvest.core.throttle.DomainRateLimiter;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.UrlFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 크롤 1회분의 공유 상태 묶음. 워커들은 이 객체 하나만 넘겨받는다.
 * 각 구성요소는 자기 잠금을 따로 가지며, 여기서는 결과 목록만 직접 보호한다.
 */
final class CrawlContext implements AutoCloseable {

    final CrawlConfig config;
    final Frontier frontier;
    final PageBudget budget;
    final DomainRateLimiter rateLimiter;
    final ProxyPool proxyPool;
    final ResponseCache cache;
    final RobotsRepository robots;       // respectRobots=false 면 null
    final DomainCookieJar cookies;
    final CrawlStats stats = new CrawlStats();
    final ProgressListener listener;
    final AtomicInteger active = new AtomicInteger();

    private final List<CrawlResult> results = new ArrayList<>();

    CrawlContext(CrawlConfig config,
                 DomainRateLimiter rateLimiter,
                 ProxyPool proxyPool,
                 ResponseCache cache,
                 RobotsRepository robots,
                 ProgressListener listener) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.proxyPool = proxyPool;
        this.cache = cache;
        this.robots = robots;
        this.listener = (listener == null) ? ProgressListener.NONE : listener;
        this.budget = new PageBudget(config.getMaxPages());
        this.cookies = new DomainCookieJar(config.getCookies(), config.isPreserveCookies());
        this.frontier = new Frontier(
                new UrlFilter(config.getIncludePatterns(), config.getExcludePatterns()),
                config.getAllowedDomains(),
                robots == null ? null : url -> robots.isAllowed(url, config.getUserAgent()));
    }

    void addResult(CrawlResult r) {
        synchronized (results) {
            results.add(r);
        }
    }

    List<CrawlResult> results() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    @Override
    public void close() {
        proxyPool.close();
    }
}
