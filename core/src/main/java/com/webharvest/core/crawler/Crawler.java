package com.webharvest.core.crawler;

import com.webharvest.core.api.Fetcher;
import com.webharvest.core.api.ICrawler;
import com.webharvest.core.api.LinkExtractor;
import com.webharvest.core.api.PageParser;
import com.webharvest.core.cache.ResponseCache;
import com.webharvest.core.crawler.robots.HttpRobotsFetcher;
import com.webharvest.core.crawler.robots.RobotsFetcher;
import com.webharvest.core.crawler.robots.RobotsRepository;
import com.webharvest.core.http.DefaultRetryPolicy;
import com.webharvest.core.http.HttpFetcher;
import com.webharvest.core.http.RetryAfter;
import com.webharvest.core.http.RetryPolicy;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.CrawlErrorType;
import com.webharvest.core.model.CrawlResult;
import com.webharvest.core.model.CrawlStats;
import com.webharvest.core.model.CrawlTask;
import com.webharvest.core.model.FetchRequest;
import com.webharvest.core.model.FetchResponse;
import com.webharvest.core.model.ParsedPage;
import com.webharvest.core.proxy.HttpProxyProber;
import com.webharvest.core.proxy.ProxyAddress;
import com.webharvest.core.proxy.ProxyPool;
import com.webharvest.core.proxy.ProxyProber;
import com.webharvest.core.throttle.DomainRateLimiter;
import com.webharvest.core.util.CrawlClock;
import com.webharvest.core.util.DefaultSleeper;
import com.webharvest.core.util.InvalidUrlException;
import com.webharvest.core.util.NamedThreadFactory;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.Sleeper;
import com.webharvest.core.util.StructuredLog;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.regex.Pattern;

/**
 * 크롤 코디네이터:
 *  - 시드를 depth 0 으로 프론티어에 넣고, 고정 크기 워커 풀이 프론티어를 비울 때까지 돈다
 *  - 작업당 파이프라인: 캐시 → (레이트 리미터 → 프록시 → Fetcher, 재시도 루프) → 파서 → 자식 링크 허용
 *  - 종료: 프론티어가 비고 모든 워커가 유휴이거나 페이지 예산이 찼을 때. 이미 나간 작업은 끝까지 진행
 *  - 한 작업의 실패는 결과로 남을 뿐 크롤을 멈추지 않는다
 *
 * 기본 구현체(HttpFetcher/JsoupPageParser/HttpRobotsFetcher/HttpProxyProber)는 {@link #Crawler(CrawlConfig)},
 * 테스트/교체용 주입은 {@link #builder(CrawlConfig)}.
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);
    static final int MAX_REDIRECTS = 5;

    private record CustomParser(Pattern pattern, PageParser parser) {}

    private final CrawlConfig config;
    private final Fetcher fetcher;
    private final PageParser parser;
    private final List<CustomParser> customParsers;
    private final LinkExtractor fallbackExtractor;
    private final RobotsFetcher robotsFetcher;
    private final ProxyProber proxyProber;
    private final CrawlClock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final ResponseCache cache;
    private final ProgressListener listener;
    private final Map<String, String> requestHeaders;

    private volatile CrawlStats.Snapshot lastStats;
    private volatile int lastUnclaimed;
    private volatile CrawlContext running;

    /** 기본 구현 */
    public Crawler(CrawlConfig config) {
        this(builder(config));
    }

    private Crawler(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.config.validate();
        Duration timeout = config.getTimeout();
        this.fetcher = (b.fetcher != null) ? b.fetcher : new HttpFetcher(timeout, config.isVerifySsl());
        this.parser = (b.parser != null) ? b.parser : new JsoupPageParser();
        List<CustomParser> cps = new ArrayList<>();
        b.customParsers.forEach((regex, p) -> cps.add(new CustomParser(Pattern.compile(regex), p)));
        this.customParsers = List.copyOf(cps);
        this.fallbackExtractor = (b.fallbackExtractor != null) ? b.fallbackExtractor : new JsoupLinkExtractor();
        this.robotsFetcher = (b.robotsFetcher != null) ? b.robotsFetcher
                : new HttpRobotsFetcher(config.getUserAgent(), timeout);
        this.proxyProber = (b.proxyProber != null) ? b.proxyProber
                : new HttpProxyProber(config.proxy().getTestUrl(), config.proxy().getTimeout(), config.getUserAgent());
        this.clock = (b.clock != null) ? b.clock : CrawlClock.SYSTEM;
        this.sleeper = (b.sleeper != null) ? b.sleeper : new DefaultSleeper();
        this.random = (b.random != null) ? b.random : () -> ThreadLocalRandom.current().nextDouble();
        this.cache = (b.cache != null) ? b.cache : new ResponseCache(config.cache(), clock);
        this.listener = (b.listener != null) ? b.listener : ProgressListener.NONE;
        this.requestHeaders = HttpFetcher.requestHeaders(config);
    }

    public static Builder builder(CrawlConfig config) {
        return new Builder(config);
    }

    // =========================
    // 실행
    // =========================

    @Override
    public List<CrawlResult> crawl() throws InterruptedException {
        final int workers = config.getWorkers();
        LOG.info("Crawl start: seeds={}, maxDepth={}, maxPages={}, workers={}",
                config.getSeeds().size(), config.getMaxDepth(), config.getMaxPages(), workers);
        SLOG.info("crawl-start",
                "seeds", config.getSeeds().size(),
                "maxDepth", config.getMaxDepth(),
                "maxPages", config.getMaxPages(),
                "workers", workers,
                "proxies", config.proxy().getProxies().size(),
                "cache", cache.isEnabled());

        try (CrawlContext ctx = newContext()) {
            running = ctx;
            ctx.proxyPool.start();

            for (String seed : config.getSeeds()) {
                Frontier.Admission a = ctx.frontier.offer(seed, 0);
                if (!a.admitted()) {
                    LOG.warn("seed {} not admitted: {}", seed, a);
                    SLOG.warn("seed-rejected", "url", seed, "reason", a.name());
                }
            }
            ctx.listener.onProgress(0.0, "crawl", 0, config.getMaxPages());

            ExecutorService exec = new ThreadPoolExecutor(
                    workers, workers,
                    0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(),
                    new NamedThreadFactory("crawl-worker"));
            List<Future<?>> futures = new ArrayList<>(workers);
            try {
                for (int i = 0; i < workers; i++) {
                    futures.add(exec.submit(() -> workerLoop(ctx)));
                }
                for (Future<?> f : futures) {
                    try {
                        f.get();
                    } catch (ExecutionException e) {
                        Throwable cause = (e.getCause() != null ? e.getCause() : e);
                        LOG.error("crawl worker died", cause);
                        SLOG.error("worker-died", cause);
                    }
                }
            } catch (InterruptedException ie) {
                ctx.frontier.close();
                exec.shutdownNow();
                throw ie;
            } finally {
                exec.shutdown();
                if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("crawl workers did not stop within 30s");
                    exec.shutdownNow();
                }
            }

            List<CrawlResult> results = ctx.results();
            lastStats = ctx.stats.snapshot();
            lastUnclaimed = ctx.frontier.pending();
            ctx.listener.onProgress(1.0, "crawl", results.size(), config.getMaxPages());

            LOG.info("Crawl done. pages={}, failed={}, cacheHits={}, retries={}, unclaimed={}, maxObservedCC={}",
                    results.size(), lastStats.pagesFailed(), lastStats.cacheHits(), lastStats.retriesTotal(),
                    lastUnclaimed, lastStats.maxObservedConcurrency());
            SLOG.info("crawl-done",
                    "pages", results.size(),
                    "failed", lastStats.pagesFailed(),
                    "fetchAttempts", lastStats.fetchAttempts(),
                    "cacheHits", lastStats.cacheHits(),
                    "unclaimed", lastUnclaimed,
                    "maxObservedCC", lastStats.maxObservedConcurrency());
            return results;
        } finally {
            running = null;
        }
    }

    private CrawlContext newContext() {
        RobotsRepository robots = config.isRespectRobots() ? new RobotsRepository(robotsFetcher) : null;
        return new CrawlContext(
                config,
                new DomainRateLimiter(config.rateLimit(), clock, sleeper, random),
                new ProxyPool(config.proxy(), proxyProber, clock),
                cache,
                robots,
                listener);
    }

    /** 진행 중인 크롤의 새 배분을 멈춘다. 이미 나간 작업은 끝까지 진행. */
    @Override
    public void close() {
        CrawlContext ctx = running;
        if (ctx != null) ctx.frontier.close();
    }

    // =========================
    // 워커
    // =========================

    private void workerLoop(CrawlContext ctx) {
        while (true) {
            // 예산 예약 → 작업 수령 (예약 없이 작업을 꺼내지 않는다)
            if (!ctx.budget.tryReserve()) return;
            CrawlTask task;
            try {
                task = ctx.frontier.next();
            } catch (InterruptedException ie) {
                ctx.budget.release();
                Thread.currentThread().interrupt();
                return;
            }
            if (task == null) {
                ctx.budget.release();
                return;
            }

            int cur = ctx.active.incrementAndGet();
            ctx.stats.observeConcurrency(cur);
            try {
                CrawlResult r;
                try {
                    r = process(ctx, task);
                } catch (RuntimeException e) {
                    LOG.warn("task failed unexpectedly: {}", task.url(), e);
                    SLOG.error("task-failed", e, "url", task.url(), "depth", task.depth());
                    r = CrawlResult.failure(task, -1, CrawlErrorType.INTERNAL, e.toString());
                }
                record(ctx, r);
            } catch (InterruptedException ie) {
                ctx.budget.release();
                ctx.frontier.close();
                Thread.currentThread().interrupt();
                return;
            } finally {
                ctx.active.decrementAndGet();
                ctx.frontier.done();
            }
        }
    }

    private void record(CrawlContext ctx, CrawlResult r) {
        ctx.addResult(r);
        ctx.stats.pageCompleted(!r.isSuccess());
        int n = ctx.budget.complete();
        int max = ctx.budget.maxPages();
        if (r.isSuccess()) {
            LOG.info("Crawled {} (page #{}, depth {}) -> links={}{}", r.getUrl(), n, r.getDepth(),
                    r.getLinks().size(), r.isFromCache() ? " [cache]" : "");
            SLOG.info("page-done", "url", r.getUrl(), "pageNo", n, "depth", r.getDepth(),
                    "status", r.getStatusCode(), "links", r.getLinks().size(), "cached", r.isFromCache());
        } else {
            LOG.warn("Failed {} (page #{}): {} {}", r.getUrl(), n, r.getErrorType(), r.getError());
            SLOG.warn("page-failed", "url", r.getUrl(), "pageNo", n, "depth", r.getDepth(),
                    "error", String.valueOf(r.getErrorType()), "message", String.valueOf(r.getError()));
        }
        try {
            ctx.listener.onProgress(Math.min(1.0, (double) n / max), "crawl", n, max);
        } catch (RuntimeException e) {
            LOG.debug("progress listener threw: {}", e.toString());
        }
    }

    // =========================
    // 작업 1건 파이프라인
    // =========================

    CrawlResult process(CrawlContext ctx, CrawlTask task) throws InterruptedException {
        // 1) 가져오기. followRedirects=false 면 3xx 의 Location 을 같은 작업 안에서 따라간다
        CrawlTask current = task;
        FetchResponse resp;
        for (int hop = 0; ; hop++) {
            Optional<FetchResponse> cached = ctx.cache.get(current.url());
            if (cached.isPresent()) {
                // hit 이면 네트워크/레이트 리미터를 건너뛴다
                ctx.stats.addCacheHit();
                resp = cached.get();
                LOG.debug("cache hit {}", current.url());
            } else {
                FetchOutcome o = fetchWithRetry(ctx, current);
                if (o.failure != null) return o.failure;
                resp = o.response;
            }
            if (!resp.isRedirect()) break;

            String location = resp.header("Location");
            if (location == null || location.isBlank()) {
                return CrawlResult.failure(current, resp.getStatusCode(), CrawlErrorType.HTTP_ERROR,
                        "redirect without Location");
            }
            if (hop >= MAX_REDIRECTS) {
                return CrawlResult.failure(current, resp.getStatusCode(), CrawlErrorType.HTTP_ERROR,
                        "too many redirects (" + MAX_REDIRECTS + ")");
            }
            String target = resolve(current.url(), location);
            Frontier.Admission a = (target != null) ? ctx.frontier.claimRedirect(target) : Frontier.Admission.INVALID_URL;
            if (!a.admitted()) {
                LOG.debug("redirect {} -> {} not followed: {}", current.url(), location, a);
                return CrawlResult.failure(current, resp.getStatusCode(), CrawlErrorType.HTTP_ERROR,
                        "redirect to " + (target != null ? target : location) + " not followed: " + a);
            }
            LOG.info("Following redirect from {} to {}", current.url(), target);
            current = new CrawlTask(UrlUtils.normalize(target), task.depth());
        }
        final String url = current.url();

        if (!resp.isSuccessful()) {
            return CrawlResult.failure(current, resp.getStatusCode(), CrawlErrorType.HTTP_ERROR,
                    "HTTP " + resp.getStatusCode());
        }

        // 2) HTML 만 파싱 (Content-Type 이 없어도 거절)
        String mediaType = resp.mediaType();
        if (mediaType == null || (!mediaType.equals("text/html") && !mediaType.equals("application/xhtml+xml"))) {
            return CrawlResult.failure(current, resp.getStatusCode(), CrawlErrorType.UNSUPPORTED_CONTENT,
                    "not HTML content: " + (mediaType != null ? mediaType : "no content-type"));
        }

        // 3) URL 패턴별 파서 → 기본 파서 → 링크만 회수
        ParsedPage page = null;
        String parseError = null;
        PageParser custom = customParserFor(url);
        if (custom != null) {
            page = tryParse(custom, resp.getBody(), url);
            if (page == null) LOG.warn("custom parser failed for {}, using default parser", url);
        }
        if (page == null) {
            try {
                page = parser.parse(resp.getBody(), url);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                parseError = e.toString();
                LOG.warn("parser failed for {}, falling back to link extraction: {}", url, parseError);
            }
        }
        List<String> rawLinks = (page != null) ? page.links() : fallbackExtractor.extract(resp.getBody(), url);
        List<String> links = normalizeAll(rawLinks);

        // 4) 자식 링크: depth < maxDepth 일 때만
        if (current.depth() < config.getMaxDepth()) {
            for (String link : links) {
                if (!ctx.frontier.offer(link, current.depth() + 1).admitted()) ctx.stats.addRejected();
            }
        }

        boolean fromCache = resp.isFromCache();
        if (page == null) {
            return CrawlResult.salvaged(current, resp.getStatusCode(), links, parseError, fromCache);
        }
        return CrawlResult.success(current, resp.getStatusCode(), new ParsedPage(page.fields(), links), fromCache);
    }

    private PageParser customParserFor(String url) {
        for (CustomParser c : customParsers) {
            if (c.pattern().matcher(url).find()) return c.parser();
        }
        return null;
    }

    /** @return 실패하거나 null 을 돌려주면 null */
    private static ParsedPage tryParse(PageParser p, String body, String url) throws InterruptedException {
        try {
            return p.parse(body, url);
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            LOG.warn("parser {} threw for {}: {}", p.getClass().getSimpleName(), url, e.toString());
            return null;
        }
    }

    /** 반복 재시도 루프. 시도마다 레이트 리미터 대기와 프록시 선택을 새로 한다. */
    private FetchOutcome fetchWithRetry(CrawlContext ctx, CrawlTask task) throws InterruptedException {
        final String url = task.url();
        final String domain = UrlUtils.domainOf(url);
        final RetryPolicy policy = DefaultRetryPolicy.fromRetryCount(
                config.retry().getCount(), config.retry().getDelay());

        for (int attempt = 1; ; attempt++) {
            ctx.rateLimiter.waitForSlot(domain);
            String proxy = ctx.proxyPool.acquire(config.proxy().getStrategy()).orElse(null);

            FetchRequest req = new FetchRequest(url, proxy, ctx.cookies.cookiesFor(domain),
                    requestHeaders, config.getTimeout(), config.isFollowRedirects());
            ctx.stats.addFetchAttempt();
            FetchResponse resp = fetcher.fetch(req);

            int status;
            if (resp.isTransportError()) {
                status = -1;
                if (proxy != null) ctx.proxyPool.reportFailure(proxy);
                ctx.rateLimiter.reportFailure(domain, status);
            } else {
                status = resp.getStatusCode();
                ctx.cookies.learn(domain, resp.headers("Set-Cookie"));
                if (proxy != null) ctx.proxyPool.reportSuccess(proxy, Duration.ofMillis(resp.getResponseTimeMs()));
                if (!DefaultRetryPolicy.isRetryable(status)) {
                    ctx.rateLimiter.reportSuccess(domain);
                    ctx.cache.put(url, resp);
                    return FetchOutcome.ok(resp);
                }
                ctx.rateLimiter.reportFailure(domain, status);
            }

            if (!policy.shouldRetry(status, attempt)) {
                return FetchOutcome.failed(failureFor(task, resp, proxy, attempt));
            }

            Duration backoff = policy.nextDelay(attempt);
            if (!resp.isTransportError()) {
                Optional<Duration> ra = RetryAfter.parse(resp.header("Retry-After"), clock.nowMillis());
                if (ra.isPresent() && ra.get().compareTo(backoff) > 0) backoff = ra.get();
            }
            ctx.stats.addRetry();
            LOG.warn("Error fetching {} ({}{}). Retrying ({}/{}) in {} ms",
                    url, describe(resp), proxy != null ? " via " + ProxyAddress.redact(proxy) : "",
                    attempt, policy.maxAttempts() - 1, backoff.toMillis());
            sleeper.sleep(backoff);
        }
    }

    private static CrawlResult failureFor(CrawlTask task, FetchResponse resp, String proxy, int attempts) {
        String msg = describe(resp) + " after " + attempts + " attempt(s)";
        if (resp.isTransportError()) {
            CrawlErrorType type = (proxy != null) ? CrawlErrorType.PROXY_FAILURE : CrawlErrorType.of(resp.getError());
            return CrawlResult.failure(task, -1, type, msg);
        }
        CrawlErrorType type = (resp.getStatusCode() == 429) ? CrawlErrorType.RATE_LIMITED : CrawlErrorType.HTTP_ERROR;
        return CrawlResult.failure(task, resp.getStatusCode(), type, msg);
    }

    private static String describe(FetchResponse resp) {
        if (resp.isTransportError()) {
            return resp.getError() + (resp.getErrorMessage() != null ? ": " + resp.getErrorMessage() : "");
        }
        return "HTTP " + resp.getStatusCode();
    }

    private static List<String> normalizeAll(List<String> raw) {
        List<String> out = new ArrayList<>(raw.size());
        for (String l : raw) {
            try {
                String n = UrlUtils.normalize(l);
                if (!out.contains(n)) out.add(n);
            } catch (InvalidUrlException e) {
                LOG.debug("dropping invalid link {}: {}", l, e.getMessage());
            }
        }
        return out;
    }

    private static String resolve(String base, String location) {
        try {
            return URI.create(base).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            LOG.debug("bad redirect location {} from {}", location, base);
            return null;
        }
    }

    // =========================
    // 게터
    // =========================

    /** 마지막 크롤의 카운터. 아직 돌지 않았으면 null. */
    public CrawlStats.Snapshot getRuntimeSnapshot() {
        return lastStats;
    }

    /** 마지막 크롤 종료 시 프론티어에 남아 배분되지 않은 작업 수 */
    public int getUnclaimedCount() {
        return lastUnclaimed;
    }

    public ResponseCache getCache() {
        return cache;
    }

    private static final class FetchOutcome {
        final FetchResponse response;
        final CrawlResult failure;

        private FetchOutcome(FetchResponse response, CrawlResult failure) {
            this.response = response;
            this.failure = failure;
        }

        static FetchOutcome ok(FetchResponse r) { return new FetchOutcome(r, null); }
        static FetchOutcome failed(CrawlResult f) { return new FetchOutcome(null, f); }
    }

    // =========================
    // Builder
    // =========================

    public static final class Builder {
        private final CrawlConfig config;
        private Fetcher fetcher;
        private PageParser parser;
        private final Map<String, PageParser> customParsers = new LinkedHashMap<>();
        private LinkExtractor fallbackExtractor;
        private RobotsFetcher robotsFetcher;
        private ProxyProber proxyProber;
        private CrawlClock clock;
        private Sleeper sleeper;
        private DoubleSupplier random;
        private ResponseCache cache;
        private ProgressListener listener;

        private Builder(CrawlConfig config) { this.config = config; }

        public Builder fetcher(Fetcher v) { this.fetcher = v; return this; }
        public Builder parser(PageParser v) { this.parser = v; return this; }
        /**
         * URL 이 정규식과 일치(find)하면 기본 파서 대신 쓴다. 등록 순서대로 처음 일치한 것.
         * 이 파서가 실패하면 기본 파서, 그것도 실패하면 링크만 회수한다.
         */
        public Builder parser(String urlRegex, PageParser v) {
            Pattern.compile(urlRegex); // 문법 오류는 여기서
            this.customParsers.put(urlRegex, Objects.requireNonNull(v, "parser"));
            return this;
        }
        public Builder fallbackExtractor(LinkExtractor v) { this.fallbackExtractor = v; return this; }
        public Builder robotsFetcher(RobotsFetcher v) { this.robotsFetcher = v; return this; }
        public Builder proxyProber(ProxyProber v) { this.proxyProber = v; return this; }
        public Builder clock(CrawlClock v) { this.clock = v; return this; }
        public Builder sleeper(Sleeper v) { this.sleeper = v; return this; }
        /** 레이트 리미터 지터용 [0,1) 난수 */
        public Builder random(DoubleSupplier v) { this.random = v; return this; }
        /** 여러 크롤이 같은 캐시를 쓰게 할 때 */
        public Builder cache(ResponseCache v) { this.cache = v; return this; }
        public Builder listener(ProgressListener v) { this.listener = v; return this; }

        public Crawler build() { return new Crawler(this); }
    }
}
