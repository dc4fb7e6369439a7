package com.webharvest.core.model;

import com.webharvest.core.proxy.ProxyStrategy;
import com.webharvest.core.util.UrlFilter;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * 기본값은 {@link #defaults()}, 검증은 {@link #validate()}. 검증 실패만이 크롤 시작을 막는 치명적 오류다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_USER_AGENT = "WebHarvest/0.1 (+crawler)";

    /** YAML `retry:` 섹션 */
    public static final class RetryCfg {
        private int count = 3;                              // 최초 시도 외 재시도 횟수
        private Duration delay = Duration.ofSeconds(2);     // 백오프 기준값

        public int getCount() { return count; }
        public RetryCfg setCount(int v) { this.count = v; return this; }

        public Duration getDelay() { return delay; }
        public RetryCfg setDelay(Duration v) { this.delay = v; return this; }
    }

    /** YAML `rateLimit:` 섹션 */
    public static final class RateLimitCfg {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration minDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double randomRange = 0.5;                   // 지터 비율 [0, 1]
        private double retryFactor = 2.0;
        private boolean adaptive = true;                    // 실패 누적 시 지수 백오프
        private Duration throttleDuration = Duration.ofMinutes(5); // 429 임시 지연 유지 시간
        private Map<String, Duration> domainDelays = new LinkedHashMap<>();

        public Duration getBaseDelay() { return baseDelay; }
        public RateLimitCfg setBaseDelay(Duration v) { this.baseDelay = v; return this; }

        public Duration getMinDelay() { return minDelay; }
        public RateLimitCfg setMinDelay(Duration v) { this.minDelay = v; return this; }

        public Duration getMaxDelay() { return maxDelay; }
        public RateLimitCfg setMaxDelay(Duration v) { this.maxDelay = v; return this; }

        public double getRandomRange() { return randomRange; }
        public RateLimitCfg setRandomRange(double v) { this.randomRange = v; return this; }

        public double getRetryFactor() { return retryFactor; }
        public RateLimitCfg setRetryFactor(double v) { this.retryFactor = v; return this; }

        public boolean isAdaptive() { return adaptive; }
        public RateLimitCfg setAdaptive(boolean v) { this.adaptive = v; return this; }

        public Duration getThrottleDuration() { return throttleDuration; }
        public RateLimitCfg setThrottleDuration(Duration v) { this.throttleDuration = v; return this; }

        public Map<String, Duration> getDomainDelays() { return domainDelays; }
        public RateLimitCfg setDomainDelays(Map<String, Duration> v) {
            this.domainDelays = (v == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(v);
            return this;
        }

        /** 지연 없이 돌리는 설정(테스트/로컬 미러용) */
        public RateLimitCfg disable() {
            this.baseDelay = Duration.ZERO;
            this.minDelay = Duration.ZERO;
            this.randomRange = 0.0;
            return this;
        }
    }

    /** YAML `proxy:` 섹션 */
    public static final class ProxyCfg {
        private List<String> proxies = List.of();
        private ProxyStrategy strategy = ProxyStrategy.ROUND_ROBIN;
        private int maxFailures = 3;
        private Duration healthCheckInterval = Duration.ofMinutes(5);
        private Duration coolDown = Duration.ofMinutes(1);
        private String testUrl = "https://httpbin.org/ip";
        private Duration timeout = Duration.ofSeconds(10);

        public List<String> getProxies() { return proxies; }
        public ProxyCfg setProxies(List<String> v) { this.proxies = (v == null) ? List.of() : List.copyOf(v); return this; }

        public ProxyStrategy getStrategy() { return strategy; }
        public ProxyCfg setStrategy(ProxyStrategy v) { this.strategy = (v == null) ? ProxyStrategy.ROUND_ROBIN : v; return this; }

        public int getMaxFailures() { return maxFailures; }
        public ProxyCfg setMaxFailures(int v) { this.maxFailures = v; return this; }

        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public ProxyCfg setHealthCheckInterval(Duration v) { this.healthCheckInterval = v; return this; }

        public Duration getCoolDown() { return coolDown; }
        public ProxyCfg setCoolDown(Duration v) { this.coolDown = v; return this; }

        public String getTestUrl() { return testUrl; }
        public ProxyCfg setTestUrl(String v) { this.testUrl = v; return this; }

        public Duration getTimeout() { return timeout; }
        public ProxyCfg setTimeout(Duration v) { this.timeout = v; return this; }

        public boolean isEnabled() { return !proxies.isEmpty(); }
    }

    /** YAML `cache:` 섹션 */
    public static final class CacheCfg {
        private boolean enabled = true;
        private Duration expiry = Duration.ofHours(1);
        private int maxSize = 1000;                 // 메모리 인덱스 상한
        private Path dir = Path.of(".cache");       // null 이면 메모리 전용

        public boolean isEnabled() { return enabled; }
        public CacheCfg setEnabled(boolean v) { this.enabled = v; return this; }

        public Duration getExpiry() { return expiry; }
        public CacheCfg setExpiry(Duration v) { this.expiry = v; return this; }

        public int getMaxSize() { return maxSize; }
        public CacheCfg setMaxSize(int v) { this.maxSize = v; return this; }

        public Path getDir() { return dir; }
        public CacheCfg setDir(Path v) { this.dir = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private List<String> seeds = List.of();
    private int maxDepth = 3;
    private int maxPages = 100;
    private int workers = 5;
    private Duration timeout = Duration.ofSeconds(30);
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean followRedirects = true;
    private boolean respectRobots = true;
    private boolean preserveCookies = true;
    private boolean verifySsl = true;

    private List<String> allowedDomains = List.of();
    private List<String> includePatterns = List.of();
    private List<String> excludePatterns = List.of();
    private Map<String, String> headers = new LinkedHashMap<>();
    private Map<String, String> cookies = new LinkedHashMap<>();

    private final RetryCfg retry = new RetryCfg();
    private final RateLimitCfg rateLimit = new RateLimitCfg();
    private final ProxyCfg proxy = new ProxyCfg();
    private final CacheCfg cache = new CacheCfg();

    // ---------- getters ----------
    public List<String> getSeeds() { return seeds; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public int getWorkers() { return workers; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public boolean isRespectRobots() { return respectRobots; }
    public boolean isPreserveCookies() { return preserveCookies; }
    /** false 면 인증서/호스트명 검증 없이 접속 (자체 서명 테스트 서버용) */
    public boolean isVerifySsl() { return verifySsl; }
    public List<String> getAllowedDomains() { return allowedDomains; }
    public List<String> getIncludePatterns() { return includePatterns; }
    public List<String> getExcludePatterns() { return excludePatterns; }
    public Map<String, String> getHeaders() { return headers; }
    public Map<String, String> getCookies() { return cookies; }

    public RetryCfg retry() { return retry; }
    public RateLimitCfg rateLimit() { return rateLimit; }
    public ProxyCfg proxy() { return proxy; }
    public CacheCfg cache() { return cache; }

    // ---------- fluent setters ----------
    public CrawlConfig setSeeds(List<String> v) { this.seeds = (v == null) ? List.of() : List.copyOf(v); return this; }
    public CrawlConfig setMaxDepth(int v) { this.maxDepth = v; return this; }
    public CrawlConfig setMaxPages(int v) { this.maxPages = v; return this; }
    public CrawlConfig setWorkers(int v) { this.workers = v; return this; }
    public CrawlConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public CrawlConfig setUserAgent(String v) { this.userAgent = (v == null || v.isBlank()) ? DEFAULT_USER_AGENT : v; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setRespectRobots(boolean v) { this.respectRobots = v; return this; }
    public CrawlConfig setPreserveCookies(boolean v) { this.preserveCookies = v; return this; }
    public CrawlConfig setVerifySsl(boolean v) { this.verifySsl = v; return this; }
    public CrawlConfig setAllowedDomains(List<String> v) { this.allowedDomains = (v == null) ? List.of() : List.copyOf(v); return this; }
    public CrawlConfig setIncludePatterns(List<String> v) { this.includePatterns = (v == null) ? List.of() : List.copyOf(v); return this; }
    public CrawlConfig setExcludePatterns(List<String> v) { this.excludePatterns = (v == null) ? List.of() : List.copyOf(v); return this; }
    public CrawlConfig setHeaders(Map<String, String> v) { this.headers = (v == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(v); return this; }
    public CrawlConfig setCookies(Map<String, String> v) { this.cookies = (v == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(v); return this; }

    /** 기존 코드 호환용: 밀리초 */
    public long getTimeoutMs() { return timeout.toMillis(); }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(seeds, "seeds");
        if (seeds.isEmpty()) throw new IllegalArgumentException("seeds must not be empty");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        requirePositive(timeout, "timeout");
        Objects.requireNonNull(userAgent, "userAgent");
        new UrlFilter(includePatterns, excludePatterns); // 패턴 문법 확인

        if (retry.getCount() < 0) throw new IllegalArgumentException("retry.count must be >= 0");
        requireNonNegative(retry.getDelay(), "retry.delay");

        requireNonNegative(rateLimit.getBaseDelay(), "rateLimit.baseDelay");
        requireNonNegative(rateLimit.getMinDelay(), "rateLimit.minDelay");
        requireNonNegative(rateLimit.getMaxDelay(), "rateLimit.maxDelay");
        if (rateLimit.getMinDelay().compareTo(rateLimit.getMaxDelay()) > 0)
            throw new IllegalArgumentException("rateLimit.minDelay must be <= rateLimit.maxDelay");
        if (rateLimit.getRandomRange() < 0.0 || rateLimit.getRandomRange() > 1.0)
            throw new IllegalArgumentException("rateLimit.randomRange must be within [0, 1]");
        if (rateLimit.getRetryFactor() < 1.0)
            throw new IllegalArgumentException("rateLimit.retryFactor must be >= 1");
        requireNonNegative(rateLimit.getThrottleDuration(), "rateLimit.throttleDuration");
        rateLimit.getDomainDelays().forEach((d, v) -> requireNonNegative(v, "rateLimit.domainDelays." + d));

        if (proxy.getMaxFailures() < 1) throw new IllegalArgumentException("proxy.maxFailures must be >= 1");
        requirePositive(proxy.getHealthCheckInterval(), "proxy.healthCheckInterval");
        requireNonNegative(proxy.getCoolDown(), "proxy.coolDown");
        requirePositive(proxy.getTimeout(), "proxy.timeout");
        Objects.requireNonNull(proxy.getTestUrl(), "proxy.testUrl");

        requirePositive(cache.getExpiry(), "cache.expiry");
        if (cache.getMaxSize() < 1) throw new IllegalArgumentException("cache.maxSize must be >= 1");
    }

    private static void requirePositive(Duration d, String key) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(key + " must be > 0");
    }

    private static void requireNonNegative(Duration d, String key) {
        if (d == null || d.isNegative())
            throw new IllegalArgumentException(key + " must be >= 0");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
