package com.webharvest.core.util;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.proxy.ProxyStrategy;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * seeds: ["https://example.com/"]     # 또는 "a,b,c"
 * maxDepth: 3
 * maxPages: 100
 * workers: 5
 * timeoutMs: 30000
 * userAgent: "WebHarvest/0.1 (+crawler)"
 * followRedirects: true
 * respectRobots: true
 * preserveCookies: true
 * verifySsl: true
 * allowedDomains: ["example.com"]
 * includePatterns: []                 # 정규식(기본) | glob:... | prefix:...
 * excludePatterns: []
 * headers: { Accept-Language: "ko-KR" }
 * cookies: { session: "abc" }
 *
 * retry:
 *   count: 3
 *   delayMs: 2000
 * rateLimit:
 *   baseDelayMs: 1000
 *   minDelayMs: 500
 *   maxDelayMs: 60000
 *   randomRange: 0.5
 *   retryFactor: 2
 *   adaptive: true
 *   throttleDurationMs: 300000
 *   domainDelays: { "slow.example.com": 5000 }
 * proxy:
 *   list: ["http://10.0.0.1:8080"]
 *   strategy: round-robin            # random | fastest
 *   maxFailures: 3
 *   healthCheckIntervalMs: 300000
 *   coolDownMs: 60000
 *   testUrl: "https://httpbin.org/ip"
 *   timeoutMs: 10000
 * cache:
 *   enabled: true
 *   expirySeconds: 3600
 *   maxSize: 1000
 *   dir: ".cache"                     # 빈 문자열이면 메모리 전용
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    /** 스트림에서 읽기. 마지막에 validate() 수행. */
    public static CrawlConfig fromStream(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();
        if (root instanceof Map<?, ?> map) {
            apply(map, cfg);
        }
        // 시드가 없으면 여기서 실패 (시작 시점의 유일한 치명 오류)
        cfg.validate();
        return cfg;
    }

    private static void apply(Map<?, ?> map, CrawlConfig cfg) {
        // 1) 평면 키
        setStringList(map, "seeds", cfg::setSeeds);
        setInt(map, "maxDepth", cfg::setMaxDepth);
        setInt(map, "maxPages", cfg::setMaxPages);
        setInt(map, "workers", cfg::setWorkers);
        setMs(map, "timeoutMs", cfg::setTimeout);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setBoolean(map, "respectRobots", cfg::setRespectRobots);
        setBoolean(map, "verifySsl", cfg::setVerifySsl);
        setBoolean(map, "preserveCookies", cfg::setPreserveCookies);
        setStringList(map, "allowedDomains", cfg::setAllowedDomains);
        setStringList(map, "includePatterns", cfg::setIncludePatterns);
        setStringList(map, "excludePatterns", cfg::setExcludePatterns);
        setStringMap(map, "headers", cfg::setHeaders);
        setStringMap(map, "cookies", cfg::setCookies);

        // 2) retry.*
        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            var r = cfg.retry();
            setInt(retry, "count", r::setCount);
            setMs(retry, "delayMs", r::setDelay);
        }

        // 3) rateLimit.*
        Map<String, Object> rl = getMap(map, "rateLimit");
        if (rl != null) {
            var r = cfg.rateLimit();
            setMs(rl, "baseDelayMs", r::setBaseDelay);
            setMs(rl, "minDelayMs", r::setMinDelay);
            setMs(rl, "maxDelayMs", r::setMaxDelay);
            setDouble(rl, "randomRange", r::setRandomRange);
            setDouble(rl, "retryFactor", r::setRetryFactor);
            setBoolean(rl, "adaptive", r::setAdaptive);
            setMs(rl, "throttleDurationMs", r::setThrottleDuration);
            Map<String, Object> dd = getMap(rl, "domainDelays");
            if (dd != null) {
                Map<String, Duration> delays = new LinkedHashMap<>();
                dd.forEach((k, v) -> {
                    if (k != null && v != null) delays.put(String.valueOf(k), Duration.ofMillis(toLong(v)));
                });
                r.setDomainDelays(delays);
            }
        }

        // 4) proxy.*
        Map<String, Object> px = getMap(map, "proxy");
        if (px != null) {
            var p = cfg.proxy();
            setStringList(px, "list", p::setProxies);
            setString(px, "strategy", s -> {
                ProxyStrategy st = ProxyStrategy.fromName(s);
                if (st != null) p.setStrategy(st); // 오타면 기본값 유지
            });
            setInt(px, "maxFailures", p::setMaxFailures);
            setMs(px, "healthCheckIntervalMs", p::setHealthCheckInterval);
            setMs(px, "coolDownMs", p::setCoolDown);
            setString(px, "testUrl", p::setTestUrl);
            setMs(px, "timeoutMs", p::setTimeout);
        }

        // 5) cache.*
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            var c = cfg.cache();
            setBoolean(cache, "enabled", c::setEnabled);
            setInt(cache, "expirySeconds", s -> c.setExpiry(Duration.ofSeconds(s)));
            setInt(cache, "maxSize", c::setMaxSize);
            if (cache.containsKey("dir")) {
                Object d = cache.get("dir");
                String s = (d == null) ? "" : String.valueOf(d).trim();
                c.setDir(s.isEmpty() ? null : Path.of(s));
            }
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setStringMap(Map<?, ?> map, String key, Consumer<Map<String, String>> setter) {
        Map<String, Object> m = getMap(map, key);
        if (m == null) return;
        Map<String, String> out = new LinkedHashMap<>();
        m.forEach((k, v) -> {
            if (k != null && v != null) out.put(String.valueOf(k), String.valueOf(v));
        });
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    /** 밀리초 숫자 → Duration. 음수도 그대로 넘겨 validate() 가 거르게 한다. */
    private static void setMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Duration.ofMillis(toLong(v)));
    }

    private static long toLong(Object v) {
        if (v instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(v).trim());
    }
}
