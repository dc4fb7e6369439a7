package com.webharvest.core.crawler.robots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호스트별 robots 정책 캐시.
 * - 최초 조회 때 한 번만 가져오고 이후 크롤이 끝날 때까지 재조회하지 않는다
 * - 같은 호스트를 동시에 처음 묻는 스레드들은 하나의 조회 결과를 기다려 공유한다
 * - 조회 실패/비 2xx/리다이렉트 초과 → allow-all (fail-open) 으로 캐시
 */
public final class RobotsRepository {

    private static final Logger LOG = LoggerFactory.getLogger(RobotsRepository.class);
    private static final int MAX_REDIRECTS = 3;

    private final RobotsFetcher fetcher;
    private final ConcurrentMap<String, CompletableFuture<RobotsPolicy>> cache = new ConcurrentHashMap<>();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final AtomicInteger unreachableCount = new AtomicInteger();

    public RobotsRepository(RobotsFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /** host:port 키 (포트 없으면 스킴 기본포트). */
    static String cacheKey(URI pageUri) {
        String scheme = Optional.ofNullable(pageUri.getScheme()).orElse("https").toLowerCase(Locale.ROOT);
        String host = Optional.ofNullable(pageUri.getHost()).orElse("").toLowerCase(Locale.ROOT);
        int port = pageUri.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return host + ":" + port;
    }

    public boolean isAllowed(String url, String userAgent) {
        URI u = URI.create(url);
        return policyFor(u).allows(u, userAgent);
    }

    /** pageUri 기준 정책. 첫 호출 스레드만 조회하고 나머지는 그 결과를 기다린다. */
    public RobotsPolicy policyFor(URI pageUri) {
        String key = cacheKey(pageUri);
        CompletableFuture<RobotsPolicy> existing = cache.get(key);
        if (existing == null) {
            CompletableFuture<RobotsPolicy> mine = new CompletableFuture<>();
            existing = cache.putIfAbsent(key, mine);
            if (existing == null) {
                RobotsPolicy p;
                try {
                    p = fetchAndBuildPolicy(pageUri);
                } catch (RuntimeException e) {
                    p = unreachable(key, e.toString());
                }
                mine.complete(p);
                return p;
            }
        }
        return existing.join();
    }

    /** 실제 robots.txt 조회 횟수 (중복 조회 검증용) */
    public int fetchCount() {
        return fetchCount.get();
    }

    /** fail-open 으로 떨어진 호스트 수 */
    public int unreachableCount() {
        return unreachableCount.get();
    }

    private RobotsPolicy fetchAndBuildPolicy(URI pageUri) {
        String key = cacheKey(pageUri);
        URI cur = robotsTxtUri(pageUri);
        if (cur == null) return RobotsPolicy.allowAll();

        for (int i = 0; i <= MAX_REDIRECTS; i++) {
            fetchCount.incrementAndGet();
            RobotsFetcher.Response r = fetcher.fetch(cur);
            int s = r.status();
            if (s == 0) {
                return unreachable(key, r.error());
            }
            if (s >= 200 && s < 300) {
                return RobotsPolicy.parse(r.body());
            }
            if (s >= 300 && s < 400 && r.location() != null) {
                // 동일 호스트 내에서만 따라간다 (스킴 전환 OK)
                if (!sameHost(cur, r.location())) {
                    return unreachable(key, "cross-host redirect to " + r.location());
                }
                cur = r.location();
                continue;
            }
            return unreachable(key, "status " + s);
        }
        return unreachable(key, "too many redirects");
    }

    private RobotsPolicy unreachable(String key, String reason) {
        unreachableCount.incrementAndGet();
        LOG.warn("robots.txt unreachable for {} ({}), allowing all", key, reason);
        return RobotsPolicy.allowAll();
    }

    private static boolean sameHost(URI a, URI b) {
        String ha = Optional.ofNullable(a.getHost()).orElse("");
        String hb = Optional.ofNullable(b.getHost()).orElse("");
        return ha.equalsIgnoreCase(hb);
    }

    private static URI robotsTxtUri(URI page) {
        String host = page.getHost();
        if (host == null || host.isEmpty()) return null;
        String scheme = Optional.ofNullable(page.getScheme()).orElse("https");
        int port = page.getPort();
        String authority = (port < 0) ? host : host + ":" + port;
        return URI.create(scheme + "://" + authority + "/robots.txt");
    }
}
