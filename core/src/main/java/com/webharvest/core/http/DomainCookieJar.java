package com.webharvest.core.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpCookie;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 도메인별 쿠키 저장소. 설정 쿠키 + 응답 Set-Cookie 로 배운 쿠키를 합쳐 돌려준다.
 * 만료/경로 속성은 보지 않는다 (크롤 1회 수명).
 */
public final class DomainCookieJar {

    private static final Logger LOG = LoggerFactory.getLogger(DomainCookieJar.class);

    private final Map<String, String> base;
    private final boolean learn;
    private final Map<String, Map<String, String>> byDomain = new ConcurrentHashMap<>();

    /** @param learn false 면 Set-Cookie 를 무시하고 설정 쿠키만 보낸다 */
    public DomainCookieJar(Map<String, String> configured, boolean learn) {
        this.base = (configured == null) ? Map.of() : Map.copyOf(configured);
        this.learn = learn;
    }

    public Map<String, String> cookiesFor(String domain) {
        Map<String, String> out = new LinkedHashMap<>(base);
        Map<String, String> learned = byDomain.get(key(domain));
        if (learned != null) out.putAll(learned);
        return out;
    }

    /** Set-Cookie 헤더 값들을 domain 에 기록 */
    public void learn(String domain, List<String> setCookieHeaders) {
        if (!learn || setCookieHeaders == null || setCookieHeaders.isEmpty()) return;
        Map<String, String> jar = byDomain.computeIfAbsent(key(domain), k -> new ConcurrentHashMap<>());
        for (String h : setCookieHeaders) {
            try {
                for (HttpCookie c : HttpCookie.parse(h)) {
                    if (c.getMaxAge() == 0) jar.remove(c.getName());
                    else jar.put(c.getName(), c.getValue());
                }
            } catch (IllegalArgumentException e) {
                LOG.debug("ignoring malformed Set-Cookie from {}: {}", domain, h);
            }
        }
    }

    /** "a=1; b=2" */
    public static String header(Map<String, String> cookies) {
        StringBuilder sb = new StringBuilder();
        cookies.forEach((k, v) -> {
            if (sb.length() > 0) sb.append("; ");
            sb.append(k).append('=').append(v);
        });
        return sb.toString();
    }

    private static String key(String domain) {
        return (domain == null) ? "" : domain.toLowerCase(Locale.ROOT);
    }
}
