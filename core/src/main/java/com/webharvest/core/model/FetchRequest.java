package com.webharvest.core.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fetcher 호출 인자 묶음.
 * @param proxy "http://host:port" 형태, 없으면 직접 연결
 */
public record FetchRequest(String url,
                           String proxy,
                           Map<String, String> cookies,
                           Map<String, String> headers,
                           Duration timeout,
                           boolean followRedirects) {

    public FetchRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(timeout, "timeout");
        cookies = (cookies == null) ? Map.of() : Map.copyOf(cookies);
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
    }

    public Optional<String> proxyOpt() {
        return Optional.ofNullable(proxy);
    }

    public FetchRequest withProxy(String p) {
        return new FetchRequest(url, p, cookies, headers, timeout, followRedirects);
    }
}
