package com.webharvest.core.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Authenticator;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/** testUrl 을 프록시 경유로 GET 해 200 이면 성공. 지연은 요청 왕복 시간. */
public final class HttpProxyProber implements ProxyProber {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProxyProber.class);

    private final URI testUrl;
    private final Duration timeout;
    private final String userAgent;

    public HttpProxyProber(String testUrl, Duration timeout, String userAgent) {
        this.testUrl = URI.create(testUrl);
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public Result probe(String proxy) throws InterruptedException {
        long t0 = System.nanoTime();
        try {
            HttpClient client = viaProxy(HttpClient.newBuilder().connectTimeout(timeout), ProxyAddress.parse(proxy)).build();
            HttpRequest req = HttpRequest.newBuilder(testUrl)
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .build();
            HttpResponse<Void> res = client.send(req, HttpResponse.BodyHandlers.discarding());
            long ms = (System.nanoTime() - t0) / 1_000_000;
            return res.statusCode() == 200 ? Result.ok(ms) : Result.failed(ms);
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("proxy probe failed for {}: {}", ProxyAddress.redact(proxy), e.toString());
            return Result.failed((System.nanoTime() - t0) / 1_000_000);
        }
    }

    /** 빌더에 프록시 경유 설정을 붙인다 (자격 증명이 있으면 Authenticator 포함) */
    public static HttpClient.Builder viaProxy(HttpClient.Builder b, ProxyAddress addr) {
        b.proxy(ProxySelector.of(addr.socketAddress()));
        if (addr.hasCredentials()) {
            b.authenticator(new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    if (getRequestorType() != RequestorType.PROXY) return null;
                    return new PasswordAuthentication(addr.username(), addr.password().toCharArray());
                }
            });
        }
        return b;
    }
}
