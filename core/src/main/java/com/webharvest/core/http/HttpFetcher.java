package com.webharvest.core.http;

import com.webharvest.core.api.Fetcher;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.FetchError;
import com.webharvest.core.model.FetchRequest;
import com.webharvest.core.model.FetchResponse;
import com.webharvest.core.proxy.HttpProxyProber;
import com.webharvest.core.proxy.ProxyAddress;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.ConnectException;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * java.net.http 기반 기본 Fetcher.
 * 프록시/리다이렉트 조합마다 HttpClient 를 하나씩 만들어 재사용한다.
 * 전송 예외는 던지지 않고 {@link FetchError} 로 분류해 돌려준다.
 */
public final class HttpFetcher implements Fetcher {

    /** 브라우저와 비슷한 기본 헤더. User-Agent 는 설정값으로 덮는다. */
    public static final Map<String, String> DEFAULT_HEADERS;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        m.put("Accept-Language", "en-US,en;q=0.5");
        m.put("Upgrade-Insecure-Requests", "1");
        m.put("Cache-Control", "max-age=0");
        m.put("DNT", "1");
        DEFAULT_HEADERS = Collections.unmodifiableMap(m);
    }

    // HttpClient 가 직접 관리해서 설정하면 IllegalArgumentException 이 나는 헤더
    private static final Set<String> RESTRICTED = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final Duration connectTimeout;
    private final SSLContext sslContext; // null 이면 JDK 기본(검증함)
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    public HttpFetcher(Duration connectTimeout) {
        this(connectTimeout, true);
    }

    /** @param verifySsl false 면 인증서 체인과 호스트명을 검증하지 않는다 */
    public HttpFetcher(Duration connectTimeout, boolean verifySsl) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.sslContext = verifySsl ? null : trustAllContext();
    }

    public boolean isVerifySsl() {
        return sslContext == null;
    }

    /** 기본 헤더 + 설정 헤더 + User-Agent */
    public static Map<String, String> requestHeaders(CrawlConfig cfg) {
        Map<String, String> h = new LinkedHashMap<>(DEFAULT_HEADERS);
        h.putAll(cfg.getHeaders());
        h.put("User-Agent", cfg.getUserAgent());
        return h;
    }

    @Override
    public FetchResponse fetch(FetchRequest request) throws InterruptedException {
        long start = System.nanoTime();
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder(URI.create(request.url()))
                    .timeout(request.timeout())
                    .GET();
            request.headers().forEach((k, v) -> {
                if (!RESTRICTED.contains(k.toLowerCase(Locale.ROOT))) rb.header(k, v);
            });
            if (!request.cookies().isEmpty()) {
                rb.header("Cookie", DomainCookieJar.header(request.cookies()));
            }

            HttpClient client = clientFor(request.proxy(), request.followRedirects());
            HttpResponse<String> resp = client.send(rb.build(), HttpResponse.BodyHandlers.ofString());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            return FetchResponse.builder()
                    .url(resp.uri().toString())
                    .statusCode(resp.statusCode())
                    .headers(resp.headers().map())
                    .body(resp.body() == null ? "" : resp.body())
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (IOException e) {
            return failure(request, classify(e), e, start);
        } catch (IllegalArgumentException e) {
            // 잘못된 URL/헤더/프록시 주소
            return failure(request, FetchError.OTHER, e, start);
        }
    }

    static FetchError classify(IOException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException) return FetchError.TIMEOUT;
            if (t instanceof SSLException) return FetchError.SSL;
            if (t instanceof ConnectException) return FetchError.CONNECTION;
        }
        return FetchError.CONNECTION;
    }

    private static FetchResponse failure(FetchRequest request, FetchError type, Exception e, long start) {
        return FetchResponse.builder()
                .url(request.url())
                .statusCode(-1)
                .error(type, e.toString())
                .responseTimeMs((System.nanoTime() - start) / 1_000_000)
                .build();
    }

    private HttpClient clientFor(String proxy, boolean followRedirects) {
        String key = (proxy == null ? "direct" : proxy) + "|" + followRedirects;
        return clients.computeIfAbsent(key, k -> {
            HttpClient.Builder b = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout)
                    .followRedirects(followRedirects ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER);
            if (proxy != null) HttpProxyProber.viaProxy(b, ProxyAddress.parse(proxy));
            if (sslContext != null) b.sslContext(sslContext);
            return b.build();
        });
    }

    // ---------- verifySsl=false ----------

    /**
     * 모든 인증서를 받아들이는 trust manager. X509ExtendedTrustManager 라서 JDK 의
     * 엔드포인트(호스트명) 확인도 함께 건너뛴다.
     */
    static final X509ExtendedTrustManager TRUST_ALL = new X509ExtendedTrustManager() {
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
        @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
    };

    static SSLContext trustAllContext() {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{TRUST_ALL}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("cannot build trust-all TLS context", e);
        }
    }
}
