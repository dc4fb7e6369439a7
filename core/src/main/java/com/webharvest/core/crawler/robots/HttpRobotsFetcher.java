package com.webharvest.core.crawler.robots;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** java.net.http 기반 robots.txt 조회. 크롤 타임아웃을 그대로 쓴다. */
public final class HttpRobotsFetcher implements RobotsFetcher {
    private final HttpClient client;
    private final String userAgent;
    private final Duration timeout;

    public HttpRobotsFetcher(String userAgent, Duration timeout) {
        // Redirect.NEVER → 저장소가 직접 리다이렉트 판단
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), userAgent, timeout);
    }

    public HttpRobotsFetcher(HttpClient client, String userAgent, Duration timeout) {
        this.client = client;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    @Override
    public Response fetch(URI robotsTxtUri) {
        HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                .GET()
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/plain,*/*;q=0.8")
                .build();
        try {
            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();
            if (code >= 300 && code < 400) {
                URI next = res.headers().firstValue("Location").map(robotsTxtUri::resolve).orElse(null);
                return Response.redirect(code, next);
            }
            return Response.ok(code, res.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted");
        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(e.toString());
        }
    }
}
