package com.webharvest.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** Fetcher 응답 스냅샷: 상태/헤더/본문, 또는 전송 오류. */
public final class FetchResponse {
    private final String url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final FetchError error;
    private final String errorMessage;
    private final long responseTimeMs;
    private final boolean fromCache;

    private FetchResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.error = b.error;
        this.errorMessage = b.errorMessage;
        this.responseTimeMs = b.responseTimeMs;
        this.fromCache = b.fromCache;
    }

    public String getUrl() { return url; }
    /** 전송 오류면 -1 */
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public FetchError getError() { return error; }
    public String getErrorMessage() { return errorMessage; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public boolean isFromCache() { return fromCache; }

    public boolean isTransportError() { return error != null; }
    public boolean isSuccessful() { return error == null && statusCode >= 200 && statusCode < 300; }
    public boolean isRedirect() { return error == null && statusCode >= 300 && statusCode < 400; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                return (e.getValue() != null) ? e.getValue() : List.of();
            }
        }
        return List.of();
    }

    /** Content-Type 의 미디어 타입 부분(소문자). 헤더가 없으면 null. */
    public String mediaType() {
        String ct = header("Content-Type");
        if (ct == null) return null;
        int semi = ct.indexOf(';');
        return (semi >= 0 ? ct.substring(0, semi) : ct).trim().toLowerCase(Locale.ROOT);
    }

    /** 캐시에서 복원된 사본 */
    public FetchResponse asCached() {
        return toBuilder().fromCache(true).build();
    }

    public Builder toBuilder() {
        return builder().url(url).statusCode(statusCode).headers(headers).body(body)
                .error(error, errorMessage).responseTimeMs(responseTimeMs).fromCache(fromCache);
    }

    public static FetchResponse failure(String url, FetchError error, String message) {
        return builder().url(url).statusCode(-1).error(error, message).build();
    }

    @Override
    public String toString() {
        return "FetchResponse{" + url + ", status=" + statusCode
                + (error != null ? ", error=" + error : "")
                + (fromCache ? ", cached" : "") + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private FetchError error;
        private String errorMessage;
        private long responseTimeMs;
        private boolean fromCache;

        public Builder url(String url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder header(String name, String value) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            if (this.headers != null) this.headers.forEach((k, v) -> copy.put(k, new ArrayList<>(v)));
            copy.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            this.headers = copy;
            return this;
        }
        public Builder body(String body) { this.body = body; return this; }
        public Builder error(FetchError error, String message) { this.error = error; this.errorMessage = message; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder fromCache(boolean fromCache) { this.fromCache = fromCache; return this; }

        public FetchResponse build() {
            Objects.requireNonNull(url, "url");
            return new FetchResponse(this);
        }
    }
}
