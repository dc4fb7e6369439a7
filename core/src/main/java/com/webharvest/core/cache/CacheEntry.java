package com.webharvest.core.cache;

import com.webharvest.core.model.FetchResponse;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * 캐시 항목 (메모리/디스크 공용 DTO). 디스크에는 Jackson 으로 JSON 직렬화된다.
 * checksum 은 본문 CRC32 이며 읽을 때 다시 계산해 부분 기록을 걸러낸다.
 */
public record CacheEntry(int version,
                         String key,
                         String url,
                         Instant timestamp,
                         int statusCode,
                         Map<String, List<String>> headers,
                         String body,
                         long checksum) {

    static final int FORMAT_VERSION = 1;

    static CacheEntry of(String key, String url, Instant timestamp, FetchResponse resp) {
        String body = resp.getBody();
        return new CacheEntry(FORMAT_VERSION, key, url, timestamp, resp.getStatusCode(),
                Map.copyOf(resp.getHeaders()), body, crc(body));
    }

    /** 형식/키/체크섬이 모두 맞는가 */
    boolean isIntact(String expectedKey) {
        return version == FORMAT_VERSION
                && expectedKey.equals(key)
                && timestamp != null
                && body != null
                && checksum == crc(body);
    }

    FetchResponse toResponse() {
        return FetchResponse.builder()
                .url(url)
                .statusCode(statusCode)
                .headers(headers == null ? Map.of() : headers)
                .body(body)
                .fromCache(true)
                .build();
    }

    static long crc(String body) {
        CRC32 c = new CRC32();
        c.update(body.getBytes(StandardCharsets.UTF_8));
        return c.getValue();
    }
}
