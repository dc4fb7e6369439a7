package com.webharvest.core.cache;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.FetchError;
import com.webharvest.core.model.FetchResponse;
import com.webharvest.core.util.FrozenClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private static final String URL = "https://ex.test/page?b=2&a=1";

    @TempDir
    Path dir;

    private FrozenClock clock;
    private CrawlConfig.CacheCfg cfg;

    @BeforeEach
    void setUp() {
        clock = new FrozenClock(1_700_000_000_000L);
        cfg = CrawlConfig.defaults().cache()
                .setDir(dir.resolve("cache"))
                .setExpiry(Duration.ofMinutes(10))
                .setMaxSize(100);
    }

    private ResponseCache cache() {
        return new ResponseCache(cfg, clock);
    }

    private static FetchResponse ok(String url, String body) {
        return FetchResponse.builder()
                .url(url)
                .statusCode(200)
                .header("Content-Type", "text/html; charset=utf-8")
                .body(body)
                .build();
    }

    private Path onlyFile() throws Exception {
        try (var s = Files.list(cfg.getDir())) {
            return s.filter(p -> p.toString().endsWith(".json")).findFirst().orElseThrow();
        }
    }

    @Test
    @DisplayName("저장 후 조회: 본문/상태/헤더 보존, fromCache 표시")
    void put_then_get() {
        ResponseCache c = cache();
        assertThat(c.put(URL, ok(URL, "<p>hi</p>"))).isTrue();

        FetchResponse r = c.get(URL).orElseThrow();
        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(r.getBody()).isEqualTo("<p>hi</p>");
        assertThat(r.header("content-type")).startsWith("text/html");
        assertThat(r.isFromCache()).isTrue();
    }

    @Test
    @DisplayName("키는 정규화 URL 기준")
    void key_uses_normalized_url() {
        ResponseCache c = cache();
        c.put(URL, ok(URL, "x"));
        assertThat(c.get("HTTPS://EX.test:443/page?a=1&b=2#top")).isPresent();
        assertThat(ResponseCache.keyOf(URL)).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("디스크 항목은 다음 실행(새 인스턴스)에서도 보인다")
    void survives_new_instance() {
        cache().put(URL, ok(URL, "persisted"));
        ResponseCache next = cache();
        assertThat(next.memorySize()).isZero();
        assertThat(next.get(URL)).map(FetchResponse::getBody).contains("persisted");
        assertThat(next.memorySize()).isEqualTo(1);
    }

    @Nested
    @DisplayName("저장 대상")
    class Cacheability {

        @Test
        void only_200_is_stored() {
            ResponseCache c = cache();
            assertThat(c.put(URL, ok(URL, "x").toBuilder().statusCode(404).build())).isFalse();
            assertThat(c.put(URL, ok(URL, "x").toBuilder().statusCode(301).build())).isFalse();
            assertThat(c.get(URL)).isEmpty();
        }

        @Test
        void no_store_and_no_cache_are_skipped() {
            ResponseCache c = cache();
            assertThat(c.put(URL, ok(URL, "x").toBuilder().header("Cache-Control", "private, no-store").build())).isFalse();
            assertThat(c.put(URL, ok(URL, "x").toBuilder().header("cache-control", "No-Cache").build())).isFalse();
            assertThat(c.put(URL, ok(URL, "x").toBuilder().header("Cache-Control", "max-age=60").build())).isTrue();
        }

        @Test
        void transport_errors_are_not_cacheable() {
            assertThat(ResponseCache.isCacheable(FetchResponse.failure(URL, FetchError.TIMEOUT, "t"))).isFalse();
        }

        @Test
        void disabled_cache_is_a_no_op() {
            cfg.setEnabled(false);
            ResponseCache c = cache();
            assertThat(c.put(URL, ok(URL, "x"))).isFalse();
            assertThat(c.get(URL)).isEmpty();
            assertThat(c.stats().enabled()).isFalse();
        }
    }

    @Nested
    @DisplayName("만료")
    class Expiry {

        @Test
        @DisplayName("expiry 를 넘기면 miss 이고 파일도 지운다")
        void expired_entry_is_miss_and_deleted() throws Exception {
            ResponseCache c = cache();
            c.put(URL, ok(URL, "x"));
            Path f = onlyFile();

            clock.plusMillis(Duration.ofMinutes(10).toMillis());
            assertThat(c.get(URL)).isPresent(); // 경계는 아직 유효

            clock.plusMillis(1);
            assertThat(c.get(URL)).isEmpty();
            assertThat(f).doesNotExist();
        }

        @Test
        void clearExpired_counts_memory_and_disk() {
            ResponseCache c = cache();
            c.put("https://ex.test/old", ok("https://ex.test/old", "o"));
            clock.plusMillis(Duration.ofMinutes(11).toMillis());
            c.put("https://ex.test/new", ok("https://ex.test/new", "n"));

            // 메모리 1 + 디스크 1
            assertThat(c.clearExpired()).isEqualTo(2);
            assertThat(c.get("https://ex.test/new")).isPresent();
            assertThat(c.stats().diskEntries()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("손상 감지")
    class Corruption {

        @Test
        @DisplayName("깨진 JSON → 삭제 후 miss, 카운트 증가")
        void garbage_file_is_removed() throws Exception {
            cache().put(URL, ok(URL, "x"));
            Path f = onlyFile();
            Files.writeString(f, "{\"version\":1,\"key\":");

            ResponseCache c = cache();
            assertThat(c.get(URL)).isEmpty();
            assertThat(f).doesNotExist();
            assertThat(c.stats().corruptedEntries()).isEqualTo(1);
        }

        @Test
        @DisplayName("본문이 바뀌면 체크섬 불일치로 걸러진다")
        void checksum_mismatch_is_detected() throws Exception {
            cache().put(URL, ok(URL, "original body"));
            Path f = onlyFile();
            Files.writeString(f, Files.readString(f).replace("original body", "tampered body"));

            ResponseCache c = cache();
            assertThat(c.get(URL)).isEmpty();
            assertThat(f).doesNotExist();
        }

        @Test
        @DisplayName("다른 URL 의 항목이 이 키 파일에 있으면 손상으로 본다")
        void key_mismatch_is_detected() throws Exception {
            String other = "https://ex.test/other";
            cache().put(other, ok(other, "x"));
            Path otherFile = onlyFile();
            Path target = cfg.getDir().resolve(ResponseCache.keyOf(URL) + ".json");
            Files.move(otherFile, target);

            assertThat(cache().get(URL)).isEmpty();
            assertThat(target).doesNotExist();
        }
    }

    @Test
    @DisplayName("메모리 인덱스는 maxSize 를 넘으면 오래된 것부터 빠진다 (디스크는 유지)")
    void memory_eviction_oldest_first() {
        cfg.setMaxSize(2);
        ResponseCache c = cache();
        for (int i = 0; i < 3; i++) {
            String u = "https://ex.test/p" + i;
            c.put(u, ok(u, "b" + i));
            clock.plusMillis(1000);
        }
        assertThat(c.memorySize()).isEqualTo(2);
        assertThat(c.stats().diskEntries()).isEqualTo(3);
        assertThat(c.get("https://ex.test/p0")).isPresent(); // 디스크에서 복원
    }

    @Test
    @DisplayName("최근에 읽은 항목은 살아남는다 (LRU)")
    void memory_eviction_is_least_recently_used() {
        cfg.setDir(null).setMaxSize(2);
        ResponseCache c = cache();
        c.put("https://ex.test/p0", ok("https://ex.test/p0", "b0"));
        c.put("https://ex.test/p1", ok("https://ex.test/p1", "b1"));
        assertThat(c.get("https://ex.test/p0")).isPresent();

        c.put("https://ex.test/p2", ok("https://ex.test/p2", "b2"));

        assertThat(c.memorySize()).isEqualTo(2);
        assertThat(c.get("https://ex.test/p1")).isEmpty();
        assertThat(c.get("https://ex.test/p0")).isPresent();
        assertThat(c.get("https://ex.test/p2")).isPresent();
    }

    @Test
    @DisplayName("디렉터리 없이 메모리 전용")
    void memory_only_mode() {
        cfg.setDir(null);
        ResponseCache c = cache();
        c.put(URL, ok(URL, "m"));
        assertThat(c.get(URL)).isPresent();
        CacheStats s = c.stats();
        assertThat(s.diskEntries()).isZero();
        assertThat(s.dir()).isNull();
    }

    @Test
    void clear_removes_everything() {
        ResponseCache c = cache();
        c.put(URL, ok(URL, "x"));
        c.clear();
        assertThat(c.memorySize()).isZero();
        assertThat(c.stats().diskEntries()).isZero();
        assertThat(cache().get(URL)).isEqualTo(Optional.empty());
    }

    @Test
    void stats_report_sizes() {
        ResponseCache c = cache();
        c.put(URL, ok(URL, "x"));
        CacheStats s = c.stats();
        assertThat(s.enabled()).isTrue();
        assertThat(s.memoryEntries()).isEqualTo(1);
        assertThat(s.diskEntries()).isEqualTo(1);
        assertThat(s.diskBytes()).isPositive();
        assertThat(s.expiry()).isEqualTo(Duration.ofMinutes(10));
    }
}
