package com.webharvest.core.util;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.proxy.ProxyStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    private static CrawlConfig yaml(String s) {
        return YamlConfigLoader.fromStream(new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("전체 키 매핑 (중첩 섹션 포함)")
    void maps_all_sections(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("crawl.yml");
        Files.writeString(file, String.join("\n",
                "seeds: [\"https://a.test/\", \"https://b.test/\"]",
                "maxDepth: 2",
                "maxPages: 40",
                "workers: 3",
                "timeoutMs: 5000",
                "userAgent: \"TestBot/1.0\"",
                "followRedirects: false",
                "respectRobots: false",
                "verifySsl: false",
                "allowedDomains: a.test, b.test",
                "excludePatterns: [\"glob:*/logout*\", \"\\\\.pdf$\"]",
                "headers: { Accept-Language: ko-KR }",
                "cookies: { session: abc }",
                "retry: { count: 1, delayMs: 100 }",
                "rateLimit:",
                "  baseDelayMs: 200",
                "  minDelayMs: 100",
                "  maxDelayMs: 9000",
                "  randomRange: 0",
                "  retryFactor: 3",
                "  adaptive: false",
                "  domainDelays: { slow.test: 4000 }",
                "proxy:",
                "  list: [\"http://10.0.0.1:3128\"]",
                "  strategy: fastest",
                "  maxFailures: 2",
                "cache:",
                "  enabled: true",
                "  expirySeconds: 60",
                "  maxSize: 10",
                "  dir: \"\""));

        CrawlConfig cfg = YamlConfigLoader.load(file);

        assertThat(cfg.getSeeds()).containsExactly("https://a.test/", "https://b.test/");
        assertThat(cfg.getMaxDepth()).isEqualTo(2);
        assertThat(cfg.getMaxPages()).isEqualTo(40);
        assertThat(cfg.getWorkers()).isEqualTo(3);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.getUserAgent()).isEqualTo("TestBot/1.0");
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.isRespectRobots()).isFalse();
        assertThat(cfg.isVerifySsl()).isFalse();
        assertThat(cfg.getAllowedDomains()).containsExactly("a.test", "b.test");
        assertThat(cfg.getExcludePatterns()).containsExactly("glob:*/logout*", "\\.pdf$");
        assertThat(cfg.getHeaders()).containsEntry("Accept-Language", "ko-KR");
        assertThat(cfg.getCookies()).containsEntry("session", "abc");

        assertThat(cfg.retry().getCount()).isEqualTo(1);
        assertThat(cfg.retry().getDelay()).isEqualTo(Duration.ofMillis(100));

        assertThat(cfg.rateLimit().getBaseDelay()).isEqualTo(Duration.ofMillis(200));
        assertThat(cfg.rateLimit().getRandomRange()).isZero();
        assertThat(cfg.rateLimit().getRetryFactor()).isEqualTo(3.0);
        assertThat(cfg.rateLimit().isAdaptive()).isFalse();
        assertThat(cfg.rateLimit().getDomainDelays()).containsEntry("slow.test", Duration.ofSeconds(4));

        assertThat(cfg.proxy().getProxies()).containsExactly("http://10.0.0.1:3128");
        assertThat(cfg.proxy().getStrategy()).isEqualTo(ProxyStrategy.FASTEST);
        assertThat(cfg.proxy().getMaxFailures()).isEqualTo(2);

        assertThat(cfg.cache().getExpiry()).isEqualTo(Duration.ofMinutes(1));
        assertThat(cfg.cache().getMaxSize()).isEqualTo(10);
        assertThat(cfg.cache().getDir()).isNull(); // 메모리 전용
    }

    @Test
    @DisplayName("생략된 키는 기본값 유지")
    void missing_keys_keep_defaults() {
        CrawlConfig cfg = yaml("seeds: https://ex.test/\n");
        CrawlConfig d = CrawlConfig.defaults();

        assertThat(cfg.getSeeds()).isEqualTo(List.of("https://ex.test/"));
        assertThat(cfg.getMaxDepth()).isEqualTo(d.getMaxDepth());
        assertThat(cfg.getWorkers()).isEqualTo(d.getWorkers());
        assertThat(cfg.getUserAgent()).isEqualTo(CrawlConfig.DEFAULT_USER_AGENT);
        assertThat(cfg.proxy().getStrategy()).isEqualTo(ProxyStrategy.ROUND_ROBIN);
        assertThat(cfg.cache().getDir()).isEqualTo(d.cache().getDir());
    }

    @Test
    void unknown_strategy_keeps_default() {
        CrawlConfig cfg = yaml("seeds: [\"https://ex.test/\"]\nproxy: { strategy: fastest-ever }\n");
        assertThat(cfg.proxy().getStrategy()).isEqualTo(ProxyStrategy.ROUND_ROBIN);
    }

    @Test
    @DisplayName("시드 없음 → 시작 시점 설정 오류")
    void no_seeds_fails_validation() {
        assertThatThrownBy(() -> yaml("maxDepth: 1\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("seeds");
    }

    @Test
    void invalid_values_are_rejected() {
        assertThatThrownBy(() -> yaml("seeds: [\"https://ex.test/\"]\nworkers: 0\n"))
                .hasMessageContaining("workers must be >= 1");
        assertThatThrownBy(() -> yaml("seeds: [\"https://ex.test/\"]\nrateLimit: { randomRange: 1.5 }\n"))
                .hasMessageContaining("randomRange");
    }

    @Test
    void missing_file_is_io_error(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("nope.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("crawl.yml not found");
    }

    @Test
    void classpath_sample_loads() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/crawl-sample.yml")) {
            assertThat(in).isNotNull();
            CrawlConfig cfg = YamlConfigLoader.fromStream(in);
            assertThat(cfg.getSeeds()).isNotEmpty();
            assertThat(cfg.getAllowedDomains()).contains("example.com");
        }
    }
}
