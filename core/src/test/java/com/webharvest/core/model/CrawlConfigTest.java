package com.webharvest.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigTest {

    private static CrawlConfig base() {
        return CrawlConfig.defaults().setSeeds(List.of("https://ex.test/"));
    }

    @Test
    @DisplayName("기본값")
    void defaults() {
        CrawlConfig c = CrawlConfig.defaults();
        assertThat(c.getMaxDepth()).isEqualTo(3);
        assertThat(c.getMaxPages()).isEqualTo(100);
        assertThat(c.getWorkers()).isEqualTo(5);
        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(c.isRespectRobots()).isTrue();
        assertThat(c.isVerifySsl()).isTrue();
        assertThat(c.retry().getCount()).isEqualTo(3);
        assertThat(c.rateLimit().getBaseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(c.rateLimit().getMinDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(c.rateLimit().getMaxDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(c.proxy().isEnabled()).isFalse();
        assertThat(c.proxy().getMaxFailures()).isEqualTo(3);
        assertThat(c.cache().getExpiry()).isEqualTo(Duration.ofHours(1));
        assertThat(c.cache().getMaxSize()).isEqualTo(1000);
    }

    @Test
    void valid_config_passes() {
        assertThatCode(() -> base().validate()).doesNotThrowAnyException();
    }

    @Test
    void empty_seeds_rejected() {
        assertThatThrownBy(() -> CrawlConfig.defaults().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("seeds must not be empty");
    }

    @Test
    void numeric_bounds() {
        assertThatThrownBy(() -> base().setMaxDepth(-1).validate()).hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> base().setMaxPages(0).validate()).hasMessageContaining("maxPages");
        assertThatThrownBy(() -> base().setWorkers(0).validate()).hasMessageContaining("workers");
        assertThatThrownBy(() -> base().setTimeout(Duration.ZERO).validate()).hasMessageContaining("timeout");
    }

    @Test
    @DisplayName("maxDepth=0 은 시드만 크롤하는 유효한 설정")
    void depth_zero_is_valid() {
        assertThatCode(() -> base().setMaxDepth(0).validate()).doesNotThrowAnyException();
    }

    @Test
    void rate_limit_bounds() {
        CrawlConfig c = base();
        c.rateLimit().setMinDelay(Duration.ofSeconds(10)).setMaxDelay(Duration.ofSeconds(1));
        assertThatThrownBy(c::validate).hasMessageContaining("minDelay must be <=");

        CrawlConfig r = base();
        r.rateLimit().setRetryFactor(0.5);
        assertThatThrownBy(r::validate).hasMessageContaining("retryFactor");

        CrawlConfig d = base();
        d.rateLimit().setDomainDelays(Map.of("x.test", Duration.ofMillis(-1)));
        assertThatThrownBy(d::validate).hasMessageContaining("domainDelays.x.test");
    }

    @Test
    void proxy_and_cache_bounds() {
        CrawlConfig p = base();
        p.proxy().setMaxFailures(0);
        assertThatThrownBy(p::validate).hasMessageContaining("proxy.maxFailures");

        CrawlConfig c = base();
        c.cache().setMaxSize(0);
        assertThatThrownBy(c::validate).hasMessageContaining("cache.maxSize");
    }

    @Test
    @DisplayName("disable(): 페이싱 없이 (테스트/로컬용)")
    void rate_limit_disable() {
        CrawlConfig c = base();
        c.rateLimit().disable();
        assertThat(c.rateLimit().getBaseDelay()).isZero();
        assertThat(c.rateLimit().getMinDelay()).isZero();
        assertThat(c.rateLimit().getRandomRange()).isZero();
        assertThatCode(c::validate).doesNotThrowAnyException();
    }

    @Test
    void blank_user_agent_falls_back_to_default() {
        assertThat(base().setUserAgent("  ").getUserAgent()).isEqualTo(CrawlConfig.DEFAULT_USER_AGENT);
    }

    @Test
    @DisplayName("문법이 틀린 include/exclude 정규식은 시작 시 거부")
    void broken_url_pattern_fails_validation() {
        assertThatThrownBy(base().setExcludePatterns(List.of("*/logout*"))::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("*/logout*");
        assertThatCode(base().setExcludePatterns(List.of("glob:*/logout*", "/logout"))::validate)
                .doesNotThrowAnyException();
    }
}
