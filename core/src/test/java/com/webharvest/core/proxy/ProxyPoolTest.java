package com.webharvest.core.proxy;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.util.FrozenClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProxyPoolTest {

    private static final String P1 = "http://10.0.0.1:8080";
    private static final String P2 = "http://10.0.0.2:8080";
    private static final String P3 = "http://10.0.0.3:8080";

    private FrozenClock clock;
    private FakeProber prober;
    private CrawlConfig.ProxyCfg cfg;

    @BeforeEach
    void setUp() {
        clock = new FrozenClock(0);
        prober = new FakeProber().up(P1, 100).up(P2, 300).up(P3, 200);
        cfg = CrawlConfig.defaults().proxy()
                .setProxies(List.of(P1, P2, P3))
                .setMaxFailures(2)
                .setCoolDown(Duration.ofMinutes(1));
    }

    private ProxyPool pool() {
        return new ProxyPool(cfg, prober, clock);
    }

    @Test
    @DisplayName("프록시가 없으면 항상 직접 연결")
    void empty_pool_yields_direct() throws Exception {
        try (ProxyPool p = new ProxyPool(CrawlConfig.defaults().proxy(), prober, clock)) {
            p.start();
            assertThat(p.stats().total()).isZero();
            assertThat(p.acquire(ProxyStrategy.ROUND_ROBIN)).isEmpty();
        }
    }

    @Test
    @DisplayName("중복 설정은 한 번만 등록")
    void duplicates_in_config_are_merged() {
        cfg.setProxies(List.of(P1, P1, " " + P2 + " ", ""));
        assertThat(pool().records()).extracting(ProxyRecord::address).containsExactly(P1, P2);
    }

    @Nested
    @DisplayName("선택 전략")
    class Strategies {

        @Test
        void round_robin_cycles_in_order() throws Exception {
            ProxyPool p = pool();
            List<String> got = new ArrayList<>();
            for (int i = 0; i < 6; i++) got.add(p.acquire(ProxyStrategy.ROUND_ROBIN).orElseThrow());
            assertThat(got).containsExactly(P1, P2, P3, P1, P2, P3);
        }

        @Test
        @DisplayName("FASTEST: 평균 지연이 가장 낮은 활성 프록시")
        void fastest_uses_latency() throws Exception {
            ProxyPool p = pool();
            p.start();
            try {
                assertThat(p.acquire(ProxyStrategy.FASTEST)).contains(P1);
                p.reportFailure(P1);
                p.reportFailure(P1); // 격리
                assertThat(p.acquire(ProxyStrategy.FASTEST)).contains(P3);
            } finally {
                p.close();
            }
        }

        @Test
        @DisplayName("FASTEST: 측정값이 없으면 첫 활성 프록시")
        void fastest_without_measurements_picks_first() throws Exception {
            assertThat(pool().acquire(ProxyStrategy.FASTEST)).contains(P1);
        }

        @Test
        void random_only_returns_active() throws Exception {
            ProxyPool p = pool();
            p.reportFailure(P2);
            p.reportFailure(P2);
            for (int i = 0; i < 30; i++) {
                assertThat(p.acquire(ProxyStrategy.RANDOM).orElseThrow()).isIn(P1, P3);
            }
        }

        @Test
        void acquire_records_last_use() throws Exception {
            ProxyPool p = pool();
            clock.plusMillis(1234);
            p.acquire(ProxyStrategy.ROUND_ROBIN);
            assertThat(p.record(P1).orElseThrow().lastUsedAt()).isEqualTo(1234);
            assertThat(p.record(P2).orElseThrow().lastUsedAt()).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("격리와 복구")
    class Quarantine {

        @Test
        @DisplayName("maxFailures 연속 실패 → 격리, 성공이 끼면 카운트 리셋")
        void quarantines_after_consecutive_failures() throws Exception {
            ProxyPool p = pool();
            p.reportFailure(P1);
            p.reportSuccess(P1, Duration.ofMillis(50));
            p.reportFailure(P1);
            assertThat(p.record(P1).orElseThrow().isActive()).isTrue();

            p.reportFailure(P1);
            assertThat(p.record(P1).orElseThrow().state()).isEqualTo(ProxyState.DEAD);
            assertThat(p.stats().active()).isEqualTo(2);
            assertThat(p.stats().dead()).isEqualTo(1);

            for (int i = 0; i < 4; i++) assertThat(p.acquire(ProxyStrategy.ROUND_ROBIN).orElseThrow()).isNotEqualTo(P1);
        }

        @Test
        @DisplayName("초기 프로브 실패 → 시작부터 격리")
        void initial_probe_failure_quarantines() throws Exception {
            prober.down(P2);
            try (ProxyPool p = pool()) {
                p.start();
                assertThat(p.record(P2).orElseThrow().state()).isEqualTo(ProxyState.DEAD);
                assertThat(p.record(P1).orElseThrow().avgLatencyMs()).isEqualTo(100.0);
            }
        }

        @Test
        @DisplayName("쿨다운 전에는 복구 시도하지 않음, 지나면 헬스체크가 되살린다")
        void health_check_recovers_after_cool_down() throws Exception {
            ProxyPool p = pool();
            p.reportFailure(P1);
            p.reportFailure(P1);
            int before = prober.calls(P1);

            clock.plusMillis(30_000);
            p.runHealthCheck();
            assertThat(prober.calls(P1)).isEqualTo(before);
            assertThat(p.record(P1).orElseThrow().isActive()).isFalse();

            clock.plusMillis(30_000);
            p.runHealthCheck();
            ProxyRecord r = p.record(P1).orElseThrow();
            assertThat(r.isActive()).isTrue();
            assertThat(r.consecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("복구 프로브 실패 → 쿨다운 재시작")
        void failed_recovery_restarts_cool_down() throws Exception {
            ProxyPool p = pool();
            p.reportFailure(P1);
            p.reportFailure(P1);
            prober.down(P1);

            clock.plusMillis(60_000);
            p.runHealthCheck();
            assertThat(p.record(P1).orElseThrow().isActive()).isFalse();

            prober.up(P1, 80);
            clock.plusMillis(59_000);
            p.runHealthCheck();
            assertThat(p.record(P1).orElseThrow().isActive()).isFalse();

            clock.plusMillis(1_000);
            p.runHealthCheck();
            assertThat(p.record(P1).orElseThrow().isActive()).isTrue();
        }

        @Test
        @DisplayName("활성이 하나도 없으면 acquire 가 복구를 시도, 실패하면 직접 연결")
        void acquire_tries_recovery_when_all_dead() throws Exception {
            cfg.setProxies(List.of(P1));
            ProxyPool p = pool();
            p.reportFailure(P1);
            p.reportFailure(P1);

            assertThat(p.acquire(ProxyStrategy.ROUND_ROBIN)).isEmpty(); // 쿨다운 중

            clock.plusMillis(60_000);
            assertThat(p.acquire(ProxyStrategy.ROUND_ROBIN)).contains(P1);
        }

        @Test
        @DisplayName("헬스체크 실패도 실패 카운트에 포함")
        void health_check_failures_count() throws Exception {
            ProxyPool p = pool();
            prober.down(P3);
            p.runHealthCheck();
            assertThat(p.record(P3).orElseThrow().consecutiveFailures()).isEqualTo(1);
            p.runHealthCheck();
            assertThat(p.record(P3).orElseThrow().state()).isEqualTo(ProxyState.DEAD);
        }
    }

    @Test
    @DisplayName("지연 EMA: 0.7×이전 + 0.3×새 값")
    void latency_is_exponential_moving_average() {
        ProxyPool p = pool();
        p.reportSuccess(P1, Duration.ofMillis(100));
        assertThat(p.record(P1).orElseThrow().avgLatencyMs()).isEqualTo(100.0);
        p.reportSuccess(P1, Duration.ofMillis(200));
        assertThat(p.record(P1).orElseThrow().avgLatencyMs()).isCloseTo(130.0, within(0.001));
    }

    @Test
    void stats_cover_measured_active_proxies() throws Exception {
        try (ProxyPool p = pool()) {
            p.start();
            ProxyPoolStats s = p.stats();
            assertThat(s.total()).isEqualTo(3);
            assertThat(s.fastestProxy()).isEqualTo(P1);
            assertThat(s.fastestLatencyMs()).isEqualTo(100.0);
            assertThat(s.slowestProxy()).isEqualTo(P2);
            assertThat(s.averageLatencyMs()).isCloseTo(200.0, within(0.001));
        }
    }

    @Test
    void stats_without_measurements_are_null() {
        ProxyPoolStats s = pool().stats();
        assertThat(s.fastestProxy()).isNull();
        assertThat(s.averageLatencyMs()).isNull();
    }

    @Nested
    @DisplayName("추가/삭제")
    class Management {

        @Test
        void add_requires_successful_probe() throws Exception {
            ProxyPool p = pool();
            String p4 = "http://10.0.0.4:8080";
            assertThat(p.addProxy(p4)).isFalse();
            prober.up(p4, 10);
            assertThat(p.addProxy(p4)).isTrue();
            assertThat(p.addProxy(p4)).isFalse();
            assertThat(p.stats().total()).isEqualTo(4);
        }

        @Test
        void remove_drops_from_rotation() throws Exception {
            ProxyPool p = pool();
            assertThat(p.removeProxy(P2)).isTrue();
            assertThat(p.removeProxy(P2)).isFalse();
            List<String> got = new ArrayList<>();
            for (int i = 0; i < 4; i++) got.add(p.acquire(ProxyStrategy.ROUND_ROBIN).orElseThrow());
            assertThat(got).containsOnly(P1, P3);
        }

        @Test
        void outcome_for_unknown_proxy_is_ignored() {
            ProxyPool p = pool();
            p.reportFailure("http://nope:1");
            p.reportSuccess(null, Duration.ofMillis(1));
            assertThat(p.stats().dead()).isZero();
        }
    }
}
