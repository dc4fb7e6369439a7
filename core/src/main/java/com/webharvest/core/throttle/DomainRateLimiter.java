package com.webharvest.core.throttle;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.util.CrawlClock;
import com.webharvest.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 도메인별 요청 간격 제어기.
 *
 * <p>지연 계산: 도메인 지정값(없으면 base) → 활성 임시 지연과 max → adaptive 면
 * {@code retryFactor^min(failures, 4)} 배 (max 상한) → [min, max] 로 고정.
 * 여기에 {@code [0, randomRange]} 비율의 지터를 더한다.
 *
 * <p>{@link #waitForSlot(String)} 은 도메인 상태 잠금 안에서 다음 슬롯을 예약하고,
 * 실제 대기는 잠금 밖에서 한다. 뒤이은 호출자는 아직 도래하지 않은 예약 시각을 기준으로 기다리므로
 * 같은 도메인의 예약 시각은 단조 증가한다.
 */
public final class DomainRateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(DomainRateLimiter.class);
    private static final int MAX_BACKOFF_EXPONENT = 4;

    /** 도메인 하나의 상태. 해당 객체 모니터로 보호된다. */
    private static final class DomainState {
        long lastRequestAt = -1;     // 예약된 마지막 슬롯(ms), -1 = 첫 요청 전
        int consecutiveFailures;
        double temporaryDelayMs;     // 0 = 없음
        long temporaryExpiresAt;
    }

    private final double baseMs;
    private final double minMs;
    private final double maxMs;
    private final double randomRange;
    private final double retryFactor;
    private final boolean adaptive;
    private final long throttleDurationMs;

    private final Map<String, Double> domainDelays = new ConcurrentHashMap<>();
    private final Map<String, DomainState> states = new ConcurrentHashMap<>();

    private final CrawlClock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public DomainRateLimiter(CrawlConfig.RateLimitCfg cfg, CrawlClock clock, Sleeper sleeper) {
        this(cfg, clock, sleeper, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param random [0,1) 난수 공급자 (테스트에서 고정) */
    public DomainRateLimiter(CrawlConfig.RateLimitCfg cfg, CrawlClock clock, Sleeper sleeper, DoubleSupplier random) {
        Objects.requireNonNull(cfg, "cfg");
        this.minMs = cfg.getMinDelay().toMillis();
        this.maxMs = cfg.getMaxDelay().toMillis();
        this.baseMs = Math.max(cfg.getBaseDelay().toMillis(), minMs);
        this.randomRange = cfg.getRandomRange();
        this.retryFactor = cfg.getRetryFactor();
        this.adaptive = cfg.isAdaptive();
        this.throttleDurationMs = cfg.getThrottleDuration().toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
        cfg.getDomainDelays().forEach((d, v) -> domainDelays.put(key(d), bound(v.toMillis())));
    }

    /**
     * domain 으로 요청을 보내도 될 때까지 블록한다.
     * @return 실제로 기다린 시간
     */
    public Duration waitForSlot(String domain) throws InterruptedException {
        String k = key(domain);
        DomainState st = state(k);
        long waitMs;
        synchronized (st) {
            long now = clock.nowMillis();
            double delay = currentDelayMs(k, st, now);
            double randomized = (randomRange > 0) ? delay * (1 + uniform(0, randomRange)) : delay;

            double wait;
            if (st.lastRequestAt < 0) {
                // 첫 요청은 계산된 지연의 일부만 기다린다
                wait = randomized * uniform(0.2, 0.5);
            } else {
                wait = Math.max(0, randomized - (now - st.lastRequestAt));
            }
            waitMs = Math.round(wait);
            st.lastRequestAt = now + waitMs;
        }
        if (waitMs > 0) {
            LOG.debug("rate limit: waiting {} ms for {}", waitMs, k);
            sleeper.sleep(Duration.ofMillis(waitMs));
        }
        return Duration.ofMillis(waitMs);
    }

    public void reportSuccess(String domain) {
        DomainState st = state(key(domain));
        synchronized (st) {
            st.consecutiveFailures = 0;
            st.temporaryDelayMs = 0;
        }
    }

    /** @param statusCode HTTP 상태, 전송 오류면 -1 */
    public void reportFailure(String domain, int statusCode) {
        String k = key(domain);
        DomainState st = state(k);
        synchronized (st) {
            st.consecutiveFailures++;
            if (statusCode == 429) {
                long now = clock.nowMillis();
                double next = Math.min(currentDelayMs(k, st, now) * retryFactor * 2, maxMs);
                st.temporaryDelayMs = next;
                st.temporaryExpiresAt = now + throttleDurationMs;
                LOG.warn("rate limited by {} (429), delay raised to {} ms for {} ms", k, Math.round(next), throttleDurationMs);
            } else {
                LOG.debug("failure recorded for {} (consecutive: {})", k, st.consecutiveFailures);
            }
        }
    }

    /** 도메인 고정 지연 지정 ([min, max] 로 고정) */
    public void setDomainDelay(String domain, Duration delay) {
        double bounded = bound(delay.toMillis());
        domainDelays.put(key(domain), bounded);
        LOG.info("delay for {} set to {} ms", key(domain), Math.round(bounded));
    }

    /** 만료 시각이 있는 임시 지연. 만료는 다음 계산 때 게으르게 반영된다. */
    public void setTemporaryDelay(String domain, Duration delay, Duration duration) {
        DomainState st = state(key(domain));
        synchronized (st) {
            st.temporaryDelayMs = bound(delay.toMillis());
            st.temporaryExpiresAt = clock.nowMillis() + duration.toMillis();
        }
    }

    /** 현재 적용될 (지터 전) 지연 */
    public Duration currentDelay(String domain) {
        String k = key(domain);
        DomainState st = state(k);
        synchronized (st) {
            return Duration.ofMillis(Math.round(currentDelayMs(k, st, clock.nowMillis())));
        }
    }

    public int consecutiveFailures(String domain) {
        DomainState st = state(key(domain));
        synchronized (st) {
            return st.consecutiveFailures;
        }
    }

    /** 예약 시각/실패 수/임시 지연 초기화. 도메인 지정 지연은 유지. */
    public void reset() {
        states.clear();
        LOG.info("rate limiter reset");
    }

    // ---------- internal ----------

    private double currentDelayMs(String k, DomainState st, long now) {
        double delay = domainDelays.getOrDefault(k, baseMs);
        if (st.temporaryDelayMs > 0) {
            if (now >= st.temporaryExpiresAt) {
                st.temporaryDelayMs = 0;
            } else {
                delay = Math.max(delay, st.temporaryDelayMs);
            }
        }
        if (adaptive && st.consecutiveFailures > 0) {
            double scaled = delay * Math.pow(retryFactor, Math.min(st.consecutiveFailures, MAX_BACKOFF_EXPONENT));
            delay = Math.min(scaled, maxMs);
        }
        return Math.max(minMs, Math.min(delay, maxMs));
    }

    private double bound(double ms) {
        return Math.max(minMs, Math.min(ms, maxMs));
    }

    private double uniform(double lo, double hi) {
        return lo + (hi - lo) * random.getAsDouble();
    }

    private DomainState state(String k) {
        return states.computeIfAbsent(k, x -> new DomainState());
    }

    private static String key(String domain) {
        return (domain == null) ? "" : domain.toLowerCase(Locale.ROOT);
    }
}
