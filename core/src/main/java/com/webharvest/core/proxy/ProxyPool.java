package com.webharvest.core.proxy;

import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.util.CrawlClock;
import com.webharvest.core.util.NamedThreadFactory;
import com.webharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * 프록시 풀: 활성/격리 집합, 실패 카운트, 지연 EMA 관리.
 *
 * <p>상태 변경은 모두 {@code lock} 하나로 직렬화하고, 프로브(네트워크 I/O)는 잠금 밖에서 한다.
 * 프로브 중인 프록시는 {@code probing} 표시로 다른 스레드의 중복 프로브를 막는다.
 *
 * <p>주기 헬스체크는 {@link #start()} 로 시작해 {@link #close()} 로 멈춘다 (크롤 1회 수명).
 */
public final class ProxyPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyPool.class);
    private static final StructuredLog SLOG = StructuredLog.get(ProxyPool.class);
    static final double EMA_OLD = 0.7;
    static final double EMA_NEW = 0.3;

    /** 잠금 안에서만 읽고 쓴다. */
    private static final class Slot {
        final String address;
        ProxyState state = ProxyState.ACTIVE;
        int failures;
        long lastUsedAt = -1;
        double avgLatencyMs = Double.NaN;
        long deadSince;
        boolean probing;

        Slot(String address) { this.address = address; }

        ProxyRecord snapshot() {
            return new ProxyRecord(address, state, failures, lastUsedAt, avgLatencyMs);
        }
    }

    private final Object lock = new Object();
    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final List<String> active = new ArrayList<>();   // 라운드로빈 순서
    private int rrIndex;

    private final int maxFailures;
    private final long coolDownMs;
    private final Duration healthInterval;
    private final ProxyProber prober;
    private final CrawlClock clock;

    private ScheduledExecutorService healthExec;

    public ProxyPool(CrawlConfig.ProxyCfg cfg, ProxyProber prober, CrawlClock clock) {
        Objects.requireNonNull(cfg, "cfg");
        this.maxFailures = cfg.getMaxFailures();
        this.coolDownMs = cfg.getCoolDown().toMillis();
        this.healthInterval = cfg.getHealthCheckInterval();
        this.prober = Objects.requireNonNull(prober, "prober");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (String p : cfg.getProxies()) {
            if (p == null || p.isBlank()) continue;
            String addr = p.trim();
            if (slots.putIfAbsent(addr, new Slot(addr)) == null) active.add(addr);
        }
    }

    // ---------- lifecycle ----------

    /** 등록된 프록시를 모두 한 번 프로브하고 주기 헬스체크를 건다. 프록시가 없으면 아무것도 하지 않는다. */
    public void start() throws InterruptedException {
        List<String> all;
        synchronized (lock) {
            if (slots.isEmpty()) {
                LOG.info("no proxies configured, using direct connections");
                return;
            }
            all = new ArrayList<>(slots.keySet());
        }
        LOG.info("probing {} proxies", all.size());
        for (String p : all) {
            ProxyProber.Result r = prober.probe(p);
            synchronized (lock) {
                Slot s = slots.get(p);
                if (s == null) continue;
                if (r.ok()) {
                    s.avgLatencyMs = r.latencyMs();
                } else {
                    markDead(s, "initial probe failed");
                }
            }
        }
        synchronized (lock) {
            if (active.isEmpty()) LOG.warn("proxy probe complete: no working proxies (dead={})", slots.size());
            else LOG.info("proxy probe complete: active={} dead={}", active.size(), slots.size() - active.size());
            if (healthExec == null) {
                healthExec = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("proxy-health"));
                long ms = healthInterval.toMillis();
                healthExec.scheduleWithFixedDelay(this::healthTick, ms, ms, TimeUnit.MILLISECONDS);
            }
        }
    }

    @Override
    public void close() {
        ScheduledExecutorService ex;
        synchronized (lock) {
            ex = healthExec;
            healthExec = null;
        }
        if (ex != null) ex.shutdownNow();
    }

    private void healthTick() {
        try {
            runHealthCheck();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            // 다음 주기는 계속 돌아야 한다
            LOG.error("proxy health check failed", e);
        }
    }

    // ---------- selection ----------

    /**
     * 전략에 따라 활성 프록시 하나. 활성 집합이 비었으면 쿨다운이 지난 격리 프록시 복구를 먼저 시도한다.
     * @return 쓸 프록시가 없으면 empty (직접 연결)
     */
    public Optional<String> acquire(ProxyStrategy strategy) throws InterruptedException {
        List<String> toRecover;
        synchronized (lock) {
            if (slots.isEmpty()) return Optional.empty();
            if (!active.isEmpty()) return Optional.of(select(strategy));
            toRecover = claimRecoverable();
        }
        probeDead(toRecover);
        synchronized (lock) {
            if (active.isEmpty()) {
                LOG.warn("no active proxies available");
                return Optional.empty();
            }
            return Optional.of(select(strategy));
        }
    }

    private String select(ProxyStrategy strategy) {
        String chosen;
        switch (strategy == null ? ProxyStrategy.ROUND_ROBIN : strategy) {
            case RANDOM -> chosen = active.get(ThreadLocalRandom.current().nextInt(active.size()));
            case FASTEST -> {
                chosen = active.get(0);
                double best = Double.POSITIVE_INFINITY;
                for (String a : active) {
                    double l = slots.get(a).avgLatencyMs;
                    if (!Double.isNaN(l) && l < best) {
                        best = l;
                        chosen = a;
                    }
                }
            }
            default -> {
                rrIndex = rrIndex % active.size();
                chosen = active.get(rrIndex);
                rrIndex = (rrIndex + 1) % active.size();
            }
        }
        slots.get(chosen).lastUsedAt = clock.nowMillis();
        return chosen;
    }

    // ---------- outcome feedback ----------

    /** 실제 요청 성공. latency 가 있으면 EMA 에 반영. */
    public void reportSuccess(String proxy, Duration latency) {
        if (proxy == null) return;
        synchronized (lock) {
            Slot s = slots.get(proxy);
            if (s == null) return;
            s.failures = 0;
            if (latency != null) updateLatency(s, latency.toMillis());
        }
    }

    public void reportFailure(String proxy) {
        if (proxy == null) return;
        synchronized (lock) {
            Slot s = slots.get(proxy);
            if (s == null) return;
            s.failures++;
            LOG.debug("proxy failure reported for {} (failures: {})", ProxyAddress.redact(proxy), s.failures);
            if (s.state == ProxyState.ACTIVE && s.failures >= maxFailures) {
                markDead(s, "request failures");
            }
        }
    }

    // ---------- health check ----------

    /** 활성 프록시 전부 + 쿨다운 지난 격리 프록시를 프로브한다. 스케줄러와 테스트가 호출. */
    public void runHealthCheck() throws InterruptedException {
        List<String> toCheck = new ArrayList<>();
        List<String> toRecover;
        synchronized (lock) {
            for (String a : active) {
                Slot s = slots.get(a);
                if (!s.probing) {
                    s.probing = true;
                    toCheck.add(a);
                }
            }
            toRecover = claimRecoverable();
        }

        for (int i = 0; i < toCheck.size(); i++) {
            String p = toCheck.get(i);
            ProxyProber.Result r;
            try {
                r = prober.probe(p);
            } catch (InterruptedException e) {
                release(toCheck.subList(i, toCheck.size()));
                release(toRecover);
                throw e;
            }
            synchronized (lock) {
                Slot s = slots.get(p);
                if (s == null) continue;
                s.probing = false;
                if (r.ok()) {
                    s.failures = 0;
                    updateLatency(s, r.latencyMs());
                } else {
                    s.failures++;
                    LOG.debug("proxy {} failed health check (failures: {})", ProxyAddress.redact(p), s.failures);
                    if (s.state == ProxyState.ACTIVE && s.failures >= maxFailures) {
                        markDead(s, "health check failures");
                    }
                }
            }
        }
        probeDead(toRecover);
        synchronized (lock) {
            LOG.debug("health check complete: active={} dead={}", active.size(), slots.size() - active.size());
        }
    }

    /** 잠금 안에서 호출: 쿨다운이 지난 격리 프록시를 골라 probing 표시 */
    private List<String> claimRecoverable() {
        long now = clock.nowMillis();
        List<String> out = new ArrayList<>();
        for (Slot s : slots.values()) {
            if (s.state == ProxyState.DEAD && !s.probing && now - s.deadSince >= coolDownMs) {
                s.probing = true;
                out.add(s.address);
            }
        }
        return out;
    }

    private void probeDead(List<String> candidates) throws InterruptedException {
        for (int i = 0; i < candidates.size(); i++) {
            String p = candidates.get(i);
            ProxyProber.Result r;
            try {
                r = prober.probe(p);
            } catch (InterruptedException e) {
                release(candidates.subList(i, candidates.size()));
                throw e;
            }
            synchronized (lock) {
                Slot s = slots.get(p);
                if (s == null) continue;
                s.probing = false;
                if (s.state != ProxyState.DEAD) continue;
                if (r.ok()) {
                    s.state = ProxyState.ACTIVE;
                    s.failures = 0;
                    s.avgLatencyMs = r.latencyMs();
                    active.add(p);
                    LOG.info("proxy {} is back online ({} ms)", ProxyAddress.redact(p), r.latencyMs());
                    SLOG.info("proxy-recovered", "proxy", ProxyAddress.redact(p), "latencyMs", r.latencyMs());
                } else {
                    s.deadSince = clock.nowMillis(); // 쿨다운 다시 시작
                }
            }
        }
    }

    private void release(List<String> addresses) {
        synchronized (lock) {
            for (String p : addresses) {
                Slot s = slots.get(p);
                if (s != null) s.probing = false;
            }
        }
    }

    /** 잠금 안에서 호출 */
    private void markDead(Slot s, String reason) {
        s.state = ProxyState.DEAD;
        s.deadSince = clock.nowMillis();
        active.remove(s.address);
        LOG.warn("proxy {} quarantined after {} failures ({})", ProxyAddress.redact(s.address), s.failures, reason);
        SLOG.warn("proxy-quarantined", "proxy", ProxyAddress.redact(s.address), "failures", s.failures, "reason", reason);
    }

    private static void updateLatency(Slot s, long ms) {
        s.avgLatencyMs = Double.isNaN(s.avgLatencyMs) ? ms : EMA_OLD * s.avgLatencyMs + EMA_NEW * ms;
    }

    // ---------- management ----------

    /** 프로브에 성공한 새 프록시만 추가한다. 이미 있으면 false. */
    public boolean addProxy(String proxy) throws InterruptedException {
        Objects.requireNonNull(proxy, "proxy");
        synchronized (lock) {
            if (slots.containsKey(proxy)) {
                LOG.warn("proxy {} is already in the pool", ProxyAddress.redact(proxy));
                return false;
            }
        }
        ProxyProber.Result r = prober.probe(proxy);
        synchronized (lock) {
            if (slots.containsKey(proxy)) return false;
            if (!r.ok()) {
                LOG.warn("proxy {} not added (probe failed)", ProxyAddress.redact(proxy));
                return false;
            }
            Slot s = new Slot(proxy);
            s.avgLatencyMs = r.latencyMs();
            slots.put(proxy, s);
            active.add(proxy);
            LOG.info("proxy {} added", ProxyAddress.redact(proxy));
            return true;
        }
    }

    public boolean removeProxy(String proxy) {
        synchronized (lock) {
            Slot s = slots.remove(proxy);
            if (s == null) {
                LOG.warn("proxy {} not found in the pool", ProxyAddress.redact(proxy));
                return false;
            }
            active.remove(proxy);
            LOG.info("proxy {} removed", ProxyAddress.redact(proxy));
            return true;
        }
    }

    public Optional<ProxyRecord> record(String proxy) {
        synchronized (lock) {
            Slot s = slots.get(proxy);
            return (s == null) ? Optional.empty() : Optional.of(s.snapshot());
        }
    }

    public List<ProxyRecord> records() {
        synchronized (lock) {
            List<ProxyRecord> out = new ArrayList<>(slots.size());
            for (Slot s : slots.values()) out.add(s.snapshot());
            return out;
        }
    }

    public ProxyPoolStats stats() {
        synchronized (lock) {
            String fastest = null, slowest = null;
            double fastMs = Double.POSITIVE_INFINITY, slowMs = Double.NEGATIVE_INFINITY, sum = 0;
            int measured = 0;
            for (String a : active) {
                double l = slots.get(a).avgLatencyMs;
                if (Double.isNaN(l)) continue;
                measured++;
                sum += l;
                if (l < fastMs) { fastMs = l; fastest = a; }
                if (l > slowMs) { slowMs = l; slowest = a; }
            }
            return new ProxyPoolStats(
                    slots.size(), active.size(), slots.size() - active.size(),
                    fastest, measured > 0 ? fastMs : null,
                    slowest, measured > 0 ? slowMs : null,
                    measured > 0 ? sum / measured : null);
        }
    }
}
