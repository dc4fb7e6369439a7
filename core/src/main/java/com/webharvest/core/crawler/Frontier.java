package com.webharvest.core.crawler;

import com.webharvest.core.model.CrawlTask;
import com.webharvest.core.util.InvalidUrlException;
import com.webharvest.core.util.UrlFilter;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * FIFO 작업 큐 + 방문 집합. 새 작업의 허용/거부는 모두 여기서 결정된다.
 *
 * <p>허용 순서: 정규화 → include/exclude → allowedDomains → (빠른) 중복 확인 → robots → 잠금 안에서
 * 방문 표시와 enqueue 를 한 번에. robots 조회는 네트워크 I/O 라 잠금 밖에서 하고, 그 사이 다른 생산자가
 * 먼저 같은 URL 을 넣었으면 최종 단계에서 DUPLICATE 가 된다.
 *
 * <p>{@link #next()} 는 큐가 비었어도 처리 중인 작업이 있으면 자식 링크를 기다리며 블록한다.
 * 큐가 비고 처리 중인 작업도 없거나, {@link #close()} 되었으면 null.
 */
public final class Frontier {

    private static final Logger LOG = LoggerFactory.getLogger(Frontier.class);

    public enum Admission {
        ADMITTED,
        INVALID_URL,
        FILTERED,
        OFF_DOMAIN,
        DUPLICATE,
        ROBOTS_DENIED,
        CLOSED;

        public boolean admitted() { return this == ADMITTED; }
    }

    private final UrlFilter filter;
    private final Set<String> allowedDomains;
    private final Predicate<String> robotsAllows;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Set<String> visited = new HashSet<>();
    private final Deque<CrawlTask> queue = new ArrayDeque<>();
    private int inFlight;
    private boolean closed;

    /**
     * @param allowedDomains 비어 있으면 제한 없음. 호스트 정확 일치(대소문자 무시)
     * @param robotsAllows   정규화 URL → 허용 여부 (robots 미사용이면 항상 true)
     */
    public Frontier(UrlFilter filter, Collection<String> allowedDomains, Predicate<String> robotsAllows) {
        this.filter = (filter == null) ? UrlFilter.acceptAll() : filter;
        Set<String> d = new HashSet<>();
        if (allowedDomains != null) {
            for (String s : allowedDomains) if (s != null && !s.isBlank()) d.add(s.trim().toLowerCase(Locale.ROOT));
        }
        this.allowedDomains = Set.copyOf(d);
        this.robotsAllows = (robotsAllows == null) ? u -> true : robotsAllows;
    }

    /** 원본 URL 을 depth 로 넣어 본다. */
    public Admission offer(String rawUrl, int depth) {
        return admit(rawUrl, depth, true);
    }

    /**
     * 리다이렉트 대상: offer 와 같은 허용 규칙으로 방문 표시만 하고 큐에는 넣지 않는다.
     * 허용되면 호출한 작업이 같은 자리에서 이어서 가져온다.
     */
    public Admission claimRedirect(String rawUrl) {
        return admit(rawUrl, 0, false);
    }

    private Admission admit(String rawUrl, int depth, boolean enqueue) {
        String url;
        try {
            url = UrlUtils.normalize(rawUrl);
        } catch (InvalidUrlException e) {
            LOG.debug("rejected invalid url {}: {}", rawUrl, e.getMessage());
            return Admission.INVALID_URL;
        }
        if (!filter.accepts(url)) return Admission.FILTERED;
        if (!allowedDomains.isEmpty() && !allowedDomains.contains(UrlUtils.domainOf(url))) {
            return Admission.OFF_DOMAIN;
        }
        if (isVisited(url)) return Admission.DUPLICATE;
        if (!robotsAllows.test(url)) {
            LOG.debug("disallowed by robots.txt: {}", url);
            return Admission.ROBOTS_DENIED;
        }
        return claim(new CrawlTask(url, depth), enqueue);
    }

    /** 방문 표시 (+ enqueue) 를 원자적으로. 이미 방문했으면 DUPLICATE. */
    private Admission claim(CrawlTask task, boolean enqueue) {
        lock.lock();
        try {
            if (closed) return Admission.CLOSED;
            if (!visited.add(task.url())) return Admission.DUPLICATE;
            if (enqueue) {
                queue.addLast(task);
                changed.signal();
            }
            return Admission.ADMITTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 다음 작업을 꺼내고 처리 중 카운트를 올린다. 받은 작업은 반드시 {@link #done()} 으로 끝낸다.
     * @return 더 할 일이 없으면 null
     */
    public CrawlTask next() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (closed) return null;
                CrawlTask t = queue.pollFirst();
                if (t != null) {
                    inFlight++;
                    return t;
                }
                if (inFlight == 0) {
                    changed.signalAll(); // 다른 대기자도 종료하도록
                    return null;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public void done() {
        lock.lock();
        try {
            if (inFlight > 0) inFlight--;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** 새 배분 중단. 이미 나간 작업은 계속 진행된다. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isVisited(String normalizedUrl) {
        lock.lock();
        try {
            return visited.contains(normalizedUrl);
        } finally {
            lock.unlock();
        }
    }

    /** 큐에 남아 있는(아직 배분되지 않은) 작업 수 */
    public int pending() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int visitedCount() {
        lock.lock();
        try {
            return visited.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }
}
