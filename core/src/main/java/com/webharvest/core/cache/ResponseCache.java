package com.webharvest.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webharvest.core.model.CrawlConfig;
import com.webharvest.core.model.FetchResponse;
import com.webharvest.core.util.CrawlClock;
import com.webharvest.core.util.InvalidUrlException;
import com.webharvest.core.util.StructuredLog;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 응답 캐시: 메모리 인덱스 + 디스크 JSON 파일.
 *
 * <ul>
 *   <li>키: 정규화 URL 의 SHA-256 hex, 파일은 {@code <dir>/<key>.json}</li>
 *   <li>조회: 메모리 → 디스크. 만료 항목은 발견 즉시 삭제하고 miss</li>
 *   <li>저장: 200 이고 Cache-Control 에 no-store/no-cache 가 없을 때만. 임시 파일 기록 후 원자적 이동</li>
 *   <li>손상(파싱 실패, 체크섬/키 불일치): 파일 삭제 후 miss</li>
 *   <li>메모리 인덱스는 접근 순서 LRU. maxSize 를 넘으면 가장 오래 안 쓴 것부터 뺀다 (디스크는 유지)</li>
 * </ul>
 */
public final class ResponseCache {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseCache.class);
    private static final StructuredLog SLOG = StructuredLog.get(ResponseCache.class);
    private static final String SUFFIX = ".json";

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final boolean enabled;
    private final long expiryMs;
    private final Duration expiry;
    private final int maxSize;
    private final Path dir;
    private final CrawlClock clock;

    private final Map<String, CacheEntry> memory = new LinkedHashMap<>(16, 0.75f, true); // memory 모니터로 보호
    private final AtomicLong corrupted = new AtomicLong();

    public ResponseCache(CrawlConfig.CacheCfg cfg, CrawlClock clock) {
        Objects.requireNonNull(cfg, "cfg");
        this.enabled = cfg.isEnabled();
        this.expiry = cfg.getExpiry();
        this.expiryMs = expiry.toMillis();
        this.maxSize = cfg.getMaxSize();
        this.dir = cfg.getDir();
        this.clock = Objects.requireNonNull(clock, "clock");
        if (enabled && dir != null) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("cannot create cache dir " + dir, e);
            }
        }
        LOG.info("response cache: enabled={} expiry={}s maxSize={} dir={}",
                enabled, expiry.toSeconds(), maxSize, dir);
    }

    public boolean isEnabled() {
        return enabled;
    }

    // ---------- get / put ----------

    public Optional<FetchResponse> get(String url) {
        if (!enabled) return Optional.empty();
        String key = keyOf(url);
        long now = clock.nowMillis();

        synchronized (memory) {
            CacheEntry e = memory.get(key);
            if (e != null) {
                if (!isExpired(e, now)) {
                    LOG.debug("cache hit (memory): {}", url);
                    return Optional.of(e.toResponse());
                }
                memory.remove(key);
            }
        }
        if (dir == null) return Optional.empty();

        Path file = fileFor(key);
        CacheEntry e = readFile(file, key);
        if (e == null) return Optional.empty();
        if (isExpired(e, now)) {
            deleteQuietly(file);
            LOG.debug("expired cache entry removed: {}", url);
            return Optional.empty();
        }
        synchronized (memory) {
            memory.put(key, e);
            evictOverflow();
        }
        LOG.debug("cache hit (disk): {}", url);
        return Optional.of(e.toResponse());
    }

    /** @return 실제로 저장했으면 true */
    public boolean put(String url, FetchResponse resp) {
        if (!enabled || !isCacheable(resp)) return false;
        String key = keyOf(url);
        CacheEntry e = CacheEntry.of(key, url, Instant.ofEpochMilli(clock.nowMillis()), resp);
        synchronized (memory) {
            memory.put(key, e);
            evictOverflow();
        }
        if (dir != null) writeFile(key, e);
        return true;
    }

    /** 200 이고 no-store/no-cache 가 없는 응답만 */
    public static boolean isCacheable(FetchResponse resp) {
        if (resp == null || resp.isTransportError() || resp.getStatusCode() != 200) return false;
        for (String cc : resp.headers("Cache-Control")) {
            String v = cc.toLowerCase(Locale.ROOT);
            if (v.contains("no-store") || v.contains("no-cache")) return false;
        }
        return true;
    }

    // ---------- maintenance ----------

    /** 만료(와 손상) 항목 제거. @return 제거 수 */
    public int clearExpired() {
        if (!enabled) return 0;
        long now = clock.nowMillis();
        int count = 0;
        synchronized (memory) {
            var it = memory.values().iterator();
            while (it.hasNext()) {
                if (isExpired(it.next(), now)) {
                    it.remove();
                    count++;
                }
            }
        }
        for (Path f : diskFiles()) {
            String key = keyFromFile(f);
            CacheEntry e = readFile(f, key);
            if (e == null) {
                count++;        // 손상 파일은 readFile 이 이미 지웠다
            } else if (isExpired(e, now)) {
                deleteQuietly(f);
                count++;
            }
        }
        LOG.info("cleared {} expired cache entries", count);
        return count;
    }

    public void clear() {
        synchronized (memory) {
            memory.clear();
        }
        for (Path f : diskFiles()) deleteQuietly(f);
        LOG.info("cache cleared");
    }

    public int memorySize() {
        synchronized (memory) {
            return memory.size();
        }
    }

    public CacheStats stats() {
        int files = 0;
        long bytes = 0;
        for (Path f : diskFiles()) {
            try {
                bytes += Files.size(f);
                files++;
            } catch (NoSuchFileException gone) {
                LOG.debug("cache file vanished during stats: {}", f);
            } catch (IOException e) {
                LOG.warn("cannot stat cache file {}: {}", f, e.toString());
            }
        }
        return new CacheStats(enabled, memorySize(), files, bytes, expiry, dir, corrupted.get());
    }

    // ---------- internal ----------

    private boolean isExpired(CacheEntry e, long now) {
        return now - e.timestamp().toEpochMilli() > expiryMs;
    }

    /** memory 잠금 안에서 호출 */
    private void evictOverflow() {
        var it = memory.keySet().iterator();
        while (memory.size() > maxSize && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    /** @return 정상 항목, 없거나 손상이면 null (손상 파일은 삭제) */
    private CacheEntry readFile(Path file, String key) {
        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            LOG.warn("cannot read cache file {}: {}", file, e.toString());
            return null;
        }
        try {
            CacheEntry e = mapper.readValue(raw, CacheEntry.class);
            if (e != null && e.isIntact(key)) return e;
            corrupt(file, "checksum/key mismatch");
        } catch (IOException e) {
            corrupt(file, e.getClass().getSimpleName());
        }
        return null;
    }

    private void corrupt(Path file, String reason) {
        corrupted.incrementAndGet();
        LOG.warn("corrupted cache entry {} removed ({})", file.getFileName(), reason);
        SLOG.warn("cache-corruption", "file", file.getFileName().toString(), "reason", reason);
        deleteQuietly(file);
    }

    private void writeFile(String key, CacheEntry e) {
        Path target = fileFor(key);
        Path tmp = null;
        try {
            byte[] json = mapper.writeValueAsBytes(e);
            tmp = Files.createTempFile(dir, key, ".tmp");
            Files.write(tmp, json);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (JsonProcessingException ex) {
            LOG.warn("cannot serialize cache entry for {}: {}", e.url(), ex.toString());
        } catch (IOException ex) {
            LOG.warn("cannot write cache file for {}: {}", e.url(), ex.toString());
        } finally {
            if (tmp != null) deleteQuietly(tmp);
        }
    }

    private List<Path> diskFiles() {
        if (dir == null || !Files.isDirectory(dir)) return List.of();
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path p : ds) out.add(p);
        } catch (IOException e) {
            LOG.warn("cannot list cache dir {}: {}", dir, e.toString());
        }
        return out;
    }

    private void deleteQuietly(Path f) {
        try {
            Files.deleteIfExists(f);
        } catch (IOException e) {
            LOG.warn("cannot delete cache file {}: {}", f, e.toString());
        }
    }

    private Path fileFor(String key) {
        return dir.resolve(key + SUFFIX);
    }

    private static String keyFromFile(Path f) {
        String n = f.getFileName().toString();
        return n.substring(0, n.length() - SUFFIX.length());
    }

    /** 정규화 URL 의 SHA-256 hex. 정규화가 안 되는 입력은 원문 그대로 해시한다. */
    static String keyOf(String url) {
        String canonical;
        try {
            canonical = UrlUtils.normalize(url);
        } catch (InvalidUrlException e) {
            canonical = url;
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
