package com.webharvest.core.http;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Retry-After 헤더 해석: 초 단위 정수 또는 HTTP-date. 상한 30초. */
public final class RetryAfter {
    public static final Duration CAP = Duration.ofSeconds(30);

    private RetryAfter() {}

    /**
     * @param nowMillis HTTP-date 일 때 기준 시각
     * @return 해석 불가/과거 시각이면 empty
     */
    public static Optional<Duration> parse(String header, long nowMillis) {
        if (header == null || header.isBlank()) return Optional.empty();
        String v = header.trim();
        try {
            long secs = Long.parseLong(v);
            if (secs < 0) return Optional.empty();
            return Optional.of(cap(Duration.ofSeconds(secs)));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME);
                long ms = at.toInstant().toEpochMilli() - nowMillis;
                return (ms <= 0) ? Optional.empty() : Optional.of(cap(Duration.ofMillis(ms)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
    }

    private static Duration cap(Duration d) {
        return d.compareTo(CAP) > 0 ? CAP : d;
    }
}
