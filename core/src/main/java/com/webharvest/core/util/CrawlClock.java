package com.webharvest.core.util;

/** 테스트에서 시간을 고정하기 위한 벽시계 추상화(epoch millis). */
@FunctionalInterface
public interface CrawlClock {
    long nowMillis();

    CrawlClock SYSTEM = System::currentTimeMillis;
}
