package com.webharvest.core.util;

import java.time.Duration;

/** 대기 추상화. 레이트 리미터/재시도 백오프가 사용하며 테스트에서는 기록용 구현으로 바꾼다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
