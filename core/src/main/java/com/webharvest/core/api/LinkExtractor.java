package com.webharvest.core.api;

import java.util.List;

/** 본문에서 절대 http(s) 링크만 뽑는 최소 전략. 예외를 던지지 않는다. */
@FunctionalInterface
public interface LinkExtractor {
    List<String> extract(String body, String baseUrl);
}
