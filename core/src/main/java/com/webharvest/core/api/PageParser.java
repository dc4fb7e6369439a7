package com.webharvest.core.api;

import com.webharvest.core.model.ParsedPage;

/** 본문 → 구조화 필드 + 링크. 실패 시 예외를 던지면 링크 전용 추출로 대체된다. */
@FunctionalInterface
public interface PageParser {
    ParsedPage parse(String body, String url) throws Exception;
}
