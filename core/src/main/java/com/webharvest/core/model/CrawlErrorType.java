package com.webharvest.core.model;

/** 작업 단위 오류 분류. 어떤 값도 크롤 전체를 중단시키지 않는다. */
public enum CrawlErrorType {
    INVALID_URL,
    ROBOTS_UNREACHABLE,
    FETCH_TIMEOUT,
    CONNECTION_ERROR,
    SSL_ERROR,
    HTTP_ERROR,
    RATE_LIMITED,
    PROXY_FAILURE,
    CACHE_CORRUPTION,
    PARSE_FAILURE,
    UNSUPPORTED_CONTENT,
    /** 작업 처리 중 예기치 못한 런타임 예외 */
    INTERNAL;

    /** 전송 계층 오류 → 결과 오류 분류 */
    public static CrawlErrorType of(FetchError error) {
        if (error == null) return HTTP_ERROR;
        return switch (error) {
            case TIMEOUT -> FETCH_TIMEOUT;
            case CONNECTION -> CONNECTION_ERROR;
            case SSL -> SSL_ERROR;
            case OTHER -> HTTP_ERROR;
        };
    }
}
