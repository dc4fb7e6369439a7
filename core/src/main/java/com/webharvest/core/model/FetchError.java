package com.webharvest.core.model;

/** Fetcher 가 돌려주는 전송 오류 분류 (재시도 판단용). */
public enum FetchError {
    TIMEOUT,
    CONNECTION,
    SSL,
    OTHER;

    /** 프록시 책임으로 볼 수 있는 오류인가 */
    public boolean isTransport() {
        return this != OTHER;
    }
}
