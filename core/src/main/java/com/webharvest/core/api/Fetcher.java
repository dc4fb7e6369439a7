package com.webharvest.core.api;

import com.webharvest.core.model.FetchRequest;
import com.webharvest.core.model.FetchResponse;

/**
 * 네트워크 협력자. 전송 오류는 예외 대신 {@link FetchResponse#getError()} 로 돌려준다
 * (TIMEOUT/CONNECTION/SSL 구분이 재시도 판단에 쓰인다).
 */
@FunctionalInterface
public interface Fetcher {
    FetchResponse fetch(FetchRequest request) throws InterruptedException;
}
