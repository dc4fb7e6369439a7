package com.webharvest.core.proxy;

/** 프록시 헬스 프로브. 네트워크 I/O 이므로 풀 잠금 밖에서만 호출된다. */
@FunctionalInterface
public interface ProxyProber {

    record Result(boolean ok, long latencyMs) {
        public static Result ok(long latencyMs) { return new Result(true, latencyMs); }
        public static Result failed(long latencyMs) { return new Result(false, latencyMs); }
    }

    Result probe(String proxy) throws InterruptedException;
}
