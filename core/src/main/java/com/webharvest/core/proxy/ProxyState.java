package com.webharvest.core.proxy;

public enum ProxyState {
    ACTIVE,
    /** 격리됨: 쿨다운 경과 + 프로브 성공 시에만 ACTIVE 로 복귀 */
    DEAD
}
