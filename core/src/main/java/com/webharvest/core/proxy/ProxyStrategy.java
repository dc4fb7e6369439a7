package com.webharvest.core.proxy;

import java.util.Locale;

/** 활성 프록시 선택 전략. */
public enum ProxyStrategy {
    ROUND_ROBIN,
    RANDOM,
    FASTEST;

    /** "round-robin", "round_robin", "ROUND_ROBIN" 모두 허용. 모르는 값이면 null. */
    public static ProxyStrategy fromName(String s) {
        if (s == null) return null;
        String k = s.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ProxyStrategy p : values()) {
            if (p.name().equals(k)) return p;
        }
        return null;
    }
}
