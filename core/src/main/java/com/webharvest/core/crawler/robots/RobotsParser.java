package com.webharvest.core.crawler.robots;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * robots.txt 파서.
 * - 지시어: User-agent / Allow / Disallow (키 대소문자 무시), 그 외 무시
 * - 연속된 User-agent 줄은 하나의 그룹
 * - 그룹 밖 규칙은 '*' 그룹으로
 * - 형식이 깨진 줄은 건너뛴다 (파싱 자체는 실패하지 않음)
 */
public final class RobotsParser {

    static final String UA_ALL = "*";

    private RobotsParser() {}

    /** @return UA(소문자) → 규칙 */
    public static Map<String, RobotsRules> parse(String robotsTxt) {
        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        if (robotsTxt == null) return byUa;

        List<String> group = new ArrayList<>();
        boolean lastWasUa = false;

        for (String raw : robotsTxt.split("\\r?\\n|\\r")) {
            int hash = raw.indexOf('#');
            String line = (hash >= 0 ? raw.substring(0, hash) : raw).trim();
            int colon = line.indexOf(':');
            if (colon <= 0) continue;

            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String val = line.substring(colon + 1).trim();

            if (key.equals("user-agent")) {
                if (!lastWasUa) group = new ArrayList<>();
                String ua = val.isEmpty() ? UA_ALL : val.toLowerCase(Locale.ROOT);
                group.add(ua);
                byUa.computeIfAbsent(ua, k -> new RobotsRules());
                lastWasUa = true;
                continue;
            }
            lastWasUa = false;
            if (!key.equals("allow") && !key.equals("disallow")) continue;

            if (group.isEmpty()) {
                group.add(UA_ALL);
                byUa.computeIfAbsent(UA_ALL, k -> new RobotsRules());
            }
            for (String ua : group) {
                RobotsRules r = byUa.get(ua);
                if (key.equals("allow")) r.addAllow(val); else r.addDisallow(val);
            }
        }
        return byUa;
    }

    /**
     * UA 선택: "WebHarvest/0.1 (+crawler)" → 제품 토큰 "webharvest".
     * 토큰과 같거나 토큰에 포함되는 그룹 중 가장 긴 이름, 없으면 '*'.
     */
    static RobotsRules select(Map<String, RobotsRules> byUa, String userAgent) {
        String token = productToken(userAgent);
        RobotsRules best = null;
        int bestLen = -1;
        for (var e : byUa.entrySet()) {
            String name = e.getKey();
            if (name.equals(UA_ALL)) continue;
            if (!token.isEmpty() && token.contains(name) && name.length() > bestLen) {
                best = e.getValue();
                bestLen = name.length();
            }
        }
        if (best != null) return best;
        RobotsRules star = byUa.get(UA_ALL);
        return (star != null) ? star : new RobotsRules();
    }

    static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String s = userAgent.trim();
        int cut = s.length();
        for (char c : new char[]{'/', ' ', '('}) {
            int i = s.indexOf(c);
            if (i >= 0 && i < cut) cut = i;
        }
        return s.substring(0, cut).toLowerCase(Locale.ROOT);
    }
}
