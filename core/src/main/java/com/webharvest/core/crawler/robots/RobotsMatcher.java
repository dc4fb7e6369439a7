package com.webharvest.core.crawler.robots;

import java.net.URI;
import java.util.regex.Pattern;

/**
 * robots 규칙 매칭:
 * - 대상은 raw path + (있으면) "?" + raw query. 프래그먼트는 무시
 * - 퍼센트 인코딩은 디코드하지 않고 HEX 만 대문자로 통일
 * - 기본은 접두 매칭, '*' 는 임의 길이, 끝의 '$' 는 끝 고정
 */
public final class RobotsMatcher {
    private RobotsMatcher() {}

    static boolean matches(String path, String rule) {
        if (rule == null || rule.isEmpty()) return false;
        boolean anchored = rule.endsWith("$");
        String r = anchored ? rule.substring(0, rule.length() - 1) : rule;

        if (r.indexOf('*') < 0) {
            return anchored ? path.equals(r) : path.startsWith(r);
        }
        StringBuilder regex = new StringBuilder("^");
        int from = 0;
        for (int i = r.indexOf('*'); i >= 0; i = r.indexOf('*', from)) {
            if (i > from) regex.append(Pattern.quote(r.substring(from, i)));
            regex.append(".*");
            from = i + 1;
        }
        if (from < r.length()) regex.append(Pattern.quote(r.substring(from)));
        regex.append(anchored ? "$" : ".*");
        return Pattern.compile(regex.toString(), Pattern.DOTALL).matcher(path).matches();
    }

    /** 룰 값 정규화: trim + 퍼센트 HEX 대문자. '$' 는 보존 */
    static String normalizeRule(String rule) {
        if (rule == null) return "";
        return uppercasePctHex(rule.trim());
    }

    /** 우선순위 길이: 끝 '$' 와 '*' 는 세지 않는다 */
    static int effectiveLen(String rule) {
        int end = rule.endsWith("$") ? rule.length() - 1 : rule.length();
        int n = 0;
        for (int i = 0; i < end; i++) if (rule.charAt(i) != '*') n++;
        return n;
    }

    /** URL → 매칭 대상 문자열 */
    public static String matchTarget(URI uri) {
        String p = uri.getRawPath();
        if (p == null || p.isEmpty()) p = "/";
        String q = uri.getRawQuery();
        return uppercasePctHex(q == null ? p : p + "?" + q);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%')
                   .append(Character.toUpperCase(s.charAt(i + 1)))
                   .append(Character.toUpperCase(s.charAt(i + 2)));
                i += 2;
                continue;
            }
            out.append(ch);
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
