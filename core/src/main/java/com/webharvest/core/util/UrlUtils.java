package com.webharvest.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** URL 정규화 + 도메인 추출 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    // RFC 3986 unreserved + reserved. 그 밖의 문자는 인코딩한다.
    private static final String ALLOWED =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~:/?#[]@!$&'()*+,;=";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final Pattern REG_NAME = Pattern.compile("[A-Za-z0-9._~-]+");

    private static final Comparator<String[]> PARAM_ORDER =
            Comparator.<String[], String>comparing(p -> p[0]).thenComparing(p -> p[1]);

    /**
     * 정규화 규칙:
     * - scheme/host 소문자, http/https만 허용
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거
     * - 공백, '|' 같은 URI 금지 문자는 퍼센트 인코딩
     * - 쿼리 파라미터를 key → value 순으로 정렬
     * - 빈 경로는 "/", 루트가 아닌 경로의 끝 슬래시 제거, 중복 슬래시 축소
     *
     * normalize(normalize(u)) == normalize(u) 가 항상 성립한다.
     *
     * @throws InvalidUrlException 파싱 불가, 호스트 없음, http(s)가 아닌 스킴
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) throw new InvalidUrlException(url, "empty");
        return normalize(parse(url)).toString();
    }

    public static URI normalize(URI u) {
        if (u == null) throw new InvalidUrlException(null, "empty");
        String raw = u.toString();
        if (!u.isAbsolute()) throw new InvalidUrlException(raw, "not absolute");

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidUrlException(raw, "unsupported scheme " + scheme);
        }
        Authority a = authority(u);

        int port = a.port();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        StringBuilder sb = new StringBuilder(raw.length());
        sb.append(scheme).append("://");
        if (a.userInfo() != null) sb.append(a.userInfo()).append('@');
        sb.append(a.host());
        if (port >= 0) sb.append(':').append(port);
        sb.append(normalizePath(u.getRawPath()));

        String query = sortQuery(u.getRawQuery());
        if (!query.isEmpty()) sb.append('?').append(query);

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(raw, e.getReason());
        }
    }

    /** 스킴 뒤의 URI 금지 문자(공백, '|', 비 ASCII 등)를 퍼센트 인코딩한 뒤 파싱 */
    static URI parse(String url) {
        String s = url.trim();
        int sep = s.indexOf("://");
        String head = (sep < 0) ? "" : s.substring(0, sep + 3);
        String rest = (sep < 0) ? s : s.substring(sep + 3);
        try {
            return new URI(head + encodeIllegal(rest, sep >= 0));
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(url, e.getReason());
        }
    }

    /**
     * 이미 인코딩된 "%XX" 는 그대로 두므로 두 번 적용해도 결과가 같다.
     * '[' ']' 는 authority(IPv6) 안에서만, '#' 는 처음 한 번만 그대로 둔다.
     */
    static String encodeIllegal(String s, boolean startsInAuthority) {
        StringBuilder sb = null;
        boolean inAuthority = startsInAuthority;
        boolean seenHash = false;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            if (inAuthority && (cp == '/' || cp == '?' || cp == '#')) inAuthority = false;
            boolean keep;
            if (cp == '%') {
                keep = isHex(s, i + 1) && isHex(s, i + 2);
            } else if (cp == '[' || cp == ']') {
                keep = inAuthority;
            } else if (cp == '#') {
                keep = !seenHash;
                seenHash = true;
            } else {
                keep = cp < 0x80 && ALLOWED.indexOf(cp) >= 0;
            }
            if (keep) {
                if (sb != null) sb.appendCodePoint(cp);
            } else {
                if (sb == null) sb = new StringBuilder(s.length() + 16).append(s, 0, i);
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
                }
            }
            i += Character.charCount(cp);
        }
        return (sb == null) ? s : sb.toString();
    }

    private static boolean isHex(String s, int i) {
        return i < s.length() && Character.digit(s.charAt(i), 16) >= 0;
    }

    private record Authority(String userInfo, String host, int port) {}

    /**
     * 서버 기반 authority 로 파싱되지 않는 호스트(예: "my_site.test")는 URI 가 host 를 null 로 준다.
     * 그럴 때는 raw authority 를 직접 나눈다.
     */
    private static Authority authority(URI u) {
        String host = u.getHost();
        if (host != null && !host.isEmpty()) {
            return new Authority(u.getRawUserInfo(), host.toLowerCase(Locale.ROOT), u.getPort());
        }
        String raw = u.getRawAuthority();
        if (raw == null || raw.isEmpty()) throw new InvalidUrlException(u.toString(), "missing host");
        String userInfo = null;
        int at = raw.lastIndexOf('@');
        if (at >= 0) {
            userInfo = raw.substring(0, at);
            raw = raw.substring(at + 1);
        }
        int port = -1;
        int colon = raw.lastIndexOf(':');
        if (colon >= 0) {
            String p = raw.substring(colon + 1);
            raw = raw.substring(0, colon);
            if (!p.isEmpty()) {
                if (!p.chars().allMatch(Character::isDigit) || p.length() > 5) {
                    throw new InvalidUrlException(u.toString(), "bad port " + p);
                }
                port = Integer.parseInt(p);
            }
        }
        if (!REG_NAME.matcher(raw).matches()) throw new InvalidUrlException(u.toString(), "missing host");
        return new Authority(userInfo, raw.toLowerCase(Locale.ROOT), port);
    }

    static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) return "/";
        String p = rawPath.replaceAll("/{2,}", "/");
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p.isEmpty() ? "/" : p;
    }

    /** raw 쿼리 정렬. 빈 세그먼트("a=1&&b=2")는 버리고 값 없는 키는 그대로 둔다. */
    static String sortQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        List<String[]> params = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            params.add(eq < 0
                    ? new String[]{part, "", part}
                    : new String[]{part.substring(0, eq), part.substring(eq + 1), part});
        }
        params.sort(PARAM_ORDER);
        StringBuilder sb = new StringBuilder(rawQuery.length());
        for (String[] p : params) {
            if (sb.length() > 0) sb.append('&');
            sb.append(p[2]);
        }
        return sb.toString();
    }

    /** 소문자 host(포트 제외). 파싱 실패 시 빈 문자열 */
    public static String domainOf(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            return authority(parse(url)).host();
        } catch (InvalidUrlException e) {
            return "";
        }
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameDomain(String a, String b) {
        String da = domainOf(a);
        return !da.isEmpty() && da.equals(domainOf(b));
    }
}
