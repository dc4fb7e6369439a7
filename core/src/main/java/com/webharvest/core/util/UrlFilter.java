package com.webharvest.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * include/exclude URL 패턴 필터.
 * <ul>
 *   <li>기본: 정규식, URL 어디든 일치하면 된다 ({@code find}). 예: {@code "\.pdf$"}, {@code "/blog/\d+"}</li>
 *   <li>{@code "re:"} 접두: 명시적 정규식 (기본과 같다)</li>
 *   <li>{@code "glob:"} 접두: {@code '*'}, {@code '?'} 와일드카드, 대소문자 무시 (예: {@code "glob:*&#47;logout*"})</li>
 *   <li>{@code "prefix:"} 접두: URL 또는 경로 접두 (예: {@code "prefix:/blog"})</li>
 * </ul>
 * include가 비어 있으면 모두 통과, 하나라도 있으면 최소 하나와 일치해야 한다.
 * exclude는 하나라도 일치하면 탈락.
 *
 * @throws IllegalArgumentException 정규식 문법 오류 (설정 오류로 취급)
 */
public final class UrlFilter {

    static final String RE = "re:";
    static final String GLOB = "glob:";
    static final String PREFIX = "prefix:";

    private final List<Predicate<String>> includes;
    private final List<Predicate<String>> excludes;

    public UrlFilter(List<String> includePatterns, List<String> excludePatterns) {
        this.includes = compileAll(includePatterns);
        this.excludes = compileAll(excludePatterns);
    }

    public static UrlFilter acceptAll() {
        return new UrlFilter(List.of(), List.of());
    }

    public boolean accepts(String url) {
        if (url == null) return false;
        if (!includes.isEmpty() && includes.stream().noneMatch(p -> p.test(url))) return false;
        return excludes.stream().noneMatch(p -> p.test(url));
    }

    private static List<Predicate<String>> compileAll(List<String> patterns) {
        List<Predicate<String>> out = new ArrayList<>();
        if (patterns == null) return out;
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;
            out.add(compile(p.trim()));
        }
        return List.copyOf(out);
    }

    static Predicate<String> compile(String p) {
        if (p.startsWith(GLOB)) {
            Pattern rx = Pattern.compile(globToRegex(p.substring(GLOB.length())), Pattern.CASE_INSENSITIVE);
            return s -> rx.matcher(s).find();
        }
        if (p.startsWith(PREFIX)) {
            String prefix = p.substring(PREFIX.length());
            return s -> s.startsWith(prefix) || (prefix.startsWith("/") && pathAndMore(s).startsWith(prefix));
        }
        String regex = p.startsWith(RE) ? p.substring(RE.length()) : p;
        try {
            Pattern rx = Pattern.compile(regex);
            return s -> rx.matcher(s).find();
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid url pattern '" + p + "': " + e.getDescription(), e);
        }
    }

    // "https://host/a?b" → "/a?b"
    private static String pathAndMore(String s) {
        int scheme = s.indexOf("://");
        if (scheme < 0) return s;
        int i = s.indexOf('/', scheme + 3);
        return i > 0 ? s.substring(i) : "/";
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> r.append(".*");
                case '?' -> r.append('.');
                case '.', '\\', '+', '(', ')', '^', '$', '|', '{', '}', '[', ']' -> r.append('\\').append(c);
                default -> r.append(c);
            }
        }
        return r.toString();
    }
}
