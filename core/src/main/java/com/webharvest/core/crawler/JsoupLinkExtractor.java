package com.webharvest.core.crawler;

import com.webharvest.core.api.LinkExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 기본 JSoup 링크 추출기: a[href], area[href] → abs:href (문서의 {@code <base href>} 반영).
 * 파서가 실패했을 때의 대체 경로로도 쓰인다.
 */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public List<String> extract(String body, String baseUrl) {
        if (body == null || body.isEmpty()) return List.of();
        Document doc = Jsoup.parse(body, baseUrl == null ? "" : baseUrl);
        return extract(doc);
    }

    /** 이미 파싱된 문서에서 추출 (순서 유지, 중복 제거) */
    static List<String> extract(Document doc) {
        Set<String> out = new LinkedHashSet<>();
        for (Element a : doc.select("a[href], area[href]")) {
            String href = a.attr("href").trim();
            String lower = href.toLowerCase(Locale.ROOT);
            if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:")) continue;
            String abs = a.attr("abs:href").trim();
            if (abs.isEmpty()) continue;
            String l = abs.toLowerCase(Locale.ROOT);
            if (!l.startsWith("http://") && !l.startsWith("https://")) continue;
            out.add(abs);
        }
        return new ArrayList<>(out);
    }
}
