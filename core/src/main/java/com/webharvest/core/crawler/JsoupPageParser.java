package com.webharvest.core.crawler;

import com.webharvest.core.api.PageParser;
import com.webharvest.core.model.ParsedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 기본 페이지 파서.
 * 필드: title, description, keywords, canonicalUrl, headings(h1~h6), text(p 본문), pageSizeBytes
 */
public class JsoupPageParser implements PageParser {

    @Override
    public ParsedPage parse(String body, String url) {
        Document doc = Jsoup.parse(body == null ? "" : body, url);

        Map<String, Object> f = new LinkedHashMap<>();
        f.put("title", doc.title().trim());
        putIfPresent(f, "description", meta(doc, "description"));
        putIfPresent(f, "keywords", meta(doc, "keywords"));

        Element canonical = doc.selectFirst("link[rel=canonical][href]");
        f.put("canonicalUrl", canonical != null ? canonical.attr("abs:href") : url);

        Map<String, List<String>> headings = new LinkedHashMap<>();
        for (int i = 1; i <= 6; i++) {
            List<String> hs = new ArrayList<>();
            for (Element h : doc.select("h" + i)) {
                String t = h.text().trim();
                if (!t.isEmpty()) hs.add(t);
            }
            headings.put("h" + i, List.copyOf(hs));
        }
        f.put("headings", headings);

        StringBuilder text = new StringBuilder();
        for (Element p : doc.select("p")) {
            String t = p.text().trim();
            if (t.isEmpty()) continue;
            if (text.length() > 0) text.append('\n');
            text.append(t);
        }
        f.put("text", text.toString());
        f.put("pageSizeBytes", body == null ? 0 : body.getBytes(StandardCharsets.UTF_8).length);

        return new ParsedPage(f, JsoupLinkExtractor.extract(doc));
    }

    private static String meta(Document doc, String name) {
        Element m = doc.selectFirst("meta[name=" + name + "][content]");
        return (m == null) ? null : m.attr("content").trim();
    }

    private static void putIfPresent(Map<String, Object> f, String k, String v) {
        if (v != null && !v.isEmpty()) f.put(k, v);
    }
}
