package com.webharvest.core.crawler;

import com.webharvest.core.model.ParsedPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupPageParserTest {

    private static final String HTML = String.join("\n",
            "<html><head>",
            "<title> Sample Page </title>",
            "<meta name=\"description\" content=\"A test page\">",
            "<link rel=\"canonical\" href=\"/canonical\">",
            "</head><body>",
            "<h1>Main</h1><h2>Sub A</h2><h2>Sub B</h2><h3> </h3>",
            "<p>First paragraph.</p><p></p><p>Second <b>bold</b>.</p>",
            "<a href=\"/a\">a</a>",
            "<a href=\"b?x=1#frag\">b</a>",
            "<a href=\"https://other.test/\">o</a>",
            "<a href=\"/a\">dup</a>",
            "<a href=\"javascript:void(0)\">js</a>",
            "<a href=\"mailto:me@ex.test\">mail</a>",
            "<a href=\"ftp://files.test/x\">ftp</a>",
            "<map><area href=\"/area\"></map>",
            "</body></html>");

    @Test
    @DisplayName("제목/설명/정규 URL/제목 태그/본문 텍스트 추출")
    @SuppressWarnings("unchecked")
    void extracts_fields() {
        ParsedPage p = new JsoupPageParser().parse(HTML, "https://ex.test/dir/page");
        Map<String, Object> f = p.fields();

        assertThat(f).containsEntry("title", "Sample Page")
                .containsEntry("description", "A test page")
                .containsEntry("canonicalUrl", "https://ex.test/canonical")
                .doesNotContainKey("keywords");
        Map<String, List<String>> headings = (Map<String, List<String>>) f.get("headings");
        assertThat(headings.get("h1")).containsExactly("Main");
        assertThat(headings.get("h2")).containsExactly("Sub A", "Sub B");
        assertThat(headings.get("h3")).isEmpty();
        assertThat(f.get("text")).isEqualTo("First paragraph.\nSecond bold.");
        assertThat((Integer) f.get("pageSizeBytes")).isPositive();
    }

    @Test
    @DisplayName("링크: 절대화, http(s)만, 중복 제거, 문서 순서 유지")
    void extracts_links() {
        ParsedPage p = new JsoupPageParser().parse(HTML, "https://ex.test/dir/page");
        assertThat(p.links()).containsExactly(
                "https://ex.test/a",
                "https://ex.test/dir/b?x=1#frag",
                "https://other.test/",
                "https://ex.test/area");
    }

    @Test
    void canonical_defaults_to_page_url() {
        ParsedPage p = new JsoupPageParser().parse("<html><title>x</title></html>", "https://ex.test/");
        assertThat(p.fields()).containsEntry("canonicalUrl", "https://ex.test/");
        assertThat(p.links()).isEmpty();
    }

    @Test
    @DisplayName("<base href> 가 있으면 그것을 기준으로 절대화")
    void base_href_is_honoured() {
        List<String> links = new JsoupLinkExtractor().extract(
                "<html><head><base href=\"https://cdn.test/root/\"></head><body><a href=\"x\">x</a></body></html>",
                "https://ex.test/page");
        assertThat(links).containsExactly("https://cdn.test/root/x");
    }

    @Test
    void extractor_handles_empty_body() {
        assertThat(new JsoupLinkExtractor().extract("", "https://ex.test/")).isEmpty();
        assertThat(new JsoupLinkExtractor().extract(null, "https://ex.test/")).isEmpty();
    }
}
