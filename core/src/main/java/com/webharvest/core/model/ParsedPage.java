package com.webharvest.core.model;

import java.util.List;
import java.util.Map;

/**
 * 파서 협력자 결과: 추출 필드 + 발견 링크(절대 URL 문자열, 정규화 전).
 */
public record ParsedPage(Map<String, Object> fields, List<String> links) {
    public ParsedPage {
        fields = (fields == null) ? Map.of() : Map.copyOf(fields);
        links = (links == null) ? List.of() : List.copyOf(links);
    }

    public static ParsedPage linksOnly(List<String> links) {
        return new ParsedPage(Map.of(), links);
    }
}
