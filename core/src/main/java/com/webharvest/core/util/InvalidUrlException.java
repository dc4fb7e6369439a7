package com.webharvest.core.util;

/** 파싱 불가 또는 http(s)가 아닌 URL. 프론티어 진입 단계에서 거절되며 크롤 자체는 계속된다. */
public class InvalidUrlException extends IllegalArgumentException {

    private final String url;

    public InvalidUrlException(String url, String reason) {
        super("Invalid URL '" + url + "': " + reason);
        this.url = url;
    }

    public String getUrl() { return url; }
}
