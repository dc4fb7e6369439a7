package com.webharvest.core.model;

import java.util.Objects;

/** 프론티어에 들어가는 작업 단위: 정규화된 URL + 깊이. */
public record CrawlTask(String url, int depth) {
    public CrawlTask {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public CrawlTask child(String childUrl) {
        return new CrawlTask(childUrl, depth + 1);
    }
}
