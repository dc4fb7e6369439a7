package com.webharvest.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 작업 하나의 최종 결과 (불변).
 * 성공이라도 파싱 실패로 링크만 건진 경우 {@code errorType == PARSE_FAILURE} 가 함께 남는다.
 */
public final class CrawlResult {
    private final String url;
    private final int depth;
    private final CrawlStatus status;
    private final int statusCode;
    private final CrawlErrorType errorType;
    private final String error;
    private final Map<String, Object> fields;
    private final List<String> links;
    private final boolean fromCache;

    private CrawlResult(String url, int depth, CrawlStatus status, int statusCode,
                        CrawlErrorType errorType, String error,
                        Map<String, Object> fields, List<String> links, boolean fromCache) {
        this.url = Objects.requireNonNull(url, "url");
        this.depth = depth;
        this.status = Objects.requireNonNull(status, "status");
        this.statusCode = statusCode;
        this.errorType = errorType;
        this.error = error;
        this.fields = (fields == null) ? Map.of() : Map.copyOf(fields);
        this.links = (links == null) ? List.of() : List.copyOf(links);
        this.fromCache = fromCache;
    }

    public static CrawlResult success(CrawlTask task, int statusCode, ParsedPage page, boolean fromCache) {
        return new CrawlResult(task.url(), task.depth(), CrawlStatus.SUCCESS, statusCode,
                null, null, page.fields(), page.links(), fromCache);
    }

    /** 파서 실패 후 링크만 회수한 결과 */
    public static CrawlResult salvaged(CrawlTask task, int statusCode, List<String> links,
                                       String parseError, boolean fromCache) {
        return new CrawlResult(task.url(), task.depth(), CrawlStatus.SUCCESS, statusCode,
                CrawlErrorType.PARSE_FAILURE, parseError, Map.of(), links, fromCache);
    }

    public static CrawlResult failure(CrawlTask task, int statusCode, CrawlErrorType type, String message) {
        return new CrawlResult(task.url(), task.depth(), CrawlStatus.ERROR, statusCode,
                Objects.requireNonNull(type, "type"), message, Map.of(), List.of(), false);
    }

    public String getUrl() { return url; }
    public int getDepth() { return depth; }
    public CrawlStatus getStatus() { return status; }
    /** 응답이 없었으면 -1 */
    public int getStatusCode() { return statusCode; }
    public CrawlErrorType getErrorType() { return errorType; }
    public String getError() { return error; }
    public Map<String, Object> getFields() { return fields; }
    public List<String> getLinks() { return links; }
    public boolean isFromCache() { return fromCache; }

    public boolean isSuccess() { return status == CrawlStatus.SUCCESS; }

    @Override
    public String toString() {
        return "CrawlResult{" + url + " d=" + depth + " " + status
                + (errorType != null ? " " + errorType + ": " + error : "")
                + " links=" + links.size() + '}';
    }
}
