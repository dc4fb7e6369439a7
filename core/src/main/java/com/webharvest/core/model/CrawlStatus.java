package com.webharvest.core.model;

public enum CrawlStatus {
    SUCCESS,
    ERROR
}
