package com.tribune.aggregator.domain.enums;

public enum FetchStrategy {
    FEED,
    SCRAPE
}
