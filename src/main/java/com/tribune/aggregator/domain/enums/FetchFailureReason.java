package com.tribune.aggregator.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FetchFailureReason {
    FEED_PARSE_FAILED("feed-parse-failed"),
    SCRAPE_FAILED("scrape-failed"),
    SELECTORS_MISSING("selectors-missing"),
    UNSUPPORTED_STRATEGY("unsupported-strategy");

    private final String code;
}
