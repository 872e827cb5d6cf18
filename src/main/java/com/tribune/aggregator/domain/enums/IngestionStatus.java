package com.tribune.aggregator.domain.enums;

public enum IngestionStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
