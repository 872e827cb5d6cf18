package com.tribune.aggregator.domain.enums;

// Advisory only; the cron trigger decides when runs happen.
public enum UpdateFrequency {
    HOURLY,
    DAILY,
    MANUAL
}
