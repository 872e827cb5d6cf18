package com.tribune.aggregator.domain.enums;

/**
 * Visible health of a source. {@code ERROR} is reached after too many consecutive failures
 * and cleared by the next success; {@code DISABLED} mirrors an operator turning the source off.
 */
public enum SourceStatus {
    ACTIVE,
    ERROR,
    DISABLED
}
