package com.tribune.aggregator.domain.dto;

import com.tribune.aggregator.domain.enums.FetchFailureReason;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchResult {

    private final boolean success;
    private final List<RawRecord> records;
    private final FetchFailureReason reason;
    private final String detail;

    public static FetchResult succeeded(List<RawRecord> records) {
        return new FetchResult(true, List.copyOf(records), null, null);
    }

    public static FetchResult failed(FetchFailureReason reason, String detail) {
        return new FetchResult(false, List.of(), reason, detail);
    }

    /** Operator-facing message, e.g. {@code feed-parse-failed: Non-2xx status=503}. */
    public String getError() {
        if (success) return null;
        return detail == null || detail.isBlank() ? reason.getCode() : reason.getCode() + ": " + detail;
    }
}
