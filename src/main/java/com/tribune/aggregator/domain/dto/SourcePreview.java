package com.tribune.aggregator.domain.dto;

import java.util.List;

public record SourcePreview(boolean success, int recordCount, List<RawRecord> records, String error) {

    public static SourcePreview from(FetchResult result, int limit) {
        List<RawRecord> all = result.getRecords();
        return new SourcePreview(
                result.isSuccess(),
                all.size(),
                all.subList(0, Math.min(limit, all.size())),
                result.getError()
        );
    }
}
