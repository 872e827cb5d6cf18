package com.tribune.aggregator.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Outcome of one source within one ingestion run.
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceRunResult {

    @Column(name = "source_id")
    private Long sourceId;

    @Column(name = "source_name", length = 255)
    private String sourceName;

    @Column(nullable = false)
    private boolean success;

    @Column(name = "article_count", nullable = false)
    private int articleCount;

    @Column(columnDefinition = "text")
    private String error;

    public static SourceRunResult succeeded(Source source, int articleCount) {
        return new SourceRunResult(source.getId(), source.getName(), true, articleCount, null);
    }

    public static SourceRunResult failed(Source source, String error) {
        String message = (error == null || error.isBlank()) ? "Unknown error" : error;
        return new SourceRunResult(source.getId(), source.getName(), false, 0, message);
    }
}
