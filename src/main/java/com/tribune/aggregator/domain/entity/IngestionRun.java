package com.tribune.aggregator.domain.entity;

import com.tribune.aggregator.domain.enums.IngestionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only report of one ingestion run across all eligible sources.
 */
@Entity
@Table(name = "ingestion_runs", schema = "content",
        indexes = @Index(name = "idx_ingestion_runs_started_at", columnList = "started_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "sources_processed", nullable = false)
    private int sourcesProcessed;

    @Column(name = "articles_added", nullable = false)
    private int articlesAdded;

    @Column(name = "error_count", nullable = false)
    private int errorCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IngestionStatus status;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ingestion_run_results", schema = "content",
            joinColumns = @JoinColumn(name = "run_id"))
    @OrderColumn(name = "position")
    private List<SourceRunResult> results = new ArrayList<>();
}
