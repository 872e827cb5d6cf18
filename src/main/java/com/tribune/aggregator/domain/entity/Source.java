package com.tribune.aggregator.domain.entity;

import com.tribune.aggregator.domain.enums.FetchStrategy;
import com.tribune.aggregator.domain.enums.SourceStatus;
import com.tribune.aggregator.domain.enums.UpdateFrequency;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "sources", schema = "content")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false, columnDefinition = "text")
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FetchStrategy strategy;

    @Embedded
    private ScrapeSelectors selectors;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(nullable = false, length = 100)
    private String category = "general";

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "update_frequency", nullable = false, length = 20)
    private UpdateFrequency updateFrequency = UpdateFrequency.DAILY;

    @Builder.Default
    @Column(nullable = false)
    private int priority = 5;

    @Column(name = "last_fetched_at")
    private Instant lastFetchedAt;

    @Column(name = "last_success_at")
    private Instant lastSuccessAt;

    @Builder.Default
    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures = 0;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SourceStatus status = SourceStatus.ACTIVE;

    @Builder.Default
    @Column(name = "error_message", nullable = false, columnDefinition = "text")
    private String errorMessage = "";

    @Builder.Default
    @Column(name = "total_articles_fetched", nullable = false)
    private long totalArticlesFetched = 0;

    @Builder.Default
    @Column(name = "average_articles_per_fetch", nullable = false)
    private double averageArticlesPerFetch = 0;

    @Builder.Default
    @Column(name = "successful_fetches", nullable = false)
    private int successfulFetches = 0;

    @Column(columnDefinition = "text")
    private String notes;

    @Builder.Default
    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Builder.Default
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void preUpdate() {
        this.updatedAt = Instant.now();
    }
}
