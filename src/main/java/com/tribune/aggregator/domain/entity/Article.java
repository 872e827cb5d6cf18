package com.tribune.aggregator.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical article. The id is the SHA-256 of the canonical URL, so an article is stored at
 * most once; {@link #isNew()} stays true until the row is persisted or loaded, which makes
 * {@code save} an insert that fails on a duplicate key instead of a merge.
 */
@Entity
@Table(name = "articles", schema = "content",
        indexes = {
                @Index(name = "idx_articles_fetched_at", columnList = "fetched_at"),
                @Index(name = "idx_articles_source_id", columnList = "source_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Article implements Persistable<String> {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, columnDefinition = "text")
    private String title;

    @Column(nullable = false, columnDefinition = "text")
    private String url;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "source_name", nullable = false, length = 255)
    private String sourceName;

    @Builder.Default
    @Column(nullable = false, columnDefinition = "text")
    private String summary = "";

    @Builder.Default
    @Column(nullable = false, length = 500)
    private String author = "";

    @Column(name = "published_date")
    private Instant publishedDate;

    @Column(name = "image_url", columnDefinition = "text")
    private String imageUrl;

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "article_categories", schema = "content",
            joinColumns = @JoinColumn(name = "article_id"))
    @Column(name = "category_slug", length = 100)
    private List<String> categories = new ArrayList<>();

    @Column(name = "full_text", columnDefinition = "text")
    private String fullText;

    @Column(name = "extracted_summary", columnDefinition = "text")
    private String extractedSummary;

    @Column(name = "word_count")
    private Integer wordCount;

    @Column(name = "summarized_at")
    private Instant summarizedAt;

    @Column(name = "summarization_method", length = 50)
    private String summarizationMethod;

    @Transient
    @Builder.Default
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        this.fresh = false;
    }
}
