package com.tribune.aggregator.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "categories", schema = "content",
        uniqueConstraints = @UniqueConstraint(name = "uk_categories_slug", columnNames = "slug"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Category {

    public static final String UNCATEGORIZED_SLUG = "uncategorized";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false, length = 100)
    private String slug;

    @Builder.Default
    @Column(nullable = false, columnDefinition = "text")
    private String description = "";

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "category_keywords", schema = "content",
            joinColumns = @JoinColumn(name = "category_id"))
    @Column(name = "keyword", length = 255)
    private Set<String> keywords = new HashSet<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "category_sources", schema = "content",
            joinColumns = @JoinColumn(name = "category_id"))
    @Column(name = "source_id")
    private Set<Long> sourceIds = new HashSet<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "category_domains", schema = "content",
            joinColumns = @JoinColumn(name = "category_id"))
    @Column(name = "domain", length = 255)
    private Set<String> domains = new HashSet<>();

    @Builder.Default
    @Column(name = "display_order", nullable = false)
    private int displayOrder = 0;

    @Builder.Default
    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    public boolean isSentinel() {
        return UNCATEGORIZED_SLUG.equals(slug);
    }
}
