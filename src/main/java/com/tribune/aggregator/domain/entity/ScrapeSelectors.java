package com.tribune.aggregator.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * CSS selectors for the scrape strategy. {@code summary}, {@code image} and {@code date}
 * are optional; the other three must be present for a scrape to run.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScrapeSelectors {

    @Column(name = "sel_container", length = 500)
    private String articleContainer;

    @Column(name = "sel_headline", length = 500)
    private String headline;

    @Column(name = "sel_link", length = 500)
    private String link;

    @Column(name = "sel_summary", length = 500)
    private String summary;

    @Column(name = "sel_image", length = 500)
    private String image;

    @Column(name = "sel_date", length = 500)
    private String date;

    public boolean isComplete() {
        return notBlank(articleContainer) && notBlank(headline) && notBlank(link);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
