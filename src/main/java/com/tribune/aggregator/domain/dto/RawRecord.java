package com.tribune.aggregator.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Item as returned by a fetch strategy, before normalization. Every field is optional;
 * feed and scrape strategies fill different aliases (title/headline, link/url, ...),
 * which the normalizer resolves in one place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawRecord {
    private String title;
    private String headline;
    private String link;
    private String url;
    private String summary;
    private String description;
    private String author;
    private String pubDate;
    private String published;
    private String image;
    private String thumbnail;
}
