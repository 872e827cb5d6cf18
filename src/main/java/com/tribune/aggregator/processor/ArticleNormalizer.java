package com.tribune.aggregator.processor;

import com.tribune.aggregator.domain.dto.RawRecord;
import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.util.DateParsing;
import com.tribune.aggregator.util.UrlHasher;
import com.tribune.aggregator.util.UrlUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a {@link RawRecord} into a canonical {@link Article}. A record is rejected only when it
 * has no title or no URL; every other field degrades to empty or absent.
 */
@Slf4j
@Component
public class ArticleNormalizer {

    private static final Pattern MULTI_WS = Pattern.compile("\\s+");
    private static final Pattern FEED_SUFFIX = Pattern.compile("\\s*-\\s*RSS$", Pattern.CASE_INSENSITIVE);

    public Article normalize(RawRecord raw, Source source) {
        String rawTitle = firstPresent(raw.getTitle(), raw.getHeadline());
        String rawUrl = firstPresent(raw.getLink(), raw.getUrl());
        if (rawTitle == null || rawUrl == null) {
            log.debug("Normalize: rejected record sourceId={} (missing title or url) raw={}", source.getId(), raw);
            return null;
        }

        String title = cleanTitle(rawTitle);
        String url = UrlUtils.resolveAgainstOrigin(rawUrl, source.getUrl());
        if (title.isEmpty() || url.isEmpty()) {
            return null;
        }

        String image = firstPresent(raw.getImage(), raw.getThumbnail());
        String date = firstPresent(raw.getPubDate(), raw.getPublished());

        return Article.builder()
                .id(UrlHasher.sha256Hex(url))
                .title(title)
                .url(url)
                .sourceId(source.getId())
                .sourceName(source.getName())
                .summary(clean(firstPresent(raw.getSummary(), raw.getDescription())))
                .author(clean(raw.getAuthor()))
                .publishedDate(DateParsing.parse(date).orElse(null))
                .imageUrl(image == null ? null : UrlUtils.resolveAgainstOrigin(image, source.getUrl()))
                .fetchedAt(Instant.now())
                .build();
    }

    /**
     * Normalizes a batch, dropping rejected records.
     */
    public List<Article> normalizeAll(List<RawRecord> records, Source source) {
        List<Article> out = new ArrayList<>(records.size());
        for (RawRecord raw : records) {
            Article article = normalize(raw, source);
            if (article != null) out.add(article);
        }
        return out;
    }

    static String clean(String s) {
        return s == null ? "" : MULTI_WS.matcher(s).replaceAll(" ").trim();
    }

    // A title that is nothing but the feed suffix is kept as it came.
    static String cleanTitle(String title) {
        String cleaned = clean(title);
        String stripped = FEED_SUFFIX.matcher(cleaned).replaceAll("").trim();
        return stripped.isEmpty() ? cleaned : stripped;
    }

    private static String firstPresent(String primary, String fallback) {
        if (primary != null && !primary.isBlank()) return primary;
        if (fallback != null && !fallback.isBlank()) return fallback;
        return null;
    }
}
