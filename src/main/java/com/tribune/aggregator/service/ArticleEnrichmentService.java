package com.tribune.aggregator.service;

import com.tribune.aggregator.domain.dto.SummaryResult;
import com.tribune.aggregator.domain.dto.TextExtractionResult;
import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.integration.fetcher.ArticleTextExtractor;
import com.tribune.aggregator.util.ExtractiveSummarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Fills in full text and a lead-sentence summary for articles whose feed summary is thin.
 * Best effort: a failed extraction leaves the article as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleEnrichmentService {

    static final int GOOD_SUMMARY_LENGTH = 80;

    private final ArticleTextExtractor textExtractor;

    @Value("${ingestion.enrichment.enabled:true}")
    private boolean enabled;

    @Value("${ingestion.enrichment.max-per-source:10}")
    private int maxPerSource;

    public boolean isEnabled() {
        return enabled;
    }

    public int maxPerSource() {
        return maxPerSource;
    }

    public boolean needsEnrichment(Article article) {
        return article.getSummary() == null || article.getSummary().length() <= GOOD_SUMMARY_LENGTH;
    }

    /**
     * @return true when the article gained full text
     */
    public boolean enrich(Article article) {
        TextExtractionResult text = textExtractor.extract(article.getUrl());
        if (!text.isUsable()) {
            log.debug("Enrich: skipped url={} words={} paragraphs={} err={}",
                    article.getUrl(), text.wordCount(), text.paragraphs().size(), text.error());
            return false;
        }

        article.setFullText(text.fullText());
        article.setWordCount(text.wordCount());

        SummaryResult summary = ExtractiveSummarizer.shortSummary(text.fullText());
        if (summary.success()) {
            article.setExtractedSummary(summary.summary());
            article.setSummarizedAt(Instant.now());
            article.setSummarizationMethod(summary.method());
        }

        log.debug("Enrich: ok url={} words={} summaryLen={}",
                article.getUrl(), text.wordCount(), summary.summary().length());
        return true;
    }
}
