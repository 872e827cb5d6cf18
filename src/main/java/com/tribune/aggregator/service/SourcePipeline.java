package com.tribune.aggregator.service;

import com.tribune.aggregator.domain.dto.FetchResult;
import com.tribune.aggregator.domain.entity.Article;
import com.tribune.aggregator.domain.entity.Category;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.entity.SourceRunResult;
import com.tribune.aggregator.processor.ArticleNormalizer;
import com.tribune.aggregator.processor.RuleCategorizer;
import com.tribune.aggregator.source.SourceFetchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetch, normalize, categorize and store for one source. Health is not touched here; the
 * caller applies the returned outcome once the source has settled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourcePipeline {

    private final SourceFetchService sourceFetchService;
    private final ArticleNormalizer articleNormalizer;
    private final RuleCategorizer ruleCategorizer;
    private final ArticleEnrichmentService enrichmentService;
    private final ArticleService articleService;

    // Enrichment stops starting new extractions once the source has used this much time,
    // keeping the whole source inside ingestion.source-timeout-seconds.
    @Value("${ingestion.enrichment.budget-seconds:60}")
    private long enrichmentBudgetSeconds;

    public SourceRunResult process(Source source, List<Category> categories) {
        long t0 = System.currentTimeMillis();

        FetchResult fetched = sourceFetchService.fetch(source);
        if (!fetched.isSuccess()) {
            return SourceRunResult.failed(source, fetched.getError());
        }

        List<Article> articles = articleNormalizer.normalizeAll(fetched.getRecords(), source);
        int rejected = fetched.getRecords().size() - articles.size();

        Map<String, List<String>> categoriesById = ruleCategorizer.categorizeAll(articles, categories);

        int added = 0;
        int duplicates = 0;
        int enriched = 0;
        int enrichBudget = enrichmentService.isEnabled() ? enrichmentService.maxPerSource() : 0;

        for (Article article : articles) {
            article.setCategories(new ArrayList<>(categoriesById.getOrDefault(article.getId(), List.of())));

            if (articleService.exists(article.getId())) {
                duplicates++;
                continue;
            }

            if (enrichBudget > 0 && System.currentTimeMillis() - t0 >= enrichmentBudgetSeconds * 1000) {
                log.info("Enrich: time budget of {}s used up sourceId={}, storing remaining articles as fetched",
                        enrichmentBudgetSeconds, source.getId());
                enrichBudget = 0;
            }

            if (enrichBudget > 0 && enrichmentService.needsEnrichment(article)) {
                enrichBudget--;
                if (tryEnrich(article)) enriched++;
            }

            if (articleService.insertIfAbsent(article)) {
                added++;
                log.debug("Stored article sourceId={} id={} url={}", source.getId(), article.getId(), article.getUrl());
            } else {
                duplicates++;
            }
        }

        log.info("Source done sourceId={} records={} rejected={} added={} duplicates={} enriched={} tookMs={}",
                source.getId(), fetched.getRecords().size(), rejected, added, duplicates, enriched,
                System.currentTimeMillis() - t0);

        return SourceRunResult.succeeded(source, added);
    }

    private boolean tryEnrich(Article article) {
        try {
            return enrichmentService.enrich(article);
        } catch (RuntimeException e) {
            log.warn("Enrich: failed url={} err={}", article.getUrl(), e.toString());
            return false;
        }
    }
}
