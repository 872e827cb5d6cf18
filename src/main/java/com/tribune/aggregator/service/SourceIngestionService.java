package com.tribune.aggregator.service;

import com.tribune.aggregator.aggregator.SourceAggregator;
import com.tribune.aggregator.domain.dto.FetchResult;
import com.tribune.aggregator.domain.dto.SourcePreview;
import com.tribune.aggregator.domain.entity.Category;
import com.tribune.aggregator.domain.entity.IngestionRun;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.entity.SourceRunResult;
import com.tribune.aggregator.exception.NotFoundException;
import com.tribune.aggregator.repository.SourceRepository;
import com.tribune.aggregator.source.SourceFetchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SourceIngestionService {

    static final int PREVIEW_LIMIT = 5;

    private final SourceRepository sourceRepository;
    private final CategoryService categoryService;
    private final SourcePipeline sourcePipeline;
    private final SourceAggregator sourceAggregator;
    private final SourceHealthTracker sourceHealthTracker;
    private final IngestionRunService ingestionRunService;
    private final SourceFetchService sourceFetchService;

    public IngestionRun ingestAllSources(String correlationId) {
        return runIngestion(sourceRepository.findAll(), correlationId);
    }

    /**
     * One run over {@code sources}: only enabled sources take part, each is processed
     * concurrently and in isolation, health is updated once per source after all settle,
     * and the run report is appended. Persistence failures outside a single source's
     * pipeline propagate to the caller.
     */
    public IngestionRun runIngestion(List<Source> sources, String correlationId) {
        Instant start = Instant.now();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId)) {

            List<Source> eligible = sources.stream().filter(Source::isEnabled).toList();
            if (eligible.isEmpty()) {
                log.info("Ingestion: no enabled sources; nothing to do");
                return ingestionRunService.empty(correlationId, start);
            }

            List<Category> categories = categoryService.loadRuleSet();
            log.info("Ingestion started sources={} categories={}", eligible.size(), categories.size());

            List<SourceRunResult> results = sourceAggregator.aggregateAsync(
                    eligible, source -> sourcePipeline.process(source, categories));

            for (int i = 0; i < eligible.size(); i++) {
                sourceHealthTracker.record(eligible.get(i), results.get(i));
            }

            IngestionRun run = ingestionRunService.record(correlationId, start, results);
            log.info("Ingestion done. sources={} articlesAdded={} errors={} tookMs={}",
                    run.getSourcesProcessed(), run.getArticlesAdded(), run.getErrorCount(),
                    System.currentTimeMillis() - start.toEpochMilli());
            return run;

        } catch (RuntimeException e) {
            log.error("Ingestion failed correlationId={}", correlationId, e);
            throw e;
        }
    }

    /**
     * Manual fetch of a single source, enabled or not. Updates its health but appends no run report.
     */
    public SourceRunResult ingestSource(Long sourceId) {
        Source source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> new NotFoundException("Source not found: " + sourceId));

        List<Category> categories = categoryService.loadRuleSet();
        SourceRunResult result;
        try {
            result = sourcePipeline.process(source, categories);
        } catch (RuntimeException e) {
            log.warn("Manual fetch failed sourceId={} err={}", sourceId, e.toString());
            result = SourceRunResult.failed(source, e.getMessage());
        }

        sourceHealthTracker.record(source, result);
        return result;
    }

    /**
     * Fetches without storing anything, returning the first few raw records.
     */
    public SourcePreview previewSource(Long sourceId) {
        Source source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> new NotFoundException("Source not found: " + sourceId));

        FetchResult fetched = sourceFetchService.fetch(source);
        return SourcePreview.from(fetched, PREVIEW_LIMIT);
    }
}
