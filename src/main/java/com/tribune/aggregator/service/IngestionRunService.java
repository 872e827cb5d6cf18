package com.tribune.aggregator.service;

import com.tribune.aggregator.domain.entity.IngestionRun;
import com.tribune.aggregator.domain.entity.SourceRunResult;
import com.tribune.aggregator.domain.enums.IngestionStatus;
import com.tribune.aggregator.exception.NotFoundException;
import com.tribune.aggregator.repository.IngestionRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionRunService {

    private final IngestionRunRepository ingestionRunRepository;

    /**
     * Aggregates per-source results into a run report and appends it.
     */
    public IngestionRun record(String correlationId, Instant startedAt, List<SourceRunResult> results) {
        IngestionRun run = summarize(correlationId, startedAt, results);
        IngestionRun saved = ingestionRunRepository.save(run);
        log.info("Run report saved runId={} sources={} articlesAdded={} errors={} status={}",
                saved.getId(), saved.getSourcesProcessed(), saved.getArticlesAdded(), saved.getErrorCount(), saved.getStatus());
        return saved;
    }

    /**
     * Report for a run with no eligible sources. Not persisted.
     */
    public IngestionRun empty(String correlationId, Instant startedAt) {
        return summarize(correlationId, startedAt, List.of());
    }

    public Page<IngestionRun> page(int page, int size) {
        return ingestionRunRepository.findAll(PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "startedAt")));
    }

    public IngestionRun get(Long id) {
        return ingestionRunRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Ingestion run not found: " + id));
    }

    static IngestionRun summarize(String correlationId, Instant startedAt, List<SourceRunResult> results) {
        int articles = 0;
        int errors = 0;
        for (SourceRunResult r : results) {
            articles += r.getArticleCount();
            if (!r.isSuccess()) errors++;
        }

        return IngestionRun.builder()
                .correlationId(correlationId)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .sourcesProcessed(results.size())
                .articlesAdded(articles)
                .errorCount(errors)
                .status(statusOf(results.size(), errors))
                .results(new ArrayList<>(results))
                .build();
    }

    static IngestionStatus statusOf(int sources, int errors) {
        if (errors == 0) return IngestionStatus.SUCCESS;
        if (errors == sources) return IngestionStatus.FAILED;
        return IngestionStatus.PARTIAL;
    }
}
