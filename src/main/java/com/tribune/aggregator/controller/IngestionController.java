package com.tribune.aggregator.controller;

import com.tribune.aggregator.domain.dto.SourcePreview;
import com.tribune.aggregator.domain.entity.IngestionRun;
import com.tribune.aggregator.domain.entity.SourceRunResult;
import com.tribune.aggregator.service.IngestionRunService;
import com.tribune.aggregator.service.SourceIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/admin/ingestion")
@RequiredArgsConstructor
public class IngestionController {

    private final SourceIngestionService sourceIngestionService;
    private final IngestionRunService ingestionRunService;

    @PostMapping("/run")
    public ResponseEntity<IngestionRunResponse> runIngestion(
            @RequestParam(required = false) String correlationId
    ) {
        String cid = (correlationId != null && !correlationId.isBlank())
                ? correlationId
                : UUID.randomUUID().toString();

        log.info("Manual ingestion trigger, correlationId={}", cid);
        IngestionRun run = sourceIngestionService.ingestAllSources(cid);

        return ResponseEntity.ok(IngestionRunResponse.from(run));
    }

    @PostMapping("/run/{sourceId}")
    public ResponseEntity<SourceRunResult> runIngestionForSource(@PathVariable("sourceId") Long sourceId) {
        log.info("Manual ingestion trigger for sourceId={}", sourceId);
        return ResponseEntity.ok(sourceIngestionService.ingestSource(sourceId));
    }

    @PostMapping("/preview/{sourceId}")
    public ResponseEntity<SourcePreview> previewSource(@PathVariable("sourceId") Long sourceId) {
        return ResponseEntity.ok(sourceIngestionService.previewSource(sourceId));
    }

    @GetMapping("/logs")
    public ResponseEntity<IngestionRunPageResponse> listLogs(
            @RequestParam(name = "page", required = false, defaultValue = "0") int page,
            @RequestParam(name = "size", required = false, defaultValue = "20") int size
    ) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size < 1 || size > 200) {
            throw new IllegalArgumentException("size must be between 1 and 200");
        }

        Page<IngestionRun> result = ingestionRunService.page(page, size);
        return ResponseEntity.ok(IngestionRunPageResponse.from(result, page, size));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<IngestionRunResponse> getRun(@PathVariable("id") Long runId) {
        return ResponseEntity.ok(IngestionRunResponse.from(ingestionRunService.get(runId)));
    }

    public record IngestionRunPageResponse(
            int page,
            int size,
            long totalElements,
            int totalPages,
            List<IngestionRunResponse> items
    ) {
        static IngestionRunPageResponse from(Page<IngestionRun> pageResult, int page, int size) {
            var items = pageResult.getContent().stream().map(IngestionRunResponse::from).toList();
            return new IngestionRunPageResponse(page, size, pageResult.getTotalElements(), pageResult.getTotalPages(), items);
        }
    }

    public record IngestionRunResponse(
            Long id,
            String correlationId,
            Instant startedAt,
            Instant completedAt,
            int sourcesProcessed,
            int articlesAdded,
            int errorCount,
            String status,
            List<SourceRunResult> results
    ) {
        static IngestionRunResponse from(IngestionRun run) {
            String status = run.getStatus() != null ? run.getStatus().name() : null;
            return new IngestionRunResponse(
                    run.getId(),
                    run.getCorrelationId(),
                    run.getStartedAt(),
                    run.getCompletedAt(),
                    run.getSourcesProcessed(),
                    run.getArticlesAdded(),
                    run.getErrorCount(),
                    status,
                    List.copyOf(run.getResults())
            );
        }
    }
}
