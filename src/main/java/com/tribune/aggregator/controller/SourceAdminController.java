package com.tribune.aggregator.controller;

import com.tribune.aggregator.domain.entity.ScrapeSelectors;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.FetchStrategy;
import com.tribune.aggregator.domain.enums.SourceStatus;
import com.tribune.aggregator.domain.enums.UpdateFrequency;
import com.tribune.aggregator.exception.NotFoundException;
import com.tribune.aggregator.repository.SourceRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/admin/sources")
@RequiredArgsConstructor
public class SourceAdminController {

    private final SourceRepository sourceRepository;

    @GetMapping
    public ResponseEntity<List<SourceResponse>> listSources() {
        List<SourceResponse> sources = sourceRepository.findAll(Sort.by(Sort.Direction.ASC, "id"))
                .stream()
                .map(SourceResponse::from)
                .toList();
        return ResponseEntity.ok(sources);
    }

    @PostMapping
    public ResponseEntity<SourceResponse> createSource(@RequestBody @Valid SourceCreateRequest request) {
        Source source = Source.builder()
                .name(request.name())
                .url(request.url())
                .strategy(request.strategy())
                .selectors(request.selectors() != null ? request.selectors().toEmbeddable() : null)
                .category(request.category() != null ? request.category() : "general")
                .enabled(request.enabled() != null ? request.enabled() : true)
                .updateFrequency(request.updateFrequency() != null ? request.updateFrequency() : UpdateFrequency.DAILY)
                .priority(request.priority() != null ? request.priority() : 5)
                .notes(request.notes())
                .build();
        if (!source.isEnabled()) {
            source.setStatus(SourceStatus.DISABLED);
        }

        requireSelectorsForScrape(source);
        Source saved = sourceRepository.save(source);
        log.info("Source created sourceId={} name='{}' strategy={}", saved.getId(), saved.getName(), saved.getStrategy());
        return ResponseEntity.ok(SourceResponse.from(saved));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SourceResponse> updateSource(
            @PathVariable("id") Long id,
            @RequestBody @Valid SourceUpdateRequest request
    ) {
        Source source = findSource(id);

        if (request.name() != null) source.setName(request.name());
        if (request.url() != null) source.setUrl(request.url());
        if (request.strategy() != null) source.setStrategy(request.strategy());
        if (request.selectors() != null) source.setSelectors(request.selectors().toEmbeddable());
        if (request.category() != null) source.setCategory(request.category());
        if (request.updateFrequency() != null) source.setUpdateFrequency(request.updateFrequency());
        if (request.priority() != null) source.setPriority(request.priority());
        if (request.notes() != null) source.setNotes(request.notes());

        requireSelectorsForScrape(source);
        sourceRepository.updateConfiguration(source, Instant.now());
        log.info("Source updated sourceId={}", id);
        return ResponseEntity.ok(SourceResponse.from(findSource(id)));
    }

    @PostMapping("/{id}/toggle")
    public ResponseEntity<SourceResponse> toggleSource(@PathVariable("id") Long id) {
        Source source = findSource(id);

        boolean enabled = !source.isEnabled();
        sourceRepository.updateEnabled(id, enabled, enabled ? SourceStatus.ACTIVE : SourceStatus.DISABLED, Instant.now());

        log.info("Source toggled sourceId={} enabled={}", id, enabled);
        return ResponseEntity.ok(SourceResponse.from(findSource(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSource(@PathVariable("id") Long id) {
        Source source = findSource(id);
        sourceRepository.delete(source);
        log.info("Source deleted sourceId={}", id);
        return ResponseEntity.noContent().build();
    }

    private Source findSource(Long id) {
        return sourceRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Source not found: " + id));
    }

    private static void requireSelectorsForScrape(Source source) {
        if (source.getStrategy() == FetchStrategy.SCRAPE
                && (source.getSelectors() == null || !source.getSelectors().isComplete())) {
            throw new IllegalArgumentException("Scrape sources need articleContainer, headline and link selectors");
        }
    }

    public record SelectorsRequest(
            String articleContainer,
            String headline,
            String link,
            String summary,
            String image,
            String date
    ) {
        ScrapeSelectors toEmbeddable() {
            return new ScrapeSelectors(articleContainer, headline, link, summary, image, date);
        }
    }

    public record SourceCreateRequest(
            @NotBlank String name,
            @NotBlank String url,
            @NotNull FetchStrategy strategy,
            SelectorsRequest selectors,
            String category,
            Boolean enabled,
            UpdateFrequency updateFrequency,
            @Min(1) @Max(10) Integer priority,
            String notes
    ) {}

    public record SourceUpdateRequest(
            String name,
            String url,
            FetchStrategy strategy,
            SelectorsRequest selectors,
            String category,
            UpdateFrequency updateFrequency,
            @Min(1) @Max(10) Integer priority,
            String notes
    ) {}

    public record SourceResponse(
            Long id,
            String name,
            String url,
            FetchStrategy strategy,
            ScrapeSelectors selectors,
            String category,
            boolean enabled,
            UpdateFrequency updateFrequency,
            int priority,
            SourceStatus status,
            Instant lastFetchedAt,
            Instant lastSuccessAt,
            int consecutiveFailures,
            String errorMessage,
            long totalArticlesFetched,
            double averageArticlesPerFetch,
            String notes,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static SourceResponse from(Source s) {
            return new SourceResponse(
                    s.getId(),
                    s.getName(),
                    s.getUrl(),
                    s.getStrategy(),
                    s.getSelectors(),
                    s.getCategory(),
                    s.isEnabled(),
                    s.getUpdateFrequency(),
                    s.getPriority(),
                    s.getStatus(),
                    s.getLastFetchedAt(),
                    s.getLastSuccessAt(),
                    s.getConsecutiveFailures(),
                    s.getErrorMessage(),
                    s.getTotalArticlesFetched(),
                    s.getAverageArticlesPerFetch(),
                    s.getNotes(),
                    s.getCreatedAt(),
                    s.getUpdatedAt()
            );
        }
    }
}
