package com.tribune.aggregator.service;

import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.entity.SourceRunResult;
import com.tribune.aggregator.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Applies a fetch outcome to a source's health fields. Each outcome is one atomic UPDATE;
 * crossing the failure threshold moves the source to {@code ERROR} but leaves {@code enabled}
 * alone, which stays an operator decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceHealthTracker {

    static final String UNKNOWN_ERROR = "Unknown error";

    private final SourceRepository sourceRepository;

    @Value("${ingestion.failure-threshold:5}")
    private int failureThreshold;

    public void record(Source source, SourceRunResult result) {
        if (result.isSuccess()) {
            recordSuccess(source, result.getArticleCount());
        } else {
            recordFailure(source, result.getError());
        }
    }

    public void recordSuccess(Source source, int articleCount) {
        int updated = sourceRepository.recordSuccess(source.getId(), Instant.now(), articleCount);
        if (updated == 0) {
            log.warn("Health: source vanished before success could be recorded sourceId={}", source.getId());
        }
    }

    public void recordFailure(Source source, String message) {
        String error = (message == null || message.isBlank()) ? UNKNOWN_ERROR : message;
        int updated = sourceRepository.recordFailure(source.getId(), Instant.now(), error, failureThreshold);
        if (updated == 0) {
            log.warn("Health: source vanished before failure could be recorded sourceId={}", source.getId());
            return;
        }
        if (source.getConsecutiveFailures() + 1 >= failureThreshold) {
            log.warn("Health: sourceId={} sourceName='{}' at or past failure threshold={} err={}",
                    source.getId(), source.getName(), failureThreshold, error);
        }
    }
}
