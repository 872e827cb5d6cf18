package com.tribune.aggregator.service;

import com.tribune.aggregator.repository.ArticleRepository;
import com.tribune.aggregator.repository.IngestionRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Deletes articles and run reports by age.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionService {

    private final ArticleRepository articleRepository;
    private final IngestionRunRepository ingestionRunRepository;

    @Value("${retention.article-days:30}")
    private int articleDays;

    @Value("${retention.run-days:30}")
    private int runDays;

    public RetentionResult sweep() {
        return sweep(articleDays);
    }

    public RetentionResult sweep(int daysToKeep) {
        if (daysToKeep < 1) {
            throw new IllegalArgumentException("days must be >= 1");
        }
        Instant now = Instant.now();
        long articles = articleRepository.deleteByFetchedAtBefore(now.minus(Duration.ofDays(daysToKeep)));
        long runs = ingestionRunRepository.deleteByStartedAtBefore(now.minus(Duration.ofDays(runDays)));

        log.info("Retention: deleted articles={} (older than {}d) runs={} (older than {}d)",
                articles, daysToKeep, runs, runDays);
        return new RetentionResult(daysToKeep, articles, runs);
    }

    public record RetentionResult(int daysToKeep, long articlesDeleted, long runsDeleted) {}
}
