package com.tribune.aggregator.scheduler;

import com.tribune.aggregator.domain.entity.IngestionRun;
import com.tribune.aggregator.service.SourceIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionScheduler {

    private final SourceIngestionService sourceIngestionService;

    @Scheduled(cron = "${ingestion.cron:0 0 */12 * * *}", zone = "${ingestion.zone:UTC}")
    public void run() {
        String correlationId = UUID.randomUUID().toString();
        log.info("Scheduled ingestion started correlationId={}", correlationId);
        IngestionRun run = sourceIngestionService.ingestAllSources(correlationId);
        log.info("Scheduled ingestion finished correlationId={} status={} articlesAdded={}",
                correlationId, run.getStatus(), run.getArticlesAdded());
    }
}
