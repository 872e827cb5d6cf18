package com.tribune.aggregator.scheduler;

import com.tribune.aggregator.service.RetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionScheduler {

    private final RetentionService retentionService;

    @Scheduled(cron = "${retention.cron:0 0 2 * * *}", zone = "${retention.zone:UTC}")
    public void run() {
        log.info("Scheduled retention sweep started");
        RetentionService.RetentionResult result = retentionService.sweep();
        log.info("Scheduled retention sweep finished articlesDeleted={} runsDeleted={}",
                result.articlesDeleted(), result.runsDeleted());
    }
}
