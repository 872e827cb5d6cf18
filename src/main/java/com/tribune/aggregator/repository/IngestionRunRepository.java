package com.tribune.aggregator.repository;

import com.tribune.aggregator.domain.entity.IngestionRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface IngestionRunRepository extends JpaRepository<IngestionRun, Long> {

    @Transactional
    long deleteByStartedAtBefore(Instant cutoff);
}
