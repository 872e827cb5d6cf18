package com.tribune.aggregator.scheduler;

import com.tribune.aggregator.domain.entity.IngestionRun;
import com.tribune.aggregator.domain.enums.IngestionStatus;
import com.tribune.aggregator.service.SourceIngestionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class IngestionSchedulerTest {

    @Test
    void run_callsServiceWithRandomCorrelationId() {
        SourceIngestionService svc = mock(SourceIngestionService.class);
        when(svc.ingestAllSources(anyString()))
                .thenReturn(IngestionRun.builder().status(IngestionStatus.SUCCESS).build());
        IngestionScheduler scheduler = new IngestionScheduler(svc);

        scheduler.run();

        ArgumentCaptor<String> cap = ArgumentCaptor.forClass(String.class);
        verify(svc).ingestAllSources(cap.capture());
        assertThat(UUID.fromString(cap.getValue())).isNotNull();
    }

    @Test
    void run_eachTickGetsItsOwnCorrelationId() {
        SourceIngestionService svc = mock(SourceIngestionService.class);
        when(svc.ingestAllSources(anyString()))
                .thenReturn(IngestionRun.builder().status(IngestionStatus.SUCCESS).build());
        IngestionScheduler scheduler = new IngestionScheduler(svc);

        scheduler.run();
        scheduler.run();

        ArgumentCaptor<String> cap = ArgumentCaptor.forClass(String.class);
        verify(svc, times(2)).ingestAllSources(cap.capture());
        assertThat(cap.getAllValues().get(0)).isNotEqualTo(cap.getAllValues().get(1));
    }

    @Test
    void run_failedRun_propagates() {
        SourceIngestionService svc = mock(SourceIngestionService.class);
        when(svc.ingestAllSources(anyString())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> new IngestionScheduler(svc).run())
                .isInstanceOf(DataAccessResourceFailureException.class);
    }
}
