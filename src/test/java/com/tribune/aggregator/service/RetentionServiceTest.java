package com.tribune.aggregator.service;

import com.tribune.aggregator.repository.ArticleRepository;
import com.tribune.aggregator.repository.IngestionRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

    @Mock ArticleRepository articleRepository;
    @Mock IngestionRunRepository ingestionRunRepository;

    private RetentionService service;

    @BeforeEach
    void setUp() {
        service = new RetentionService(articleRepository, ingestionRunRepository);
        ReflectionTestUtils.setField(service, "articleDays", 30);
        ReflectionTestUtils.setField(service, "runDays", 60);
    }

    @Test
    void sweep_defaultWindow_deletesOlderRows() {
        when(articleRepository.deleteByFetchedAtBefore(any(Instant.class))).thenReturn(12L);
        when(ingestionRunRepository.deleteByStartedAtBefore(any(Instant.class))).thenReturn(3L);

        RetentionService.RetentionResult result = service.sweep();

        assertEquals(30, result.daysToKeep());
        assertEquals(12L, result.articlesDeleted());
        assertEquals(3L, result.runsDeleted());

        ArgumentCaptor<Instant> articleCutoff = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> runCutoff = ArgumentCaptor.forClass(Instant.class);
        verify(articleRepository).deleteByFetchedAtBefore(articleCutoff.capture());
        verify(ingestionRunRepository).deleteByStartedAtBefore(runCutoff.capture());

        Instant now = Instant.now();
        assertThat(articleCutoff.getValue()).isBetween(now.minus(Duration.ofDays(30)).minusSeconds(60), now.minus(Duration.ofDays(30)));
        assertThat(runCutoff.getValue()).isBetween(now.minus(Duration.ofDays(60)).minusSeconds(60), now.minus(Duration.ofDays(60)));
    }

    @Test
    void sweep_explicitDays() {
        when(articleRepository.deleteByFetchedAtBefore(any(Instant.class))).thenReturn(0L);
        when(ingestionRunRepository.deleteByStartedAtBefore(any(Instant.class))).thenReturn(0L);

        assertEquals(7, service.sweep(7).daysToKeep());
    }

    @Test
    void sweep_nonPositiveDays_rejected() {
        assertThrows(IllegalArgumentException.class, () -> service.sweep(0));
        verifyNoInteractions(articleRepository, ingestionRunRepository);
    }
}
