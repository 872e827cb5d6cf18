package com.tribune.aggregator.scheduler;

import com.tribune.aggregator.service.RetentionService;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class RetentionSchedulerTest {

    @Test
    void run_sweepsWithConfiguredWindow() {
        RetentionService svc = mock(RetentionService.class);
        when(svc.sweep()).thenReturn(new RetentionService.RetentionResult(30, 4L, 1L));

        new RetentionScheduler(svc).run();

        verify(svc).sweep();
        verify(svc, never()).sweep(anyInt());
    }
}
