package com.tribune.aggregator.source;

import com.tribune.aggregator.domain.dto.FetchResult;
import com.tribune.aggregator.domain.dto.RawRecord;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.FetchFailureReason;
import com.tribune.aggregator.domain.enums.FetchStrategy;
import com.tribune.aggregator.exception.FetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourceFetchServiceTest {

    @Mock SourceFetcher feedFetcher;

    SourceFetchService service;

    @BeforeEach
    void setUp() {
        when(feedFetcher.strategy()).thenReturn(FetchStrategy.FEED);
        service = new SourceFetchService(List.of(feedFetcher));
    }

    @Test
    void fetch_success_wrapsRecords() {
        Source source = Source.builder().id(1L).strategy(FetchStrategy.FEED).url("https://a.example.com/rss").build();
        RawRecord r = RawRecord.builder().title("t").link("https://a.example.com/1").build();
        when(feedFetcher.fetch(source)).thenReturn(List.of(r));

        FetchResult result = service.fetch(source);

        assertTrue(result.isSuccess());
        assertEquals(List.of(r), result.getRecords());
        assertNull(result.getError());
    }

    @Test
    void fetch_fetchException_becomesTypedFailure() {
        Source source = Source.builder().id(1L).strategy(FetchStrategy.FEED).url("https://a.example.com/rss").build();
        when(feedFetcher.fetch(source))
                .thenThrow(new FetchException(FetchFailureReason.FEED_PARSE_FAILED, "Invalid document", null));

        FetchResult result = service.fetch(source);

        assertFalse(result.isSuccess());
        assertTrue(result.getRecords().isEmpty());
        assertEquals(FetchFailureReason.FEED_PARSE_FAILED, result.getReason());
        assertEquals("feed-parse-failed: Invalid document", result.getError());
    }

    @Test
    void fetch_unexpectedException_neverEscapes() {
        Source source = Source.builder().id(1L).strategy(FetchStrategy.FEED).url("https://a.example.com/rss").build();
        when(feedFetcher.fetch(source)).thenThrow(new IllegalStateException("boom"));

        FetchResult result = service.fetch(source);

        assertFalse(result.isSuccess());
        assertEquals(FetchFailureReason.FEED_PARSE_FAILED, result.getReason());
    }

    @Test
    void fetch_strategyWithoutFetcher_isUnsupported() {
        Source source = Source.builder().id(2L).strategy(FetchStrategy.SCRAPE).url("https://b.example.com").build();

        FetchResult result = service.fetch(source);

        assertFalse(result.isSuccess());
        assertEquals(FetchFailureReason.UNSUPPORTED_STRATEGY, result.getReason());
        verify(feedFetcher, never()).fetch(any());
    }
}
