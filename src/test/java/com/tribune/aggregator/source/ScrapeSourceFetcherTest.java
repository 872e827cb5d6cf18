package com.tribune.aggregator.source;

import com.tribune.aggregator.domain.dto.RawRecord;
import com.tribune.aggregator.domain.entity.ScrapeSelectors;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.FetchFailureReason;
import com.tribune.aggregator.domain.enums.FetchStrategy;
import com.tribune.aggregator.exception.FetchException;
import com.tribune.aggregator.integration.http.HttpPageClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScrapeSourceFetcherTest {

    private static final String LISTING = """
            <html><body>
              <div class="story">
                <h2 class="title">First story</h2>
                <a class="more" href="/news/first">Read</a>
                <p class="dek">The first dek.</p>
                <img class="thumb" src="/img/first.jpg"/>
                <time class="when">2024-05-01T08:00:00Z</time>
              </div>
              <div class="story">
                <h2 class="title">Second story</h2>
                <a class="more" href="https://other.example.org/second">Read</a>
              </div>
              <div class="story">
                <h2 class="title">No link here</h2>
              </div>
              <div class="story">
                <a class="more" href="/news/untitled">Read</a>
              </div>
            </body></html>
            """;

    @Mock HttpPageClient httpPageClient;

    ScrapeSourceFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new ScrapeSourceFetcher(httpPageClient);
        ReflectionTestUtils.setField(fetcher, "requestTimeoutSeconds", 10);
    }

    @Test
    void fetch_extractsContainers_resolvesRelativeAgainstOrigin_skipsIncomplete() {
        Source source = scrapeSource(new ScrapeSelectors(".story", ".title", "a.more", ".dek", "img.thumb", ".when"));
        stubPage(LISTING);

        List<RawRecord> out = fetcher.fetch(source);

        assertEquals(2, out.size());
        RawRecord first = out.get(0);
        assertEquals("First story", first.getHeadline());
        assertEquals("https://news.example.com/news/first", first.getUrl());
        assertEquals("The first dek.", first.getSummary());
        assertEquals("https://news.example.com/img/first.jpg", first.getImage());
        assertEquals("2024-05-01T08:00:00Z", first.getPubDate());

        RawRecord second = out.get(1);
        assertEquals("https://other.example.org/second", second.getUrl());
        assertEquals("", second.getSummary());
        assertNull(second.getImage());
        assertNull(second.getPubDate());
    }

    @Test
    void fetch_noMatches_returnsEmptyList() {
        Source source = scrapeSource(new ScrapeSelectors(".nothing", ".title", "a", null, null, null));
        stubPage(LISTING);

        assertTrue(fetcher.fetch(source).isEmpty());
    }

    @Test
    void fetch_missingSelectors_failsWithoutNetwork() {
        Source source = scrapeSource(null);

        FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(source));

        assertEquals(FetchFailureReason.SELECTORS_MISSING, ex.getReason());
        verifyNoInteractions(httpPageClient);
    }

    @Test
    void fetch_incompleteSelectors_failsWithSelectorsMissing() {
        Source source = scrapeSource(new ScrapeSelectors(".story", "", "a", null, null, null));

        FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(source));
        assertEquals(FetchFailureReason.SELECTORS_MISSING, ex.getReason());
    }

    @Test
    void fetch_networkError_throwsScrapeFailed() {
        Source source = scrapeSource(new ScrapeSelectors(".story", ".title", "a", null, null, null));
        when(httpPageClient.get(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new FetchException("Non-2xx status=404 url=" + source.getUrl(), null));

        FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(source));
        assertEquals(FetchFailureReason.SCRAPE_FAILED, ex.getReason());
    }

    @Test
    void fetch_malformedSelector_throwsScrapeFailed() {
        Source source = scrapeSource(new ScrapeSelectors("div[[[", ".title", "a", null, null, null));
        stubPage(LISTING);

        FetchException ex = assertThrows(FetchException.class, () -> fetcher.fetch(source));
        assertEquals(FetchFailureReason.SCRAPE_FAILED, ex.getReason());
    }

    private static Source scrapeSource(ScrapeSelectors selectors) {
        return Source.builder()
                .id(3L)
                .name("Example News")
                .strategy(FetchStrategy.SCRAPE)
                .url("https://news.example.com/section/world?page=1")
                .selectors(selectors)
                .build();
    }

    private void stubPage(String html) {
        when(httpPageClient.get(anyString(), anyString(), any(Duration.class)))
                .thenReturn(new HttpPageClient.PageResponse(
                        URI.create("https://news.example.com/section/world?page=1"),
                        html.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8, "text/html"));
    }
}
