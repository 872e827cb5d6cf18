package com.tribune.aggregator.integration.fetcher;

import com.tribune.aggregator.domain.dto.TextExtractionResult;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArticleTextExtractorTest {

    private static final String P1 = "The regional parliament voted on Thursday to approve a sweeping reform of the water utility sector.";
    private static final String P2 = "Supporters said the measure would cut household bills, while critics warned of reduced investment in pipes.";

    @Mock HttpPageClient httpPageClient;

    ArticleTextExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ArticleTextExtractor(httpPageClient);
        ReflectionTestUtils.setField(extractor, "timeoutSeconds", 15);
        ReflectionTestUtils.setField(extractor, "warnCooldownMs", 0L);
    }

    @Test
    void extract_prefersArticleContainer_andDropsNoise() {
        String html = """
                <html><body>
                  <nav><p>Navigation text that is long enough to count as a paragraph if kept around.</p></nav>
                  <article>
                    <p>%s</p>
                    <div class="social-share"><p>Share this story with all of your friends and family members now.</p></div>
                    <p>Short.</p>
                    <p>%s</p>
                    <p>Subscribe to our newsletter for more stories like this one every single morning.</p>
                  </article>
                  <footer><p>Footer text that is long enough to count as a paragraph if kept around.</p></footer>
                </body></html>
                """.formatted(P1, P2);
        stubPage(html);

        TextExtractionResult r = extractor.extract("https://example.com/story");

        assertTrue(r.success());
        assertEquals(List.of(P1, P2), r.paragraphs());
        assertEquals(P1 + "\n\n" + P2, r.fullText());
        assertThat(r.wordCount()).isEqualTo((P1 + " " + P2).split("\\s+").length);
        verify(httpPageClient).get(eq("https://example.com/story"), eq(HttpPageClient.ACCEPT_HTML), eq(Duration.ofSeconds(15)));
    }

    @Test
    void extract_noParagraphs_fallsBackToLines() {
        String html = "<html><body><main><div>" + P1 + "<br>\n" + P2 + "</div></main></body></html>";
        stubPage(html);

        TextExtractionResult r = extractor.extract("https://example.com/lines");

        assertTrue(r.success());
        assertEquals(2, r.paragraphs().size());
    }

    @Test
    void extract_fetchFails_returnsFailedResult() {
        when(httpPageClient.get(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new FetchException("Non-2xx status=404 url=https://example.com/gone", null));

        TextExtractionResult r = extractor.extract("https://example.com/gone");

        assertFalse(r.success());
        assertThat(r.error()).contains("404");
        assertFalse(r.isUsable());
    }

    @Test
    void extract_blankUrl_failsWithoutNetwork() {
        assertFalse(extractor.extract(" ").success());
        verifyNoInteractions(httpPageClient);
    }

    @Test
    void isUsable_requiresWordsAndParagraphs() {
        String longPara = "word ".repeat(30).trim();
        assertTrue(TextExtractionResult.of(List.of(longPara, longPara)).isUsable());
        assertFalse(TextExtractionResult.of(List.of(longPara + " " + longPara)).isUsable());
        assertFalse(TextExtractionResult.of(List.of("a b c", "d e f")).isUsable());
    }

    @Test
    void isJunk_matchesBoilerplate() {
        assertTrue(ArticleTextExtractor.isJunk("Share this article on social media with everyone you know"));
        assertTrue(ArticleTextExtractor.isJunk("Please read our Cookie Policy before continuing to browse"));
        assertTrue(ArticleTextExtractor.isJunk("There are 42 comments on this story so far today"));
        assertFalse(ArticleTextExtractor.isJunk(P1));
    }

    private void stubPage(String html) {
        when(httpPageClient.get(anyString(), anyString(), any(Duration.class)))
                .thenReturn(new HttpPageClient.PageResponse(
                        URI.create("https://example.com/story"), html.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8, "text/html"));
    }
}
