package com.tribune.aggregator.integration.fetcher;

import com.tribune.aggregator.domain.dto.TextExtractionResult;
import com.tribune.aggregator.integration.http.HttpPageClient;
import com.tribune.aggregator.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Pulls the body paragraphs out of an article page. Used to enrich articles whose feed
 * summary is missing or too short; failures come back as a result, never as an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleTextExtractor {

    private static final int MIN_PARAGRAPH_LENGTH = 50;
    private static final int MIN_FALLBACK_TEXT_LENGTH = 100;

    private static final List<String> REMOVE_SELECTORS = List.of(
            "script", "style", "nav", "header", "footer", "aside", "iframe", "noscript",
            ".ad", ".advertisement", ".social-share", ".comments",
            "[class*=ad-]", "[class*=banner]", "[id*=ad-]"
    );

    private static final List<String> CONTENT_SELECTORS = List.of(
            "article", "[role=main]", "main",
            ".article-content", ".post-content", ".entry-content",
            ".story-body", "#article-body", ".article-body"
    );

    private static final List<Pattern> JUNK_PARAGRAPHS = List.of(
            Pattern.compile("^(share|tweet|email|print|subscribe)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(advertisement|sponsored)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(related|more stories|read more)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("cookie policy|privacy policy", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sign up|newsletter|follow us", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\d+\\s*(comments|shares)", Pattern.CASE_INSENSITIVE)
    );

    private final HttpPageClient httpPageClient;

    private final ConcurrentHashMap<String, Long> lastWarnByHost = new ConcurrentHashMap<>();

    @Value("${crawler.article-timeout-seconds:15}")
    private int timeoutSeconds;

    @Value("${crawler.warn-cooldown-ms:60000}")
    private long warnCooldownMs;

    public TextExtractionResult extract(String url) {
        if (url == null || url.isBlank()) {
            return TextExtractionResult.failed("No URL provided");
        }

        try {
            HttpPageClient.PageResponse page = httpPageClient.get(
                    url, HttpPageClient.ACCEPT_HTML, Duration.ofSeconds(timeoutSeconds));

            List<String> paragraphs = extractParagraphs(page.text(), page.uri().toString());
            TextExtractionResult result = TextExtractionResult.of(paragraphs);

            log.debug("Extractor: url={} paragraphs={} words={}", url, paragraphs.size(), result.wordCount());
            return result;

        } catch (RuntimeException e) {
            debugOrWarn(url, "Extraction failed", e);
            return TextExtractionResult.failed(e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }

    List<String> extractParagraphs(String html, String baseUrl) {
        Document doc = Jsoup.parse(html, baseUrl);

        for (String sel : REMOVE_SELECTORS) {
            doc.select(sel).remove();
        }

        Element content = contentContainer(doc);
        if (content == null) return List.of();

        List<String> paragraphs = new ArrayList<>();
        for (Element p : content.select("p")) {
            String text = p.text().trim();
            if (text.length() > MIN_PARAGRAPH_LENGTH && !isJunk(text)) {
                paragraphs.add(text);
            }
        }

        if (paragraphs.isEmpty()) {
            String allText = content.wholeText().trim();
            if (allText.length() > MIN_FALLBACK_TEXT_LENGTH) {
                for (String line : allText.split("\n")) {
                    String t = line.trim();
                    if (t.length() > MIN_PARAGRAPH_LENGTH && !isJunk(t)) {
                        paragraphs.add(t);
                    }
                }
            }
        }
        return paragraphs;
    }

    private static Element contentContainer(Document doc) {
        for (String sel : CONTENT_SELECTORS) {
            Element candidate = doc.selectFirst(sel);
            if (candidate != null) return candidate;
        }
        return doc.body();
    }

    static boolean isJunk(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return JUNK_PARAGRAPHS.stream().anyMatch(p -> p.matcher(lower).find());
    }

    private void debugOrWarn(String url, String msg, Exception e) {
        String host = UrlUtils.host(url).orElse("unknown");
        long now = System.currentTimeMillis();
        long last = lastWarnByHost.getOrDefault(host, 0L);

        if (now - last >= warnCooldownMs) {
            lastWarnByHost.put(host, now);
            log.warn("Extractor: {} url={} err={}", msg, url, e.toString());
        } else {
            log.debug("Extractor: {} url={} err={}", msg, url, e.toString());
        }
    }
}
