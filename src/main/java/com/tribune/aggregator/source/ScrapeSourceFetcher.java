package com.tribune.aggregator.source;

import com.tribune.aggregator.domain.dto.RawRecord;
import com.tribune.aggregator.domain.entity.ScrapeSelectors;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.FetchFailureReason;
import com.tribune.aggregator.domain.enums.FetchStrategy;
import com.tribune.aggregator.exception.FetchException;
import com.tribune.aggregator.integration.http.HttpPageClient;
import com.tribune.aggregator.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Listing-page strategy: each element matching the container selector is one candidate
 * article. Candidates without a headline or a link are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScrapeSourceFetcher implements SourceFetcher {

    private final HttpPageClient httpPageClient;

    @Value("${crawler.request-timeout-seconds:10}")
    private int requestTimeoutSeconds;

    @Override
    public FetchStrategy strategy() {
        return FetchStrategy.SCRAPE;
    }

    @Override
    public List<RawRecord> fetch(Source source) {
        ScrapeSelectors selectors = source.getSelectors();
        if (selectors == null || !selectors.isComplete()) {
            throw new FetchException(FetchFailureReason.SELECTORS_MISSING, "No selectors configured for scraping", null);
        }

        log.info("Scrape: fetching page sourceId={} sourceName='{}' url={}",
                source.getId(), source.getName(), source.getUrl());

        try {
            HttpPageClient.PageResponse page = httpPageClient.get(
                    source.getUrl(), HttpPageClient.ACCEPT_HTML, Duration.ofSeconds(requestTimeoutSeconds));
            Document doc = Jsoup.parse(page.text(), page.uri().toString());

            List<RawRecord> out = new ArrayList<>();
            int skipped = 0;
            for (Element container : doc.select(selectors.getArticleContainer())) {
                RawRecord record = toRecord(container, selectors, source.getUrl());
                if (record == null) {
                    skipped++;
                    continue;
                }
                out.add(record);
            }

            log.info("Scrape: page done sourceId={} matched={} skipped={}", source.getId(), out.size(), skipped);
            return out;

        } catch (RuntimeException e) {
            // network errors and Jsoup's SelectorParseException for a malformed selector
            throw new FetchException(FetchFailureReason.SCRAPE_FAILED, e.getMessage(), e);
        }
    }

    private RawRecord toRecord(Element container, ScrapeSelectors selectors, String origin) {
        String title = textOf(container, selectors.getHeadline());
        String href = attrOf(container, selectors.getLink(), "href");
        if (title.isEmpty() || href.isEmpty()) {
            return null;
        }

        String image = attrOf(container, selectors.getImage(), "src");

        return RawRecord.builder()
                .headline(title)
                .url(UrlUtils.resolveAgainstOrigin(href, origin))
                .summary(textOf(container, selectors.getSummary()))
                .image(image.isEmpty() ? null : UrlUtils.resolveAgainstOrigin(image, origin))
                .pubDate(emptyToNull(textOf(container, selectors.getDate())))
                .build();
    }

    private static String textOf(Element container, String selector) {
        if (selector == null || selector.isBlank()) return "";
        Element el = container.selectFirst(selector);
        return el == null ? "" : el.text().trim();
    }

    private static String attrOf(Element container, String selector, String attr) {
        if (selector == null || selector.isBlank()) return "";
        Element el = container.selectFirst(selector);
        return el == null ? "" : el.attr(attr).trim();
    }

    private static String emptyToNull(String s) {
        return s.isEmpty() ? null : s;
    }
}
