package com.tribune.aggregator.source;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import com.tribune.aggregator.domain.dto.RawRecord;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.FetchFailureReason;
import com.tribune.aggregator.domain.enums.FetchStrategy;
import com.tribune.aggregator.exception.FetchException;
import com.tribune.aggregator.integration.http.HttpPageClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;

/**
 * RSS/Atom strategy backed by Rome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedSourceFetcher implements SourceFetcher {

    // Placeholder summaries some feeds emit instead of real text.
    private static final List<Pattern> JUNK_SUMMARIES = List.of(
            Pattern.compile("^comments$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^read more$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^continue reading$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^view article$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^click here$", Pattern.CASE_INSENSITIVE)
    );

    private static final int MIN_SUMMARY_LENGTH = 20;

    private final HttpPageClient httpPageClient;

    @Value("${crawler.request-timeout-seconds:10}")
    private int requestTimeoutSeconds;

    @Override
    public FetchStrategy strategy() {
        return FetchStrategy.FEED;
    }

    @Override
    public List<RawRecord> fetch(Source source) {
        long t0 = System.currentTimeMillis();
        log.info("RSS: fetching feed sourceId={} sourceName='{}' feedUrl={}",
                source.getId(), source.getName(), source.getUrl());

        try {
            HttpPageClient.PageResponse page = httpPageClient.get(
                    source.getUrl(), HttpPageClient.ACCEPT_FEED, Duration.ofSeconds(requestTimeoutSeconds));

            List<RawRecord> out = new ArrayList<>();
            try (InputStream is = new ByteArrayInputStream(page.body()); XmlReader reader = new XmlReader(is)) {
                SyndFeed feed = new SyndFeedInput().build(reader);
                for (SyndEntry entry : feed.getEntries()) {
                    out.add(toRecord(entry));
                }
            }

            log.info("RSS: feed done sourceId={} entries={} tookMs={}",
                    source.getId(), out.size(), System.currentTimeMillis() - t0);
            return out;

        } catch (Exception e) {
            throw new FetchException(FetchFailureReason.FEED_PARSE_FAILED, e.getMessage(), e);
        }
    }

    private RawRecord toRecord(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();

        return RawRecord.builder()
                .title(entry.getTitle())
                .link(entry.getLink())
                .summary(summaryOf(entry))
                .author(entry.getAuthor())
                .pubDate(date == null ? null : date.toInstant().toString())
                .image(firstEnclosureUrl(entry))
                .build();
    }

    private String summaryOf(SyndEntry entry) {
        String html = null;
        if (entry.getDescription() != null) {
            html = entry.getDescription().getValue();
        }
        if ((html == null || html.isBlank()) && entry.getContents() != null) {
            html = entry.getContents().stream()
                    .map(SyndContent::getValue)
                    .filter(v -> v != null && !v.isBlank())
                    .findFirst()
                    .orElse(null);
        }
        if (html == null) return "";

        String text = Jsoup.parse(html).text().trim();
        return isJunk(text) ? "" : text;
    }

    static boolean isJunk(String summary) {
        String t = summary.trim();
        if (t.length() < MIN_SUMMARY_LENGTH) return true;
        return JUNK_SUMMARIES.stream().anyMatch(p -> p.matcher(t).matches());
    }

    private static String firstEnclosureUrl(SyndEntry entry) {
        if (entry.getEnclosures() == null) return null;
        return entry.getEnclosures().stream()
                .map(SyndEnclosure::getUrl)
                .filter(u -> u != null && !u.isBlank())
                .findFirst()
                .orElse(null);
    }
}
