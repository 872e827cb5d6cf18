package com.tribune.aggregator.source;

import com.tribune.aggregator.domain.dto.FetchResult;
import com.tribune.aggregator.domain.dto.RawRecord;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.FetchFailureReason;
import com.tribune.aggregator.domain.enums.FetchStrategy;
import com.tribune.aggregator.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the fetcher for a source's strategy and turns every failure into a {@link FetchResult}.
 */
@Slf4j
@Service
public class SourceFetchService {

    private final Map<FetchStrategy, SourceFetcher> fetchers = new EnumMap<>(FetchStrategy.class);

    public SourceFetchService(List<SourceFetcher> fetchers) {
        for (SourceFetcher f : fetchers) {
            this.fetchers.put(f.strategy(), f);
        }
    }

    public FetchResult fetch(Source source) {
        SourceFetcher fetcher = source.getStrategy() == null ? null : fetchers.get(source.getStrategy());
        if (fetcher == null) {
            log.warn("Fetch: no fetcher sourceId={} strategy={}", source.getId(), source.getStrategy());
            return FetchResult.failed(FetchFailureReason.UNSUPPORTED_STRATEGY, String.valueOf(source.getStrategy()));
        }

        try {
            List<RawRecord> records = fetcher.fetch(source);
            return FetchResult.succeeded(records);
        } catch (FetchException e) {
            FetchFailureReason reason = e.getReason() != null ? e.getReason() : defaultReason(source.getStrategy());
            log.warn("Fetch: failed sourceId={} reason={} err={}", source.getId(), reason.getCode(), e.getMessage());
            return FetchResult.failed(reason, e.getMessage());
        } catch (RuntimeException e) {
            FetchFailureReason reason = defaultReason(source.getStrategy());
            log.warn("Fetch: failed sourceId={} reason={} err={}", source.getId(), reason.getCode(), e.toString());
            return FetchResult.failed(reason, e.getMessage());
        }
    }

    private static FetchFailureReason defaultReason(FetchStrategy strategy) {
        return strategy == FetchStrategy.SCRAPE ? FetchFailureReason.SCRAPE_FAILED : FetchFailureReason.FEED_PARSE_FAILED;
    }
}
