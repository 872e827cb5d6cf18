package com.tribune.aggregator.source;

import com.tribune.aggregator.domain.dto.RawRecord;
import com.tribune.aggregator.domain.entity.Source;
import com.tribune.aggregator.domain.enums.FetchStrategy;

import java.util.List;

/**
 * One fetch strategy. Implementations make a single outbound request per call and never
 * touch the store.
 *
 * @see SourceFetchService
 */
public interface SourceFetcher {

    FetchStrategy strategy();

    /**
     * @throws com.tribune.aggregator.exception.FetchException on network, parse or configuration errors
     */
    List<RawRecord> fetch(Source source);
}
