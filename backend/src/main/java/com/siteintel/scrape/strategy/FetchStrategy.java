package com.siteintel.scrape.strategy;

import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.model.SiteMetadata;
import com.siteintel.scrape.model.StrategyKind;

/**
 * A pluggable page fetcher.
 *
 * <p>Implementations throw {@link com.siteintel.scrape.fetch.PageFetchException} when the page cannot be
 * retrieved; a record with blank content counts as a failed fetch for the caller.
 */
public interface FetchStrategy {

    StrategyKind kind();

    /**
     * Stateful strategies (a shared browser session, for example) are driven one page at a time.
     */
    boolean stateful();

    PageRecord fetch(String url, FetchContext context, SiteMetadata siteMetadata);
}
