package com.errorengine.source;

import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.SourceType;

import java.time.Duration;

/**
 * Fetches the rows of a monitored query from one kind of source.
 */
public interface SourceAdapter {

    SourceType sourceType();

    /**
     * Execute the query. Implementations should honor the timeout themselves where the underlying
     * client supports it; {@link SourceFetcher} additionally cancels fetches that overrun it.
     *
     * @param query query definition
     * @param timeout fetch timeout
     * @return rows and columns
     * @throws SourceException on connection, query or response failures
     */
    SourceResult fetch(MonitoredQuery query, Duration timeout) throws SourceException;
}
