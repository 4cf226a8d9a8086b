package com.errorengine.source;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.SourceType;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Picks the adapter for a query's source type and bounds the fetch by the query timeout. A fetch
 * that overruns is cancelled (its thread interrupted) and reported as {@link SourceErrorKind#TIMEOUT}.
 */
@Service
public class SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(SourceFetcher.class);

    private final Map<SourceType, SourceAdapter> adapters = new EnumMap<>(SourceType.class);
    private final ErrorEngineProperties properties;
    private final ExecutorService fetchExecutor;

    public SourceFetcher(List<SourceAdapter> adapters, ErrorEngineProperties properties) {
        for (SourceAdapter adapter : adapters) {
            this.adapters.put(adapter.sourceType(), adapter);
        }
        this.properties = properties;
        this.fetchExecutor = Executors.newCachedThreadPool(new CustomizableThreadFactory("errorengine-fetch-"));
    }

    /**
     * Fetch the rows of a query.
     *
     * @param query query
     * @return rows
     * @throws SourceException on adapter failure, timeout or cancellation
     */
    public SourceResult fetch(MonitoredQuery query) throws SourceException {
        SourceAdapter adapter = adapters.get(query.getSourceType());
        if (adapter == null) {
            throw new SourceException(SourceErrorKind.CONFIGURATION, "no adapter for source type " + query.getSourceType());
        }
        Duration timeout = timeoutOf(query);

        Future<SourceResult> future = fetchExecutor.submit(() -> adapter.fetch(query, timeout));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SourceException(SourceErrorKind.TIMEOUT,
                    "fetch exceeded " + timeout.toSeconds() + "s and was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceException(SourceErrorKind.TIMEOUT, "fetch interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceException se) {
                throw se;
            }
            throw new SourceException(SourceErrorKind.CONNECTION,
                    "fetch failed: " + (cause != null ? cause.getMessage() : e.getMessage()), cause != null ? cause : e);
        }
    }

    Duration timeoutOf(MonitoredQuery query) {
        Integer seconds = query.getTimeoutSeconds();
        if (seconds == null || seconds <= 0) {
            seconds = properties.getSource().getDefaultTimeoutSeconds();
        }
        return Duration.ofSeconds(seconds);
    }

    @PreDestroy
    public void shutdown() {
        fetchExecutor.shutdownNow();
    }
}
