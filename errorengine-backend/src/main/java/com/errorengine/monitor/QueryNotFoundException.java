package com.errorengine.monitor;

/**
 * Thrown when a monitored query id does not exist.
 */
public class QueryNotFoundException extends RuntimeException {

    public QueryNotFoundException(long queryId) {
        super("Query not found: " + queryId);
    }
}
