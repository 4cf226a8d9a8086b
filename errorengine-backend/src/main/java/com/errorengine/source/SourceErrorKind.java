package com.errorengine.source;

public enum SourceErrorKind {
    /** Database or endpoint unreachable, authentication failed, non-2xx response. */
    CONNECTION,
    /** The fetch exceeded its timeout and was cancelled. */
    TIMEOUT,
    /** The database rejected the query text. */
    MALFORMED_QUERY,
    /** The endpoint answered with something that cannot be turned into rows. */
    INVALID_RESPONSE,
    /** The query references a missing or inactive data source, or lacks required settings. */
    CONFIGURATION
}
