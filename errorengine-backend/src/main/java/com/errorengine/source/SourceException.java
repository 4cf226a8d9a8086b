package com.errorengine.source;

/**
 * A fetch failed. The cycle is aborted before any lifecycle change.
 */
public class SourceException extends Exception {

    private final SourceErrorKind kind;

    public SourceException(SourceErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SourceException(SourceErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SourceErrorKind getKind() {
        return kind;
    }
}
