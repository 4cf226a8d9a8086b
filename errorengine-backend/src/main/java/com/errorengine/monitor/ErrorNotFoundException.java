package com.errorengine.monitor;

/**
 * Thrown when an active error id does not exist.
 */
public class ErrorNotFoundException extends RuntimeException {

    public ErrorNotFoundException(long errorId) {
        super("Error not found: " + errorId);
    }
}
