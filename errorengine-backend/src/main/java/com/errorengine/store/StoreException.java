package com.errorengine.store;

/**
 * Thrown when the state store cannot read or write.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
