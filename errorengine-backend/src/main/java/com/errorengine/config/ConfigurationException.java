package com.errorengine.config;

/**
 * Thrown when a query, rule, channel or data source definition is invalid.
 */
public class ConfigurationException extends RuntimeException {

    private final String field;

    /**
     * Create a new exception.
     *
     * @param field offending field, snake_case as in the JSON form
     * @param message error message
     */
    public ConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
