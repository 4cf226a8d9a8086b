package com.errorengine.lifecycle;

import com.errorengine.config.ConfigurationException;

import java.util.Collection;

/**
 * Thrown when a fetched row does not contain one of the query's key fields. The whole fetch is
 * rejected and no lifecycle changes are made.
 */
public class KeyFieldMissingException extends ConfigurationException {

    public KeyFieldMissingException(String keyField, Collection<String> availableColumns) {
        super("key_fields", "Key field '" + keyField + "' not found in result columns " + availableColumns);
    }
}
