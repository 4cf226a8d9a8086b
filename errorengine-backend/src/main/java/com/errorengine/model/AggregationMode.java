package com.errorengine.model;

/**
 * How routed errors are grouped into notifications.
 */
public enum AggregationMode {
    PER_RECIPIENT, PER_ERROR
}
