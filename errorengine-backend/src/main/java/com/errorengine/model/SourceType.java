package com.errorengine.model;

/**
 * Where a monitored query fetches its rows from.
 */
public enum SourceType {
    DATABASE, HTTP
}
