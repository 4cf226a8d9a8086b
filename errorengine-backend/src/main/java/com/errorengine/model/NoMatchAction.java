package com.errorengine.model;

/**
 * What happens to an error that no routing rule matches.
 */
public enum NoMatchAction {
    SEND_DEFAULT, SKIP
}
