package com.errorengine.model;

/**
 * Outcome of one orchestrator cycle.
 */
public enum ExecutionStatus {
    SUCCESS, SKIPPED, ERROR
}
