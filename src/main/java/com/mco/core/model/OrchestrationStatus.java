package com.mco.core.model;

/**
 * Lifecycle status of an orchestration.
 * {@link #UNKNOWN} is only ever reported for ids the state store has never seen.
 */
public enum OrchestrationStatus {
    CREATED,
    RUNNING,
    COMPLETED,
    UNKNOWN
}
