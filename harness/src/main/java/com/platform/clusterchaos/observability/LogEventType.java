package com.platform.clusterchaos.observability;

/**
 * Event types for structured log records.
 */
public enum LogEventType {
    RUN_STARTED,
    RUN_COMPLETED,
    RUN_FAILED,
    PHASE_TRANSITION,
    NODE_STOPPED,
    NODE_STARTED,
    NODE_HEALTHY,
    WORKLOAD_COMPLETED
}
