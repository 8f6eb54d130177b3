package com.platform.clusterchaos.model;

/**
 * Health of a single node as last observed by the harness.
 */
public enum NodeStatus {
    /**
     * Not checked since the run started or since the last restart.
     */
    UNKNOWN,

    /**
     * Backend reported ready.
     */
    HEALTHY,

    /**
     * Container stopped by the harness.
     */
    DOWN,

    /**
     * Readiness wait in progress.
     */
    POLLING;

    public boolean isHealthy() {
        return this == HEALTHY;
    }
}
