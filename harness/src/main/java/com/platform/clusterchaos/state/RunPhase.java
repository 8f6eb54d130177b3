package com.platform.clusterchaos.state;

/**
 * Phases of a harness run. Every run is in exactly one of these.
 */
public enum RunPhase {
    /**
     * Validating input and resolving containers.
     * Transitions: BASELINE_WRITE, FINAL_VERIFY, FAILED
     */
    INIT,

    /**
     * Writing the per-node quota to the current node.
     * Transitions: STOP_NODE, RESTART_ALL, FINAL_VERIFY, FAILED
     */
    BASELINE_WRITE,

    /**
     * Stopping the node that was just written to.
     * Transitions: VERIFY_RUNNING, FAILED
     */
    STOP_NODE,

    /**
     * Confirming the stopped container is reported as exited.
     * Transitions: BASELINE_WRITE, FAILED
     */
    VERIFY_RUNNING,

    /**
     * Starting every stopped container.
     * Transitions: AWAIT_HEALTHY, FAILED
     */
    RESTART_ALL,

    /**
     * Waiting for every backend to report ready.
     * Transitions: FINAL_VERIFY, FAILED
     */
    AWAIT_HEALTHY,

    /**
     * Reading back everything written.
     * Transitions: DONE, FAILED
     */
    FINAL_VERIFY,

    /**
     * All checks passed.
     */
    DONE,

    /**
     * Stopped at the first hard failure.
     */
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
