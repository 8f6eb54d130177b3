package com.platform.clusterchaos.observability;

/**
 * MDC keys shared by the log pattern and structured events.
 */
public final class MdcKeys {

    public static final String RUN_ID = "runId";
    public static final String PHASE = "phase";

    private MdcKeys() {
    }
}
