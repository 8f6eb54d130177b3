package com.platform.clusterchaos.state;

import java.time.Instant;

/**
 * One audited phase change.
 */
public record PhaseTransition(RunPhase from, RunPhase to, String reason, Instant at) {

    @Override
    public String toString() {
        return String.format("%s -> %s (%s)", from, to, reason);
    }
}
