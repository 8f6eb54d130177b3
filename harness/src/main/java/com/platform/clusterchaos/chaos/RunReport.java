package com.platform.clusterchaos.chaos;

import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import com.platform.clusterchaos.state.PhaseTransition;
import com.platform.clusterchaos.state.RunPhase;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a completed run.
 */
public record RunReport(
    String runId,
    Scenario scenario,
    RunPhase finalPhase,
    long written,
    List<String> checks,
    List<PhaseTransition> history,
    Duration elapsed
) {

    public boolean passed() {
        return finalPhase == RunPhase.DONE;
    }

    /**
     * Returns a human-readable summary of the run.
     */
    public String summary() {
        return String.format("%s run %s: %s, %d records written, checks %s, %ds",
            scenario, runId, finalPhase, written, checks, elapsed.toSeconds());
    }
}
