package com.platform.clusterchaos.chaos;

import com.platform.clusterchaos.config.HarnessProperties.Scenario;

/**
 * One test flow the runner can execute.
 */
public interface HarnessScenario {

    /**
     * Run the flow to completion.
     *
     * @param runId identifier carried in logs and the report
     * @return report of a run that reached DONE
     * @throws com.platform.clusterchaos.error.HarnessException at the first hard failure
     */
    RunReport run(String runId);

    /**
     * The scenario this implementation handles.
     */
    Scenario getScenario();
}
