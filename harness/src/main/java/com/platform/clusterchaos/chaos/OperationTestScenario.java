package com.platform.clusterchaos.chaos;

import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import com.platform.clusterchaos.model.SummaryScore;
import com.platform.clusterchaos.observability.StructuredLogger;
import com.platform.clusterchaos.state.RunPhase;
import com.platform.clusterchaos.state.RunState;
import com.platform.clusterchaos.verify.ResultVerifier;
import com.platform.clusterchaos.workload.OperationTesterAdapter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Runs the randomized operation tester once against the first node's REST API.
 * The run passes only when the tester's final summary reports every operation as passed;
 * no records are written by the harness itself.
 */
@Component
public class OperationTestScenario implements HarnessScenario {

    private final OperationTesterAdapter operationTester;
    private final ResultVerifier verifier;
    private final StructuredLogger structuredLogger;

    public OperationTestScenario(
            OperationTesterAdapter operationTester,
            ResultVerifier verifier,
            StructuredLogger structuredLogger) {
        this.operationTester = operationTester;
        this.verifier = verifier;
        this.structuredLogger = structuredLogger;
    }

    @Override
    public Scenario getScenario() {
        return Scenario.OPERATION_TEST;
    }

    @Override
    public RunReport run(String runId) {
        long startTime = System.currentTimeMillis();
        RunState state = new RunState(runId, structuredLogger);
        SummaryScore score;

        try {
            state.transition(RunPhase.FINAL_VERIFY, "running operation tester");
            score = verifier.verifySummary(operationTester.run());
            state.transition(RunPhase.DONE, "summary " + score);
        } catch (RuntimeException e) {
            state.fail(e);
            throw e;
        }

        return new RunReport(runId, getScenario(), state.phase(), 0, List.of("summary " + score),
            state.history(), Duration.ofMillis(System.currentTimeMillis() - startTime));
    }
}
