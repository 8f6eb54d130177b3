package com.platform.clusterchaos.chaos;

import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import com.platform.clusterchaos.model.ClusterTopology;
import com.platform.clusterchaos.model.ExistTally;
import com.platform.clusterchaos.model.Node;
import com.platform.clusterchaos.model.Workload;
import com.platform.clusterchaos.model.WorkloadOperation;
import com.platform.clusterchaos.observability.StructuredLogger;
import com.platform.clusterchaos.state.RunPhase;
import com.platform.clusterchaos.state.RunState;
import com.platform.clusterchaos.verify.ResultVerifier;
import com.platform.clusterchaos.workload.WorkloadDriverAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Put, get and exist of the configured range with no failure injection. The put goes to
 * node 0, the get to node 1 and the exist to node 2, wrapping around on smaller clusters,
 * so reads are served by a node other than the writer whenever there is one.
 */
@Slf4j
@Component
public class SmokeScenario implements HarnessScenario {

    private final HarnessProperties properties;
    private final WorkloadDriverAdapter workloadDriver;
    private final ResultVerifier verifier;
    private final StructuredLogger structuredLogger;

    public SmokeScenario(
            HarnessProperties properties,
            WorkloadDriverAdapter workloadDriver,
            ResultVerifier verifier,
            StructuredLogger structuredLogger) {
        this.properties = properties;
        this.workloadDriver = workloadDriver;
        this.verifier = verifier;
        this.structuredLogger = structuredLogger;
    }

    @Override
    public Scenario getScenario() {
        return Scenario.SMOKE;
    }

    @Override
    public RunReport run(String runId) {
        long startTime = System.currentTimeMillis();
        RunState state = new RunState(runId, structuredLogger);
        ClusterTopology topology = ClusterTopology.from(properties.cluster());
        Node writer = target(topology, 0);
        Node reader = target(topology, 1);
        Node counter = target(topology, 2);
        long count = properties.load().count();
        List<String> checks = new ArrayList<>();

        try {
            state.transition(RunPhase.BASELINE_WRITE,
                "writing " + count + " records to node " + writer.getIndex());
            verifier.verifyNoErrors(workloadDriver.run(workload(WorkloadOperation.PUT, writer)));
            state.addWritten(count);
            checks.add("put " + count + " ok");

            state.transition(RunPhase.FINAL_VERIFY,
                "reading back from node " + reader.getIndex() + ", counting on node " + counter.getIndex());
            verifier.verifyNoErrors(workloadDriver.run(workload(WorkloadOperation.GET, reader)));
            checks.add("get " + count + " ok");

            ExistTally tally = verifier.verifyExist(workloadDriver.run(workload(WorkloadOperation.EXIST, counter)), count);
            checks.add("exist " + tally);

            state.transition(RunPhase.DONE, "all checks passed");
        } catch (RuntimeException e) {
            state.fail(e);
            throw e;
        }

        return new RunReport(runId, getScenario(), state.phase(), state.written(), checks,
            state.history(), Duration.ofMillis(System.currentTimeMillis() - startTime));
    }

    private static Node target(ClusterTopology topology, int step) {
        return topology.node(step % topology.size());
    }

    private Workload workload(WorkloadOperation operation, Node node) {
        return Workload.template(properties.load(), properties.cluster().host())
            .operation(operation)
            .first(properties.load().first())
            .count(properties.load().count())
            .port(node.getTransportPort())
            .build();
    }
}
