package com.platform.clusterchaos.chaos;

import com.platform.clusterchaos.cluster.ClusterController;
import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import com.platform.clusterchaos.core.Sleeper;
import com.platform.clusterchaos.error.ContainerRuntimeException;
import com.platform.clusterchaos.error.HarnessInterruptedException;
import com.platform.clusterchaos.error.ValidationException;
import com.platform.clusterchaos.health.HealthMonitor;
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
import java.util.Map;

/**
 * Failure-injection run: write a share of the records to each node and stop it,
 * keeping the last node up, then restart everything and read all records back
 * through the last node.
 *
 * {@code INIT -> BASELINE_WRITE -> {STOP_NODE, VERIFY_RUNNING} x (N-1) -> RESTART_ALL
 * -> AWAIT_HEALTHY -> FINAL_VERIFY -> DONE}. The first hard failure ends the run in FAILED.
 */
@Slf4j
@Component
public class ChaosOrchestrator implements HarnessScenario {

    private final HarnessProperties properties;
    private final ClusterController clusterController;
    private final WorkloadDriverAdapter workloadDriver;
    private final HealthMonitor healthMonitor;
    private final ResultVerifier verifier;
    private final Sleeper sleeper;
    private final StructuredLogger structuredLogger;

    public ChaosOrchestrator(
            HarnessProperties properties,
            ClusterController clusterController,
            WorkloadDriverAdapter workloadDriver,
            HealthMonitor healthMonitor,
            ResultVerifier verifier,
            Sleeper sleeper,
            StructuredLogger structuredLogger) {
        this.properties = properties;
        this.clusterController = clusterController;
        this.workloadDriver = workloadDriver;
        this.healthMonitor = healthMonitor;
        this.verifier = verifier;
        this.sleeper = sleeper;
        this.structuredLogger = structuredLogger;
    }

    @Override
    public Scenario getScenario() {
        return Scenario.ALIENS;
    }

    @Override
    public RunReport run(String runId) {
        return run(runId, ClusterTopology.from(properties.cluster()));
    }

    public RunReport run(String runId, ClusterTopology topology) {
        long startTime = System.currentTimeMillis();
        RunState state = new RunState(runId, structuredLogger);
        List<String> checks;

        try {
            long quota = recordsPerNode(topology);
            Map<Integer, String> containers = clusterController.resolveContainers(topology);

            baselineWrite(topology, state, quota);
            restartAll(topology, containers, state);
            awaitHealthy(topology, state);

            state.transition(RunPhase.FINAL_VERIFY, "reading back " + state.written() + " records");
            checks = finalVerify(topology, state.written());
            state.transition(RunPhase.DONE, "all checks passed");
        } catch (RuntimeException e) {
            state.fail(e);
            throw e;
        }

        return new RunReport(runId, getScenario(), state.phase(), state.written(), checks,
            state.history(), Duration.ofMillis(System.currentTimeMillis() - startTime));
    }

    /**
     * Per-node write quota: {@code count / nodesAmount}, remainder dropped.
     */
    long recordsPerNode(ClusterTopology topology) {
        long count = properties.load().count();
        int nodesAmount = topology.size();
        if (count < nodesAmount) {
            throw ValidationException.insufficientRecordCount(count, nodesAmount);
        }
        long quota = count / nodesAmount;
        long remainder = count % nodesAmount;
        if (remainder != 0) {
            log.warn("{} records do not split evenly over {} nodes; {} will be written, {} dropped",
                count, nodesAmount, quota * nodesAmount, remainder);
        }
        return quota;
    }

    private void baselineWrite(ClusterTopology topology, RunState state, long quota) {
        long first = properties.load().first();

        for (Node node : topology.nodes()) {
            state.transition(RunPhase.BASELINE_WRITE,
                String.format("writing %d records to node %d", quota, node.getIndex()));

            Workload put = workload(WorkloadOperation.PUT, first + state.written(), quota, node.getTransportPort());
            verifier.verifyNoErrors(workloadDriver.run(put));
            state.addWritten(quota);

            if (node == topology.lastNode()) {
                break;
            }

            pause(properties.timing().writeSettleDelay(), "letting data settle on node " + node.getIndex());

            state.transition(RunPhase.STOP_NODE, "stopping node " + node.getIndex());
            clusterController.stop(node);
            state.markDown(node.getIndex());

            state.transition(RunPhase.VERIFY_RUNNING, "confirming node " + node.getIndex() + " is down");
            List<String> exited = clusterController.listExited();
            if (!exited.contains(node.getContainerId())) {
                throw ContainerRuntimeException.notStopped(node.getContainerId(), node.getIndex());
            }
        }
        log.info("Baseline write complete: {} records on {} nodes", state.written(), topology.size());
    }

    private void restartAll(ClusterTopology topology, Map<Integer, String> containers, RunState state) {
        state.transition(RunPhase.RESTART_ALL, "restarting nodes " + state.downNodes());

        for (Map.Entry<Integer, String> entry : containers.entrySet()) {
            Node node = nodeOnPort(topology, entry.getKey());
            if (state.downNodes().contains(node.getIndex())) {
                clusterController.start(node);
            }
        }
        state.clearDown();

        // Handles resolved before the restart are not trusted afterwards.
        topology.nodes().forEach(Node::invalidateContainer);
    }

    private void awaitHealthy(ClusterTopology topology, RunState state) {
        state.transition(RunPhase.AWAIT_HEALTHY, "waiting for " + topology.size() + " backends");
        healthMonitor.awaitHealthy(topology);
        pause(properties.timing().postHealthSettleDelay(), "waiting for cluster start");
    }

    /**
     * Read-only verification of {@code written} records through the last node:
     * get, exist, then the doubled exist when enabled. Safe to repeat against an unchanged cluster.
     *
     * @return one line per passed check
     */
    public List<String> finalVerify(ClusterTopology topology, long written) {
        long first = properties.load().first();
        int port = topology.lastNode().getTransportPort();
        List<String> checks = new ArrayList<>();

        Workload get = workload(WorkloadOperation.GET, first, written, port);
        verifier.verifyNoErrors(workloadDriver.run(get));
        checks.add("get " + written + " ok");

        Workload exist = workload(WorkloadOperation.EXIST, first, written, port);
        ExistTally tally = verifier.verifyExist(workloadDriver.run(exist), written);
        checks.add("exist " + tally);

        HarnessProperties.DoubledExist doubled = properties.doubledExist();
        if (doubled.enabled()) {
            long start = doubled.start() != null ? doubled.start() : first;
            Workload doubledExist = workload(WorkloadOperation.EXIST, start, 2 * written + 1, port);
            ExistTally doubledTally = verifier.verifyDoubledExist(workloadDriver.run(doubledExist), written);
            checks.add("doubled-exist " + doubledTally);
        }
        return checks;
    }

    private Workload workload(WorkloadOperation operation, long first, long count, int port) {
        return Workload.template(properties.load(), properties.cluster().host())
            .operation(operation)
            .first(first)
            .count(count)
            .port(port)
            .build();
    }

    private static Node nodeOnPort(ClusterTopology topology, int port) {
        return topology.nodes().stream()
            .filter(node -> node.getTransportPort() == port)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No node on port " + port));
    }

    private void pause(Duration delay, String during) {
        log.info("Pausing {}s, {}", delay.toSeconds(), during);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessInterruptedException(during, e);
        }
    }
}
