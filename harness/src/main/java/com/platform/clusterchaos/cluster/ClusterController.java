package com.platform.clusterchaos.cluster;

import com.platform.clusterchaos.error.ContainerNotFoundException;
import com.platform.clusterchaos.error.ContainerRuntimeException;
import com.platform.clusterchaos.model.ClusterTopology;
import com.platform.clusterchaos.model.Node;
import com.platform.clusterchaos.model.NodeStatus;
import com.platform.clusterchaos.observability.MetricsRegistry;
import com.platform.clusterchaos.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps nodes to their containers and drives container lifecycle.
 *
 * The mapping is resolved once per run and never revalidated; if the runtime replaces a
 * container in between, the next stop or start fails with a stale-mapping error.
 * Lifecycle commands are not retried: any runtime error is fatal for the run.
 */
@Slf4j
@Component
public class ClusterController {

    private final ContainerRuntime runtime;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;

    public ClusterController(ContainerRuntime runtime, StructuredLogger structuredLogger, MetricsRegistry metricsRegistry) {
        this.runtime = runtime;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Resolve every node's container by published transport port and attach the handles.
     *
     * @return port to container ID
     * @throws ContainerNotFoundException if a port has no running container
     * @throws ContainerRuntimeException if a port has several containers or the runtime is unreachable
     */
    public Map<Integer, String> resolveContainers(ClusterTopology topology) {
        Map<Integer, String> containers = new HashMap<>();
        for (Node node : topology.nodes()) {
            List<String> matches = runtime.findRunningByPublishedPort(node.getTransportPort());
            if (matches.isEmpty()) {
                throw new ContainerNotFoundException(node.getTransportPort());
            }
            if (matches.size() > 1) {
                throw ContainerRuntimeException.ambiguous(node.getTransportPort(), matches.size());
            }
            String containerId = matches.get(0);
            node.assignContainer(containerId);
            containers.put(node.getTransportPort(), containerId);
            log.debug("Node {} on port {} is container {}", node.getIndex(), node.getTransportPort(), containerId);
        }
        log.info("Resolved {} containers", containers.size());
        return containers;
    }

    public void stop(Node node) {
        String containerId = node.requireContainerId();
        runtime.stop(containerId, node.getTransportPort());
        node.markStatus(NodeStatus.DOWN);
        metricsRegistry.recordContainerAction("stop");
        log.info("Node {} stopped", node.getIndex());
        structuredLogger.chaos().nodeStopped(node.getIndex(), node.getTransportPort(), containerId);
    }

    public void start(Node node) {
        String containerId = node.requireContainerId();
        log.info("Starting node on port {}...", node.getTransportPort());
        runtime.start(containerId, node.getTransportPort());
        node.markStatus(NodeStatus.UNKNOWN);
        metricsRegistry.recordContainerAction("start");
        structuredLogger.chaos().nodeStarted(node.getIndex(), node.getTransportPort(), containerId);
    }

    public List<String> listExited() {
        List<String> exited = runtime.listExited();
        log.info("Stopped containers: {}", exited);
        return exited;
    }
}
