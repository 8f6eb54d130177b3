package com.platform.clusterchaos.model;

import lombok.Getter;

/**
 * One storage node of the cluster under test.
 *
 * Identity (index and ports) is fixed for the run. The container handle is resolved
 * lazily before the first lifecycle command and invalidated after a full restart.
 */
@Getter
public class Node {

    private final int index;
    private final int transportPort;
    private final int restPort;

    private String containerId;
    private NodeStatus status = NodeStatus.UNKNOWN;

    public Node(int index, int transportPort, int restPort) {
        this.index = index;
        this.transportPort = transportPort;
        this.restPort = restPort;
    }

    public void assignContainer(String containerId) {
        this.containerId = containerId;
    }

    public boolean hasContainer() {
        return containerId != null;
    }

    /**
     * Container handle for a lifecycle command.
     *
     * @throws IllegalStateException if the handle was never resolved or was invalidated
     */
    public String requireContainerId() {
        if (containerId == null) {
            throw new IllegalStateException(
                "Container of node " + index + " is not resolved (or was invalidated by a restart)");
        }
        return containerId;
    }

    public void invalidateContainer() {
        this.containerId = null;
    }

    public void markStatus(NodeStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return String.format("node-%d(port=%d, rest=%d, %s)", index, transportPort, restPort, status);
    }
}
