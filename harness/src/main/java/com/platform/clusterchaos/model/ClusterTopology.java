package com.platform.clusterchaos.model;

import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of nodes for one run. Replica and quorum values are informational;
 * the harness only observes their effects through the verification checks.
 */
public class ClusterTopology {

    private final List<Node> nodes;
    private final Integer replicas;
    private final Integer quorum;

    public ClusterTopology(List<Node> nodes, Integer replicas, Integer quorum) {
        if (nodes.isEmpty()) {
            throw new ValidationException("nodesAmount", 0, "cluster needs at least one node");
        }
        Set<Integer> ports = new HashSet<>();
        for (Node node : nodes) {
            if (!ports.add(node.getTransportPort())) {
                throw new ValidationException("transportPort", node.getTransportPort(), "port is used by two nodes");
            }
        }
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.replicas = replicas;
        this.quorum = quorum;
    }

    /**
     * Lay out {@code nodesAmount} nodes on consecutive transport and REST ports.
     */
    public static ClusterTopology from(HarnessProperties.Cluster cluster) {
        List<Node> nodes = new ArrayList<>(cluster.nodesAmount());
        for (int i = 0; i < cluster.nodesAmount(); i++) {
            nodes.add(new Node(i, cluster.transportMinPort() + i, cluster.restMinPort() + i));
        }
        return new ClusterTopology(nodes, cluster.replicas(), cluster.quorum());
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Node node(int index) {
        return nodes.get(index);
    }

    public Node lastNode() {
        return nodes.get(nodes.size() - 1);
    }

    public int size() {
        return nodes.size();
    }

    public Integer replicas() {
        return replicas;
    }

    public Integer quorum() {
        return quorum;
    }

    public boolean allHealthy() {
        return nodes.stream().allMatch(node -> node.getStatus().isHealthy());
    }
}
