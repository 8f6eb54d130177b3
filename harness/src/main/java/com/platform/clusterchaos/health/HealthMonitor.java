package com.platform.clusterchaos.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.core.BackoffPolicy;
import com.platform.clusterchaos.core.PollOutcome;
import com.platform.clusterchaos.core.PollResult;
import com.platform.clusterchaos.core.RetryEngine;
import com.platform.clusterchaos.error.ErrorCode;
import com.platform.clusterchaos.error.HealthCheckException;
import com.platform.clusterchaos.model.ClusterTopology;
import com.platform.clusterchaos.model.Node;
import com.platform.clusterchaos.model.NodeStatus;
import com.platform.clusterchaos.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Readiness gate over the nodes' metrics endpoints.
 *
 * Nodes are checked strictly in index order, each under its own backoff budget,
 * so the worst-case wait adds up across nodes.
 */
@Slf4j
@Component
public class HealthMonitor {

    static final String BACKEND_STATE_METRIC = "backend.backend_state";
    static final int READY_VALUE = 1;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RetryEngine retryEngine;
    private final StructuredLogger structuredLogger;
    private final HarnessProperties.Cluster cluster;
    private final BackoffPolicy backoffPolicy;

    public HealthMonitor(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            RetryEngine retryEngine,
            StructuredLogger structuredLogger,
            HarnessProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.retryEngine = retryEngine;
        this.structuredLogger = structuredLogger;
        this.cluster = properties.cluster();
        this.backoffPolicy = BackoffPolicy.from(properties.health());
    }

    /**
     * Block until every node reports a ready backend.
     *
     * @throws HealthCheckException naming the first node that stayed unhealthy or returned an undecodable payload
     */
    public void awaitHealthy(ClusterTopology topology) {
        for (Node node : topology.nodes()) {
            awaitHealthy(node);
        }
        log.info("All nodes are ready!");
    }

    void awaitHealthy(Node node) {
        node.markStatus(NodeStatus.POLLING);
        String target = "node-" + node.getIndex();

        PollResult result = retryEngine.pollUntilReady(target, backoffPolicy, () -> probe(node));

        if (!result.ready()) {
            node.markStatus(NodeStatus.UNKNOWN);
            throw HealthCheckException.unhealthy(node.getIndex(), result.attempts(), result.lastReason());
        }

        node.markStatus(NodeStatus.HEALTHY);
        log.info("Node {} is ready!", node.getIndex());
        structuredLogger.chaos().nodeHealthy(node.getIndex(), node.getRestPort(), result.attempts());
    }

    /**
     * One metrics request, classified.
     */
    PollOutcome probe(Node node) {
        String url = metricsUrl(node);
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(url, String.class);
        } catch (ResourceAccessException e) {
            return PollOutcome.retry(ErrorCode.HEALTH_ENDPOINT_UNREACHABLE,
                String.format("Failed to get metrics from node %d: %s",
                node.getIndex(), e.getMessage()));
        } catch (RestClientResponseException e) {
            return PollOutcome.retry(ErrorCode.HEALTH_ENDPOINT_STATUS,
                String.format("Failed to get response from node %d (status %d)",
                node.getIndex(), e.getStatusCode().value()));
        }

        if (response.getStatusCode().value() != 200) {
            return PollOutcome.retry(ErrorCode.HEALTH_ENDPOINT_STATUS,
                String.format("Failed to get response from node %d (status %d)",
                node.getIndex(), response.getStatusCode().value()));
        }

        JsonNode metrics;
        try {
            metrics = objectMapper.readTree(response.getBody() == null ? "" : response.getBody());
        } catch (JsonProcessingException e) {
            return PollOutcome.fatal(HealthCheckException.malformedPayload(node.getIndex(), e));
        }

        JsonNode value = backendStateValue(metrics);
        if (value == null || !value.isNumber()) {
            // Kept retryable: a schema mismatch only surfaces once the attempts run out.
            return PollOutcome.retry(ErrorCode.BACKEND_STATE_MISSING, String.format("%s on node %d",
                ErrorCode.BACKEND_STATE_MISSING.getDefaultMessage(), node.getIndex()));
        }
        if (value.asInt() != READY_VALUE) {
            return PollOutcome.retry(ErrorCode.BACKEND_NOT_READY,
                String.format("Backend is down on node %d (state %s)",
                node.getIndex(), value.asText()));
        }
        return PollOutcome.ready();
    }

    /**
     * {@code metrics["backend.backend_state"].value}, falling back to the nested
     * {@code metrics.backend.backend_state.value} layout.
     */
    static JsonNode backendStateValue(JsonNode root) {
        if (root == null) {
            return null;
        }
        JsonNode metrics = root.get("metrics");
        if (metrics == null || !metrics.isObject()) {
            return null;
        }
        JsonNode state = metrics.get(BACKEND_STATE_METRIC);
        if (state == null) {
            JsonNode backend = metrics.get("backend");
            state = backend == null ? null : backend.get("backend_state");
        }
        return state == null ? null : state.get("value");
    }

    String metricsUrl(Node node) {
        return String.format("http://%s:%d/metrics", cluster.restHost(), node.getRestPort());
    }
}
