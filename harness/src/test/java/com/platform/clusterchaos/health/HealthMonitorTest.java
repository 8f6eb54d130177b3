package com.platform.clusterchaos.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.clusterchaos.Fixtures;
import com.platform.clusterchaos.core.PollOutcome;
import com.platform.clusterchaos.core.RecordingSleeper;
import com.platform.clusterchaos.core.RetryEngine;
import com.platform.clusterchaos.error.ErrorCode;
import com.platform.clusterchaos.error.HealthCheckException;
import com.platform.clusterchaos.model.ClusterTopology;
import com.platform.clusterchaos.model.Node;
import com.platform.clusterchaos.model.NodeStatus;
import com.platform.clusterchaos.observability.MetricsRegistry;
import com.platform.clusterchaos.observability.StructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.http.HttpMethod.GET;

class HealthMonitorTest {

    private static final String NODE_0 = "http://127.0.0.1:8000/metrics";
    private static final String NODE_1 = "http://127.0.0.1:8001/metrics";
    private static final String READY = "{\"metrics\":{\"backend.backend_state\":{\"value\":1,\"timestamp\":1700000000}}}";
    private static final String DOWN = "{\"metrics\":{\"backend.backend_state\":{\"value\":0}}}";

    private MockRestServiceServer server;
    private RecordingSleeper sleeper;
    private HealthMonitor healthMonitor;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        sleeper = new RecordingSleeper();
        RetryEngine retryEngine = new RetryEngine(sleeper, new MetricsRegistry(new SimpleMeterRegistry()));
        healthMonitor = new HealthMonitor(restTemplate, new ObjectMapper(), retryEngine,
            new StructuredLogger(), Fixtures.properties(1, 9));
    }

    @Test
    void serverErrorThenReadyIsHealthy() {
        server.expect(requestTo(NODE_0)).andExpect(method(GET)).andRespond(withServerError());
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(READY, MediaType.APPLICATION_JSON));
        ClusterTopology topology = topology(1);

        healthMonitor.awaitHealthy(topology);

        server.verify();
        assertThat(topology.node(0).getStatus()).isEqualTo(NodeStatus.HEALTHY);
        assertThat(sleeper.sleeps()).hasSize(1);
    }

    @Test
    void missingBackendStateIsRetried() {
        server.expect(requestTo(NODE_0)).andRespond(withSuccess("{\"metrics\":{}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(READY, MediaType.APPLICATION_JSON));

        healthMonitor.awaitHealthy(topology(1));

        server.verify();
    }

    @Test
    void backendDownIsRetried() {
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(DOWN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(READY, MediaType.APPLICATION_JSON));

        healthMonitor.awaitHealthy(topology(1));

        server.verify();
    }

    @Test
    void nestedMetricLayoutIsAccepted() {
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(
            "{\"metrics\":{\"backend\":{\"backend_state\":{\"value\":1}}}}", MediaType.APPLICATION_JSON));

        healthMonitor.awaitHealthy(topology(1));

        server.verify();
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void undecodablePayloadFailsWithoutRetry() {
        server.expect(ExpectedCount.once(), requestTo(NODE_0))
            .andRespond(withSuccess("<html>bad gateway</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> healthMonitor.awaitHealthy(topology(1)))
            .isInstanceOfSatisfying(HealthCheckException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MALFORMED_HEALTH_PAYLOAD);
                assertThat(e.isFatal()).isTrue();
            });
        server.verify();
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void exhaustedAttemptsNameTheNode() {
        server.expect(ExpectedCount.times(3), requestTo(NODE_0)).andRespond(withServerError());
        ClusterTopology topology = topology(1);

        assertThatThrownBy(() -> healthMonitor.awaitHealthy(topology))
            .isInstanceOfSatisfying(HealthCheckException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NODE_UNHEALTHY);
                assertThat(e.getNodeIndex()).isEqualTo(0);
                assertThat(e.getMessage()).startsWith("Node 0 is not healthy after 3 attempts");
            });
        server.verify();
        assertThat(sleeper.sleeps()).hasSize(2);
        assertThat(topology.node(0).getStatus()).isEqualTo(NodeStatus.UNKNOWN);
    }

    @Test
    void nodesArePolledInIndexOrder() {
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(READY, MediaType.APPLICATION_JSON));
        server.expect(requestTo(NODE_1)).andRespond(withServerError());
        server.expect(requestTo(NODE_1)).andRespond(withSuccess(READY, MediaType.APPLICATION_JSON));
        ClusterTopology topology = topology(2);

        healthMonitor.awaitHealthy(topology);

        server.verify();
        assertThat(topology.allHealthy()).isTrue();
    }

    @Test
    void retryableOutcomesCarryTheirCause() {
        server.expect(requestTo(NODE_0)).andRespond(withServerError());
        server.expect(requestTo(NODE_0)).andRespond(withSuccess("{\"metrics\":{}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(DOWN, MediaType.APPLICATION_JSON));
        server.expect(requestTo(NODE_0)).andRespond(withSuccess(READY, MediaType.APPLICATION_JSON));
        Node node = topology(1).node(0);

        PollOutcome serverError = healthMonitor.probe(node);
        PollOutcome missing = healthMonitor.probe(node);
        PollOutcome down = healthMonitor.probe(node);
        PollOutcome ready = healthMonitor.probe(node);

        server.verify();
        assertThat(serverError.kind()).isEqualTo(PollOutcome.Kind.RETRY);
        assertThat(serverError.code()).isEqualTo(ErrorCode.HEALTH_ENDPOINT_STATUS);
        assertThat(missing.code()).isEqualTo(ErrorCode.BACKEND_STATE_MISSING);
        assertThat(down.code()).isEqualTo(ErrorCode.BACKEND_NOT_READY);
        assertThat(down.reason()).isEqualTo("Backend is down on node 0 (state 0)");
        assertThat(ready.kind()).isEqualTo(PollOutcome.Kind.READY);
    }

    @Test
    void unreachableEndpointIsRetryable() {
        RestTemplate unreachable = new RestTemplate();
        MockRestServiceServer refusing = MockRestServiceServer.bindTo(unreachable).build();
        refusing.expect(requestTo(NODE_0)).andRespond(request -> {
            throw new ConnectException("Connection refused");
        });
        HealthMonitor monitor = new HealthMonitor(unreachable, new ObjectMapper(),
            new RetryEngine(sleeper, new MetricsRegistry(new SimpleMeterRegistry())),
            new StructuredLogger(), Fixtures.properties(1, 9));

        PollOutcome outcome = monitor.probe(topology(1).node(0));

        assertThat(outcome.kind()).isEqualTo(PollOutcome.Kind.RETRY);
        assertThat(outcome.code()).isEqualTo(ErrorCode.HEALTH_ENDPOINT_UNREACHABLE);
        assertThat(outcome.reason()).startsWith("Failed to get metrics from node 0");
    }

    private static ClusterTopology topology(int nodes) {
        return ClusterTopology.from(Fixtures.properties(nodes, 9).cluster());
    }
}
