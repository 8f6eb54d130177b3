package com.platform.clusterchaos.lifecycle;

import com.platform.clusterchaos.Fixtures;
import com.platform.clusterchaos.chaos.HarnessScenario;
import com.platform.clusterchaos.chaos.RunReport;
import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import com.platform.clusterchaos.error.HealthCheckException;
import com.platform.clusterchaos.error.VerificationFailedException;
import com.platform.clusterchaos.observability.MdcKeys;
import com.platform.clusterchaos.observability.MetricsRegistry;
import com.platform.clusterchaos.observability.StructuredLogger;
import com.platform.clusterchaos.state.RunPhase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.MDC;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class HarnessRunnerTest {

    @Mock HarnessScenario mockScenario;

    private AutoCloseable closeable;
    private ByteArrayOutputStream stderr;
    private HarnessRunner runner;

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);
        stderr = new ByteArrayOutputStream();
        runner = runner(Map.of(Scenario.ALIENS, mockScenario));
    }

    @AfterEach
    void tearDown() throws Exception {
        closeable.close();
    }

    @Test
    void passedRunExitsZeroQuietly() {
        when(mockScenario.run(anyString())).thenReturn(
            new RunReport("r", Scenario.ALIENS, RunPhase.DONE, 9, List.of("exist 9 of 9"), List.of(), Duration.ZERO));

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(HarnessRunner.EXIT_OK);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(MDC.get(MdcKeys.RUN_ID)).isNull();
    }

    @Test
    void testFailureExitsOneWithSingleDiagnostic() {
        when(mockScenario.run(anyString())).thenThrow(VerificationFailedException.existMismatch(6, 9, 9));

        assertThat(runner.execute("run-1")).isEqualTo(HarnessRunner.EXIT_TEST_FAILURE);
        assertThat(stderr.toString(StandardCharsets.UTF_8).lines())
            .containsExactly("[CH-510] 6 of 9 keys (expected 9), exist test failed, see output");
    }

    @Test
    void harnessErrorExitsTwo() {
        when(mockScenario.run(anyString())).thenThrow(HealthCheckException.unhealthy(2, 10, "Backend is down"));

        assertThat(runner.execute("run-2")).isEqualTo(HarnessRunner.EXIT_FATAL);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).startsWith("[CH-220] Node 2 is not healthy");
    }

    @Test
    void unexpectedErrorExitsTwo() {
        when(mockScenario.run(anyString())).thenThrow(new IllegalStateException("boom"));

        assertThat(runner.execute("run-3")).isEqualTo(HarnessRunner.EXIT_FATAL);
        assertThat(stderr.toString(StandardCharsets.UTF_8)).startsWith("[CH-901]").contains("boom");
    }

    @Test
    void unregisteredScenarioExitsTwo() {
        HarnessRunner empty = runner(Map.of());

        assertThat(empty.execute("run-4")).isEqualTo(HarnessRunner.EXIT_FATAL);
    }

    private HarnessRunner runner(Map<Scenario, HarnessScenario> scenarios) {
        return new HarnessRunner(Fixtures.properties(3, 9), scenarios, new StructuredLogger(),
            new MetricsRegistry(new SimpleMeterRegistry()), new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }
}
