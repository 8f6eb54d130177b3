package com.platform.clusterchaos.chaos;

import com.platform.clusterchaos.error.ErrorCode;
import com.platform.clusterchaos.error.VerificationFailedException;
import com.platform.clusterchaos.model.SummaryScore;
import com.platform.clusterchaos.observability.MdcKeys;
import com.platform.clusterchaos.observability.StructuredLogger;
import com.platform.clusterchaos.state.PhaseTransition;
import com.platform.clusterchaos.state.RunPhase;
import com.platform.clusterchaos.verify.ResultVerifier;
import com.platform.clusterchaos.workload.OperationTesterAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

class OperationTestScenarioTest {

    @Mock OperationTesterAdapter mockTester;

    private AutoCloseable closeable;
    private OperationTestScenario scenario;

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);
        scenario = new OperationTestScenario(mockTester, new ResultVerifier(), new StructuredLogger());
    }

    @AfterEach
    void tearDown() throws Exception {
        MDC.clear();
        closeable.close();
    }

    @Test
    void completeSummaryPasses() {
        when(mockTester.run()).thenReturn(new SummaryScore(40, 40));

        RunReport report = scenario.run("ops-1");

        assertThat(report.passed()).isTrue();
        assertThat(report.checks()).containsExactly("summary 40/40");
        assertThat(report.history()).extracting(PhaseTransition::to)
            .containsExactly(RunPhase.FINAL_VERIFY, RunPhase.DONE);
    }

    @Test
    void incompleteSummaryFails() {
        when(mockTester.run()).thenReturn(new SummaryScore(39, 40));

        assertThatThrownBy(() -> scenario.run("ops-2"))
            .isInstanceOfSatisfying(VerificationFailedException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SUMMARY_INCOMPLETE));
        assertThat(MDC.get(MdcKeys.PHASE)).isEqualTo(RunPhase.FAILED.name());
    }

    @Test
    void unexpectedErrorEndsTheRunFailed() {
        when(mockTester.run()).thenThrow(new IllegalArgumentException("bad tester arguments"));

        assertThatThrownBy(() -> scenario.run("ops-3")).isInstanceOf(IllegalArgumentException.class);
        assertThat(MDC.get(MdcKeys.PHASE)).isEqualTo(RunPhase.FAILED.name());
    }
}
