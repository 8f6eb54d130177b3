package com.platform.clusterchaos.state;

import com.platform.clusterchaos.error.ErrorCode;
import com.platform.clusterchaos.error.HarnessException;
import com.platform.clusterchaos.observability.MdcKeys;
import com.platform.clusterchaos.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable context of one run: current phase, records written so far and nodes currently down.
 * Owned by the control thread; transitions are validated against a fixed table.
 */
@Slf4j
public class RunState {

    // Valid phase transitions (from -> to)
    private static final Map<RunPhase, Set<RunPhase>> ALLOWED_TRANSITIONS = Map.of(
        RunPhase.INIT, Set.of(RunPhase.BASELINE_WRITE, RunPhase.FINAL_VERIFY, RunPhase.FAILED),
        RunPhase.BASELINE_WRITE, Set.of(RunPhase.STOP_NODE, RunPhase.RESTART_ALL, RunPhase.FINAL_VERIFY, RunPhase.FAILED),
        RunPhase.STOP_NODE, Set.of(RunPhase.VERIFY_RUNNING, RunPhase.FAILED),
        RunPhase.VERIFY_RUNNING, Set.of(RunPhase.BASELINE_WRITE, RunPhase.FAILED),
        RunPhase.RESTART_ALL, Set.of(RunPhase.AWAIT_HEALTHY, RunPhase.FAILED),
        RunPhase.AWAIT_HEALTHY, Set.of(RunPhase.FINAL_VERIFY, RunPhase.FAILED),
        RunPhase.FINAL_VERIFY, Set.of(RunPhase.DONE, RunPhase.FAILED),
        RunPhase.DONE, Set.of(),
        RunPhase.FAILED, Set.of()
    );

    private final String runId;
    private final StructuredLogger structuredLogger;
    private final Set<Integer> downNodes = new TreeSet<>();
    private final List<PhaseTransition> history = new ArrayList<>();

    private RunPhase phase = RunPhase.INIT;
    private long written;

    public RunState(String runId, StructuredLogger structuredLogger) {
        this.runId = runId;
        this.structuredLogger = structuredLogger;
        MDC.put(MdcKeys.PHASE, phase.name());
    }

    /**
     * Move to the target phase.
     *
     * @throws IllegalStateException if the table does not allow the move
     */
    public void transition(RunPhase target, String reason) {
        if (!isTransitionAllowed(phase, target)) {
            throw new IllegalStateException(String.format("Invalid phase transition %s -> %s", phase, target));
        }
        RunPhase previous = phase;
        phase = target;
        history.add(new PhaseTransition(previous, target, reason, Instant.now()));
        MDC.put(MdcKeys.PHASE, target.name());

        log.info("Run {} phase transition: {} -> {} (reason: {})", runId, previous, target, reason);
        structuredLogger.run().phaseChanged(previous.name(), target.name(), reason);
    }

    /**
     * Terminal failure; allowed from any non-terminal phase.
     */
    public void fail(String reason) {
        if (!phase.isTerminal()) {
            transition(RunPhase.FAILED, reason);
        }
    }

    /**
     * Terminal failure caused by {@code cause}. Harness errors keep their code; anything else
     * is recorded as {@link ErrorCode#UNEXPECTED_ERROR}.
     */
    public void fail(RuntimeException cause) {
        ErrorCode code = cause instanceof HarnessException harness
            ? harness.getErrorCode()
            : ErrorCode.UNEXPECTED_ERROR;
        fail(code.getCode() + " " + cause.getMessage());
    }

    /**
     * Count records acknowledged by the cluster. The counter never decreases.
     */
    public void addWritten(long records) {
        if (records < 0) {
            throw new IllegalArgumentException("written counter cannot decrease: " + records);
        }
        written += records;
    }

    public void markDown(int nodeIndex) {
        downNodes.add(nodeIndex);
    }

    public void clearDown() {
        downNodes.clear();
    }

    private static boolean isTransitionAllowed(RunPhase from, RunPhase to) {
        Set<RunPhase> allowedTargets = ALLOWED_TRANSITIONS.get(from);
        return allowedTargets != null && allowedTargets.contains(to);
    }

    public RunPhase phase() {
        return phase;
    }

    public long written() {
        return written;
    }

    public Set<Integer> downNodes() {
        return Collections.unmodifiableSet(downNodes);
    }

    public List<PhaseTransition> history() {
        return Collections.unmodifiableList(history);
    }
}
