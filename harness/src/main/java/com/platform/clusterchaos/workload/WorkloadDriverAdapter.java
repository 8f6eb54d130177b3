package com.platform.clusterchaos.workload;

import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.error.DriverExecutionException;
import com.platform.clusterchaos.model.Workload;
import com.platform.clusterchaos.model.WorkloadResult;
import com.platform.clusterchaos.observability.MetricsRegistry;
import com.platform.clusterchaos.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Invokes the workload generator for one {@link Workload} and hands back a typed result.
 * Any non-zero exit status is fatal for the run.
 */
@Slf4j
@Component
public class WorkloadDriverAdapter {

    private final CommandExecutor executor;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    private final String executable;

    public WorkloadDriverAdapter(
            CommandExecutor executor,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger,
            HarnessProperties properties) {
        this.executor = executor;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
        this.executable = properties.driver().executable();
    }

    public WorkloadResult run(Workload workload) {
        DriverArguments arguments = DriverArguments.forWorkload(workload);
        List<String> command = arguments.command(executable);
        String display = executable + " " + arguments.toDisplayString();

        log.info("Running {}", display);
        long startTime = System.currentTimeMillis();
        CommandResult result = executor.execute(command);
        long durationMs = System.currentTimeMillis() - startTime;

        log.info("{} output:\n{}", workload.operation().behaviour(), result.output());

        if (!result.succeeded()) {
            throw DriverExecutionException.nonZeroExit(display, result.exitCode(), result.output());
        }

        WorkloadResult parsed = DriverOutputParser.parse(workload, result.output());
        metricsRegistry.recordWorkload(workload.operation(), Duration.ofMillis(durationMs), parsed.passed());
        structuredLogger.chaos().workloadCompleted(workload.operation().behaviour(), workload.port(),
            workload.first(), workload.count(), parsed.passed(), durationMs);
        return parsed;
    }
}
