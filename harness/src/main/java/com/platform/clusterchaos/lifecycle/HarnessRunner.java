package com.platform.clusterchaos.lifecycle;

import com.platform.clusterchaos.chaos.HarnessScenario;
import com.platform.clusterchaos.chaos.RunReport;
import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.config.HarnessProperties.Scenario;
import com.platform.clusterchaos.error.ErrorCode;
import com.platform.clusterchaos.error.HarnessException;
import com.platform.clusterchaos.observability.MdcKeys;
import com.platform.clusterchaos.observability.MetricsRegistry;
import com.platform.clusterchaos.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the configured scenario once at startup and turns its outcome into the process exit code:
 * 0 when the run reaches DONE, 1 on a test failure, 2 on a fatal harness error.
 *
 * A failed run prints exactly one diagnostic line to stderr.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "harness.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HarnessRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_TEST_FAILURE = 1;
    static final int EXIT_FATAL = 2;

    private final HarnessProperties properties;
    private final Map<Scenario, HarnessScenario> scenarios;
    private final StructuredLogger structuredLogger;
    private final MetricsRegistry metricsRegistry;
    private final PrintStream diagnostics;

    private volatile int exitCode = EXIT_FATAL;

    @Autowired
    public HarnessRunner(
            HarnessProperties properties,
            Map<Scenario, HarnessScenario> scenariosMap,
            StructuredLogger structuredLogger,
            MetricsRegistry metricsRegistry) {
        this(properties, scenariosMap, structuredLogger, metricsRegistry, System.err);
    }

    HarnessRunner(
            HarnessProperties properties,
            Map<Scenario, HarnessScenario> scenarios,
            StructuredLogger structuredLogger,
            MetricsRegistry metricsRegistry,
            PrintStream diagnostics) {
        this.properties = properties;
        this.scenarios = scenarios;
        this.structuredLogger = structuredLogger;
        this.metricsRegistry = metricsRegistry;
        this.diagnostics = diagnostics;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(UUID.randomUUID().toString());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String runId) {
        Scenario scenario = properties.scenario();
        long startTime = System.currentTimeMillis();
        MDC.put(MdcKeys.RUN_ID, runId);

        try {
            HarnessScenario harnessScenario = scenarios.get(scenario);
            if (harnessScenario == null) {
                throw new IllegalStateException("No implementation registered for scenario " + scenario);
            }

            log.info("Starting {} run {}", scenario, runId);
            structuredLogger.run().started(scenario.name(), settings());

            RunReport report = harnessScenario.run(runId);

            log.info("Run passed: {}", report.summary());
            report.history().forEach(transition -> log.debug("  {}", transition));
            structuredLogger.run().completed(scenario.name(), report.written(), elapsed(startTime));
            return EXIT_OK;

        } catch (HarnessException e) {
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            structuredLogger.run().failed(scenario.name(), e.getErrorCode().getCode(), e.getMessage(), elapsed(startTime));
            diagnostics.println(e.diagnostic());
            return e.isTestFailure() ? EXIT_TEST_FAILURE : EXIT_FATAL;

        } catch (RuntimeException e) {
            log.error("Run {} aborted by unexpected error", runId, e);
            ErrorCode code = ErrorCode.UNEXPECTED_ERROR;
            structuredLogger.run().failed(scenario.name(), code.getCode(), e.getMessage(), elapsed(startTime));
            diagnostics.println(String.format("[%s] %s: %s", code.getCode(), code.getDefaultMessage(), e));
            return EXIT_FATAL;

        } finally {
            metricsRegistry.snapshot().forEach((name, value) -> log.info("metric {} = {}", name, value));
            MDC.remove(MdcKeys.PHASE);
            MDC.remove(MdcKeys.RUN_ID);
        }
    }

    private Map<String, Object> settings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("nodes", properties.cluster().nodesAmount());
        settings.put("transport_min_port", properties.cluster().transportMinPort());
        settings.put("rest_min_port", properties.cluster().restMinPort());
        settings.put("count", properties.load().count());
        settings.put("first", properties.load().first());
        settings.put("payload", properties.load().payload());
        settings.put("doubled_exist", properties.doubledExist().enabled());
        return settings;
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
