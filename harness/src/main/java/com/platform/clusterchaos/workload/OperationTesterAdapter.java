package com.platform.clusterchaos.workload;

import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.error.DriverExecutionException;
import com.platform.clusterchaos.model.SummaryScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Invokes the randomized operation tester against the first node's REST API
 * and extracts its final summary.
 *
 * The tester's exit status is not authoritative: it can exit non-zero after printing a
 * complete summary, so only the summary decides. A missing summary is fatal.
 */
@Slf4j
@Component
public class OperationTesterAdapter {

    private final CommandExecutor executor;
    private final HarnessProperties properties;

    public OperationTesterAdapter(CommandExecutor executor, HarnessProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    public SummaryScore run() {
        List<String> command = command();
        String display = display(command);

        log.info("Running {}", display);
        CommandResult result = executor.execute(command);
        log.info("operation tester output:\n{}", result.output());

        if (!result.succeeded()) {
            log.warn("{} exited with status {}, reading summary anyway", command.get(0), result.exitCode());
        }

        return DriverOutputParser.findSummary(result.output())
            .orElseThrow(() -> DriverExecutionException.noOutputCaptured("operation tester", result.output()));
    }

    List<String> command() {
        HarnessProperties.OperationTest test = properties.operationTest();
        HarnessProperties.Cluster cluster = properties.cluster();
        HarnessProperties.Load load = properties.load();

        List<String> command = new ArrayList<>();
        command.add(test.executable());
        command.add("-c");
        command.add(String.valueOf(test.count()));
        command.add("-s");
        command.add(String.valueOf(test.start()));
        command.add("-e");
        command.add(String.valueOf(test.end()));
        command.add("-a");
        command.add(String.format("http://%s:%d", cluster.restHost(), cluster.restMinPort()));
        if (load.user() != null && !load.user().isBlank()) {
            command.add("--user");
            command.add(load.user());
            if (load.password() != null) {
                command.add("--password");
                command.add(load.password());
            }
        }
        return command;
    }

    private static String display(List<String> command) {
        List<String> shown = new ArrayList<>(command);
        int passwordFlag = shown.indexOf("--password");
        if (passwordFlag >= 0 && passwordFlag + 1 < shown.size()) {
            shown.set(passwordFlag + 1, "******");
        }
        return String.join(" ", shown);
    }
}
