package com.platform.clusterchaos;

import com.platform.clusterchaos.error.ErrorCode;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Cluster Chaos Harness
 *
 * Drives a multi-node storage cluster through a scripted sequence of node outages
 * and verifies that every record written survives:
 * - sequential stop of all nodes but the last, with writes in between
 * - restart and readiness gate over each node's metrics endpoint
 * - get and exist of the full written range through the surviving node
 *
 * The process exit code reports the outcome (0 passed, 1 test failure, 2 harness error).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ClusterChaosApplication {

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = SpringApplication.exit(SpringApplication.run(ClusterChaosApplication.class, args));
        } catch (RuntimeException e) {
            // Startup failures, invalid configuration included, never reach the runner.
            System.err.printf("[%s] %s: %s%n", ErrorCode.INVALID_CONFIGURATION.getCode(),
                ErrorCode.INVALID_CONFIGURATION.getDefaultMessage(), rootMessage(e));
            exitCode = 2;
        }
        System.exit(exitCode);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return String.valueOf(root.getMessage()).replace('\n', ' ');
    }
}
