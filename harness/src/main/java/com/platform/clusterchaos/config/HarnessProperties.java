package com.platform.clusterchaos.config;

import com.platform.clusterchaos.model.KeyMode;
import com.platform.clusterchaos.model.RangeFlag;
import com.platform.clusterchaos.model.Workload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Immutable harness configuration, bound once from application.yml and
 * {@code --harness.*} command-line arguments, then injected where needed.
 */
@Validated
@ConfigurationProperties(prefix = "harness")
public record HarnessProperties(
    @NotNull Scenario scenario,
    @Valid @NotNull Cluster cluster,
    @Valid @NotNull Load load,
    @Valid @NotNull Health health,
    @Valid @NotNull Driver driver,
    @Valid @NotNull Timing timing,
    @Valid @NotNull DoubledExist doubledExist,
    @Valid @NotNull OperationTest operationTest
) {

    /**
     * Which test flow the runner executes.
     */
    public enum Scenario {
        /**
         * Sequential node outages followed by restart and full verification.
         */
        ALIENS,

        /**
         * Put, get and exist against one node, no failure injection.
         */
        SMOKE,

        /**
         * Randomized operation tester with a final summary score.
         */
        OPERATION_TEST
    }

    /**
     * Cluster layout. Node i listens on {@code transportMinPort + i} and serves
     * metrics on {@code restMinPort + i}.
     */
    public record Cluster(
        @Min(1) int nodesAmount,
        @Min(1) @Max(65535) int transportMinPort,
        @Min(1) @Max(65535) int restMinPort,
        @NotBlank String host,
        @NotBlank String restHost,
        Integer replicas,
        Integer quorum
    ) {
    }

    /**
     * Workload shape shared by every driver invocation of a run.
     */
    public record Load(
        @Min(1) long count,
        @Min(1) int payload,
        @Min(0) long first,
        @Min(1) int threads,
        @NotNull KeyMode mode,
        int keySize,
        @NotNull RangeFlag rangeFlag,
        String user,
        String password
    ) {

        @AssertTrue(message = "key size must be 8 or 16")
        public boolean isKeySizeSupported() {
            return Workload.isSupportedKeySize(keySize);
        }
    }

    /**
     * Health polling backoff. Defaults mirror the readiness gate used in CI:
     * 10 tries, 1s initial delay, 1.75 multiplier, 15s ceiling.
     */
    public record Health(
        @Min(1) int tries,
        @NotNull Duration initialDelay,
        @DecimalMin("1.0") double multiplier,
        @NotNull Duration maxDelay,
        @NotNull Duration connectTimeout,
        @NotNull Duration readTimeout
    ) {
    }

    /**
     * Workload generator binary.
     */
    public record Driver(
        @NotBlank String executable,
        String workingDirectory
    ) {
    }

    /**
     * Settle delays.
     * {@code clusterStartWaitingTime} is the cluster's own startup offset; the
     * harness waits that long plus one second after the readiness gate.
     */
    public record Timing(
        @NotNull Duration writeSettleDelay,
        @NotNull Duration clusterStartWaitingTime
    ) {
        public Duration postHealthSettleDelay() {
            return clusterStartWaitingTime.plusSeconds(1);
        }
    }

    /**
     * Optional over-range exist check after the regular one.
     * {@code start} defaults to the first written index when unset.
     */
    public record DoubledExist(
        boolean enabled,
        Long start
    ) {
    }

    /**
     * Operation tester binary and its key range.
     */
    public record OperationTest(
        @NotBlank String executable,
        @Min(1) long count,
        @Min(0) long start,
        @Min(0) long end
    ) {
    }
}
