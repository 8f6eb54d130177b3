package com.platform.clusterchaos.model;

import java.util.Optional;

/**
 * Captured driver output and the fields derived from it.
 *
 * @param errorCount last {@code total err} value reported by put/get, or null
 * @param tally      {@code <matched> of <total>} reported by exist, or null when none was captured
 * @param panicked   whether the driver output carries a panic marker
 * @param passed     outcome under the default rule for the operation; the verifier may apply a stricter one
 */
public record WorkloadResult(
    Workload workload,
    String output,
    Long errorCount,
    ExistTally tally,
    boolean zeroErrorMarker,
    boolean panicked,
    boolean passed
) {

    public WorkloadOperation operation() {
        return workload.operation();
    }

    public Optional<ExistTally> existTally() {
        return Optional.ofNullable(tally);
    }
}
