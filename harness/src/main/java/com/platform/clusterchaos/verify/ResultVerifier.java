package com.platform.clusterchaos.verify;

import com.platform.clusterchaos.error.DriverExecutionException;
import com.platform.clusterchaos.error.VerificationFailedException;
import com.platform.clusterchaos.model.ExistTally;
import com.platform.clusterchaos.model.SummaryScore;
import com.platform.clusterchaos.model.WorkloadResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pass/fail rules over parsed driver output.
 *
 * Failures of the cluster raise {@link VerificationFailedException}; output the rules
 * cannot read at all raises {@link DriverExecutionException}.
 */
@Slf4j
@Component
public class ResultVerifier {

    /**
     * Put/get: zero-error marker present, no panic, last reported error total is zero.
     */
    public void verifyNoErrors(WorkloadResult result) {
        String behaviour = result.operation().behaviour();
        if (result.panicked()) {
            throw VerificationFailedException.panicked(behaviour);
        }
        if (result.errorCount() != null && result.errorCount() > 0) {
            throw VerificationFailedException.workloadErrors(behaviour, result.errorCount());
        }
        if (!result.zeroErrorMarker()) {
            throw VerificationFailedException.zeroErrorMarkerMissing(behaviour);
        }
        log.info("{} of {} records passed", behaviour, result.workload().count());
    }

    /**
     * Exist: every requested key is present, and the tally covers exactly the expected count.
     */
    public ExistTally verifyExist(WorkloadResult result, long expected) {
        ExistTally tally = requireTally(result);
        if (!tally.isComplete() || tally.total() != expected) {
            throw VerificationFailedException.existMismatch(tally.matched(), tally.total(), expected);
        }
        log.info("{} keys", tally);
        return tally;
    }

    /**
     * Doubled exist: of {@code 2 × written + 1} requested keys, exactly {@code written} are present.
     * Finding more means the cluster reports keys that were never written.
     */
    public ExistTally verifyDoubledExist(WorkloadResult result, long written) {
        ExistTally tally = requireTally(result);
        if (tally.matched() != written) {
            throw VerificationFailedException.doubledExistMismatch(tally.matched(), tally.total(), written);
        }
        log.info("{} keys in doubled range, matches {} written", tally, written);
        return tally;
    }

    public SummaryScore verifySummary(SummaryScore score) {
        if (!score.isComplete()) {
            throw VerificationFailedException.summaryIncomplete(score.passed(), score.total());
        }
        log.info("Test succeeded: {}", score);
        return score;
    }

    private ExistTally requireTally(WorkloadResult result) {
        return result.existTally()
            .orElseThrow(() -> DriverExecutionException.noOutputCaptured(
                result.operation().behaviour(), result.output()));
    }
}
