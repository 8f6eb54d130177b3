package com.platform.clusterchaos.error;

/**
 * The cluster returned a wrong answer. Carries observed and expected values
 * so a genuine product defect can be told apart from a harness defect.
 */
public class VerificationFailedException extends HarnessException {

    private final String check;
    private final String observed;
    private final String expected;

    public VerificationFailedException(ErrorCode errorCode, String check, String observed, String expected, String message) {
        super(errorCode, message);
        this.check = check;
        this.observed = observed;
        this.expected = expected;
    }

    public static VerificationFailedException workloadErrors(String behaviour, long errorCount) {
        return new VerificationFailedException(
            ErrorCode.WORKLOAD_ERRORS,
            behaviour,
            "total err: " + errorCount,
            "total err: 0",
            String.format("%s test failed with %d errors, see output", behaviour, errorCount)
        );
    }

    public static VerificationFailedException zeroErrorMarkerMissing(String behaviour) {
        return new VerificationFailedException(
            ErrorCode.WORKLOAD_ERRORS,
            behaviour,
            "no zero-error report",
            "total err: 0",
            String.format("%s test failed, see output", behaviour)
        );
    }

    public static VerificationFailedException panicked(String behaviour) {
        return new VerificationFailedException(
            ErrorCode.WORKLOAD_PANICKED,
            behaviour,
            "panicked",
            "no panic",
            String.format("%s test failed, driver panicked, see output", behaviour)
        );
    }

    public static VerificationFailedException existMismatch(long matched, long total, long expected) {
        return new VerificationFailedException(
            ErrorCode.EXIST_MISMATCH,
            "exist",
            matched + " of " + total,
            expected + " of " + expected,
            String.format("%d of %d keys (expected %d), exist test failed, see output", matched, total, expected)
        );
    }

    public static VerificationFailedException doubledExistMismatch(long matched, long total, long written) {
        return new VerificationFailedException(
            ErrorCode.DOUBLED_EXIST_MISMATCH,
            "doubled-exist",
            matched + " of " + total,
            written + " of " + total,
            String.format("%d of %d keys found in doubled range, expected exactly %d written keys",
                matched, total, written)
        );
    }

    public static VerificationFailedException summaryIncomplete(long passed, long total) {
        return new VerificationFailedException(
            ErrorCode.SUMMARY_INCOMPLETE,
            "operation-test",
            passed + "/" + total,
            total + "/" + total,
            String.format("Test failed, captured summary has incomplete score: %d of %d", passed, total)
        );
    }

    public String getCheck() {
        return check;
    }

    public String getObserved() {
        return observed;
    }

    public String getExpected() {
        return expected;
    }
}
