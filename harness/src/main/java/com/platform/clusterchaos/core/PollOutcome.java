package com.platform.clusterchaos.core;

import com.platform.clusterchaos.error.ErrorCode;
import com.platform.clusterchaos.error.HarnessException;

/**
 * Result of a single readiness check. The check classifies; the {@link RetryEngine} schedules.
 *
 * @param code  why the check did not succeed; null when ready
 * @param error the exception to raise for a FATAL outcome
 */
public record PollOutcome(Kind kind, ErrorCode code, String reason, HarnessException error) {

    public enum Kind {
        READY,
        RETRY,
        FATAL
    }

    public static PollOutcome ready() {
        return new PollOutcome(Kind.READY, null, null, null);
    }

    /**
     * @throws IllegalArgumentException if {@code code} is not a transient code
     */
    public static PollOutcome retry(ErrorCode code, String reason) {
        if (!code.isTransient()) {
            throw new IllegalArgumentException(code.getCode() + " is not retryable");
        }
        return new PollOutcome(Kind.RETRY, code, reason, null);
    }

    public static PollOutcome fatal(HarnessException error) {
        return new PollOutcome(Kind.FATAL, error.getErrorCode(), error.getMessage(), error);
    }
}
