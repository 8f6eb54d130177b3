package com.platform.clusterchaos.error;

/**
 * Standardized error codes for the harness.
 * Each code decides how a failure propagates and which exit status the run ends with.
 *
 * Format: CH-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Configuration and input errors
 * - 2xx: Health endpoint errors
 * - 3xx: Container runtime errors
 * - 4xx: Workload driver errors
 * - 5xx: Verification failures (product defects, not harness defects)
 * - 9xx: Internal errors
 */
public enum ErrorCode {

    // ==================== Configuration Errors (1xx) ====================

    INVALID_CONFIGURATION("CH-100", "Invalid harness configuration", ErrorCategory.FATAL),
    INSUFFICIENT_RECORD_COUNT("CH-101", "Record count cannot be less than node count", ErrorCategory.FATAL),

    // ==================== Health Errors (2xx) ====================

    HEALTH_ENDPOINT_UNREACHABLE("CH-200", "Health endpoint unreachable", ErrorCategory.TRANSIENT),
    HEALTH_ENDPOINT_STATUS("CH-201", "Health endpoint returned non-200 status", ErrorCategory.TRANSIENT),
    BACKEND_NOT_READY("CH-202", "Backend is not ready", ErrorCategory.TRANSIENT),
    BACKEND_STATE_MISSING("CH-203", "No backend state metric", ErrorCategory.TRANSIENT),
    MALFORMED_HEALTH_PAYLOAD("CH-210", "Health endpoint payload is not valid JSON", ErrorCategory.FATAL),
    NODE_UNHEALTHY("CH-220", "Node did not become healthy", ErrorCategory.FATAL),

    // ==================== Container Runtime Errors (3xx) ====================

    CONTAINER_RUNTIME_ERROR("CH-300", "Container runtime communication failed", ErrorCategory.FATAL),
    CONTAINER_NOT_FOUND("CH-301", "No container publishes the expected port", ErrorCategory.FATAL),
    CONTAINER_AMBIGUOUS("CH-302", "More than one container publishes the port", ErrorCategory.FATAL),
    CONTAINER_MAPPING_STALE("CH-303", "Resolved container no longer exists", ErrorCategory.FATAL),
    CONTAINER_NOT_STOPPED("CH-304", "Container is not reported as exited after stop", ErrorCategory.FATAL),

    // ==================== Workload Driver Errors (4xx) ====================

    DRIVER_LAUNCH_FAILED("CH-400", "Workload driver could not be launched", ErrorCategory.FATAL),
    DRIVER_EXIT_NONZERO("CH-401", "Workload driver exited with non-zero status", ErrorCategory.FATAL),
    DRIVER_OUTPUT_UNPARSABLE("CH-402", "No output captured", ErrorCategory.FATAL),

    // ==================== Verification Failures (5xx) ====================

    WORKLOAD_ERRORS("CH-500", "Workload reported errors", ErrorCategory.TEST_FAILURE),
    WORKLOAD_PANICKED("CH-501", "Workload driver panicked", ErrorCategory.TEST_FAILURE),
    EXIST_MISMATCH("CH-510", "Exist check found fewer keys than expected", ErrorCategory.TEST_FAILURE),
    DOUBLED_EXIST_MISMATCH("CH-511", "Doubled exist check counted an unexpected number of keys", ErrorCategory.TEST_FAILURE),
    SUMMARY_INCOMPLETE("CH-520", "Operation tester summary is incomplete", ErrorCategory.TEST_FAILURE),

    // ==================== Internal Errors (9xx) ====================

    INTERRUPTED("CH-900", "Run was interrupted", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("CH-901", "Unexpected error occurred", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    public boolean isTransient() {
        return category == ErrorCategory.TRANSIENT;
    }

    public boolean isTestFailure() {
        return category == ErrorCategory.TEST_FAILURE;
    }

    /**
     * Error category for distinguishing retryable, fatal and product failures.
     */
    public enum ErrorCategory {
        /**
         * Retried locally under the backoff policy, never surfaced on its own.
         */
        TRANSIENT,

        /**
         * Harness or environment defect; aborts the run immediately.
         */
        FATAL,

        /**
         * The cluster under test misbehaved; aborts the run with observed vs. expected data.
         */
        TEST_FAILURE
    }
}
