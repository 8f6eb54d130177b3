package com.platform.clusterchaos.error;

/**
 * Base exception for all harness failures.
 * Carries an ErrorCode for standardized propagation and exit status mapping.
 */
public abstract class HarnessException extends RuntimeException {

    private final ErrorCode errorCode;

    protected HarnessException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected HarnessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected HarnessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }

    public boolean isTestFailure() {
        return errorCode.isTestFailure();
    }

    /**
     * Single-line diagnostic used as the last thing a failed run prints.
     */
    public String diagnostic() {
        return String.format("[%s] %s", errorCode.getCode(), getMessage().replace('\n', ' ').trim());
    }
}
