package com.platform.clusterchaos.error;

/**
 * Exception for invalid harness input.
 */
public class ValidationException extends HarnessException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_CONFIGURATION,
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    private ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationException insufficientRecordCount(long count, int nodesAmount) {
        return new ValidationException(
            ErrorCode.INSUFFICIENT_RECORD_COUNT,
            "count",
            count,
            String.format("count cannot be less than node count (count=%d, nodes=%d)", count, nodesAmount)
        );
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
