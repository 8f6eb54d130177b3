package com.platform.clusterchaos.error;

/**
 * Exception for health endpoint failures that end the readiness wait.
 */
public class HealthCheckException extends HarnessException {

    private final int nodeIndex;

    public HealthCheckException(ErrorCode errorCode, int nodeIndex, String message) {
        super(errorCode, message);
        this.nodeIndex = nodeIndex;
    }

    public HealthCheckException(ErrorCode errorCode, int nodeIndex, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.nodeIndex = nodeIndex;
    }

    public static HealthCheckException unhealthy(int nodeIndex, int attempts, String lastReason) {
        return new HealthCheckException(
            ErrorCode.NODE_UNHEALTHY,
            nodeIndex,
            String.format("Node %d is not healthy after %d attempts: %s", nodeIndex, attempts, lastReason)
        );
    }

    public static HealthCheckException malformedPayload(int nodeIndex, Throwable cause) {
        return new HealthCheckException(
            ErrorCode.MALFORMED_HEALTH_PAYLOAD,
            nodeIndex,
            String.format("Metrics of node %d cannot be decoded: %s", nodeIndex, cause.getMessage()),
            cause
        );
    }

    public int getNodeIndex() {
        return nodeIndex;
    }
}
