package com.platform.clusterchaos.error;

/**
 * Exception for container runtime failures: communication errors, ambiguous or stale mappings.
 */
public class ContainerRuntimeException extends HarnessException {

    private final String containerId;
    private final String operation;

    public ContainerRuntimeException(ErrorCode errorCode, String containerId, String operation, String message) {
        super(errorCode, message);
        this.containerId = containerId;
        this.operation = operation;
    }

    public ContainerRuntimeException(ErrorCode errorCode, String containerId, String operation, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.containerId = containerId;
        this.operation = operation;
    }

    public static ContainerRuntimeException communication(String operation, String target, Throwable cause) {
        return new ContainerRuntimeException(
            ErrorCode.CONTAINER_RUNTIME_ERROR,
            target,
            operation,
            String.format("Container runtime failed to %s %s: %s", operation, target, cause.getMessage()),
            cause
        );
    }

    public static ContainerRuntimeException ambiguous(int port, int matches) {
        return new ContainerRuntimeException(
            ErrorCode.CONTAINER_AMBIGUOUS,
            null,
            "resolve",
            String.format("%d running containers publish port %d, expected exactly one", matches, port)
        );
    }

    public static ContainerRuntimeException stale(String containerId, String operation, int port, Throwable cause) {
        return new ContainerRuntimeException(
            ErrorCode.CONTAINER_MAPPING_STALE,
            containerId,
            operation,
            String.format("Container %s resolved for port %d no longer exists; cannot %s it",
                containerId, port, operation),
            cause
        );
    }

    public static ContainerRuntimeException notStopped(String containerId, int nodeIndex) {
        return new ContainerRuntimeException(
            ErrorCode.CONTAINER_NOT_STOPPED,
            containerId,
            "stop",
            String.format("Container %s of node %d is not listed as exited after stop", containerId, nodeIndex)
        );
    }

    public String getContainerId() {
        return containerId;
    }

    public String getOperation() {
        return operation;
    }
}
