package com.platform.clusterchaos.error;

/**
 * No running container publishes the port a node is expected on.
 * Kept apart from {@link ContainerRuntimeException}: this is a deployment misconfiguration,
 * not a failure to talk to the runtime.
 */
public class ContainerNotFoundException extends HarnessException {

    private final int port;

    public ContainerNotFoundException(int port) {
        super(ErrorCode.CONTAINER_NOT_FOUND,
            String.format("No running container publishes port %d", port));
        this.port = port;
    }

    public int getPort() {
        return port;
    }
}
