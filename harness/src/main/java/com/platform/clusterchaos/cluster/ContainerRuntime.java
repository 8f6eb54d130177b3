package com.platform.clusterchaos.cluster;

import java.util.List;

/**
 * Container runtime operations the harness needs.
 * Implementations translate runtime failures into harness exceptions.
 */
public interface ContainerRuntime {

    /**
     * IDs of running containers publishing the given host port.
     *
     * @throws com.platform.clusterchaos.error.ContainerRuntimeException if the runtime cannot be reached
     */
    List<String> findRunningByPublishedPort(int port);

    /**
     * Stop a container. A container that is already stopped counts as success.
     *
     * @throws com.platform.clusterchaos.error.ContainerRuntimeException on runtime errors,
     *         including a container that no longer exists
     */
    void stop(String containerId, int port);

    /**
     * Start a container. A container that is already running counts as success.
     *
     * @throws com.platform.clusterchaos.error.ContainerRuntimeException on runtime errors,
     *         including a container that no longer exists
     */
    void start(String containerId, int port);

    /**
     * IDs of all containers in the exited state.
     */
    List<String> listExited();
}
