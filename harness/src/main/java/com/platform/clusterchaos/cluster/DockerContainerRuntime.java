package com.platform.clusterchaos.cluster;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.platform.clusterchaos.error.ContainerRuntimeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ContainerRuntime} backed by the Docker Engine API.
 */
@Slf4j
@Component
public class DockerContainerRuntime implements ContainerRuntime {

    private final DockerClient dockerClient;

    public DockerContainerRuntime(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public List<String> findRunningByPublishedPort(int port) {
        try {
            List<Container> containers = dockerClient.listContainersCmd()
                .withFilter("publish", List.of(String.valueOf(port)))
                .exec();
            return containers.stream().map(Container::getId).collect(Collectors.toList());
        } catch (RuntimeException e) {
            throw ContainerRuntimeException.communication("list containers publishing", "port " + port, e);
        }
    }

    @Override
    public void stop(String containerId, int port) {
        try {
            dockerClient.stopContainerCmd(containerId).exec();
        } catch (NotModifiedException e) {
            log.debug("Container {} was already stopped", containerId);
        } catch (NotFoundException e) {
            throw ContainerRuntimeException.stale(containerId, "stop", port, e);
        } catch (RuntimeException e) {
            throw ContainerRuntimeException.communication("stop", containerId, e);
        }
    }

    @Override
    public void start(String containerId, int port) {
        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (NotModifiedException e) {
            log.debug("Container {} was already running", containerId);
        } catch (NotFoundException e) {
            throw ContainerRuntimeException.stale(containerId, "start", port, e);
        } catch (RuntimeException e) {
            throw ContainerRuntimeException.communication("start", containerId, e);
        }
    }

    @Override
    public List<String> listExited() {
        try {
            return dockerClient.listContainersCmd()
                .withShowAll(true)
                .withStatusFilter(List.of("exited"))
                .exec()
                .stream()
                .map(Container::getId)
                .collect(Collectors.toList());
        } catch (RuntimeException e) {
            throw ContainerRuntimeException.communication("list", "exited containers", e);
        }
    }
}
