package com.platform.clusterchaos.workload;

import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface CommandExecutor {

    /**
     * Run the command, blocking until it exits. There is no timeout.
     *
     * @throws com.platform.clusterchaos.error.DriverExecutionException if the process cannot be started
     */
    CommandResult execute(List<String> command);
}
