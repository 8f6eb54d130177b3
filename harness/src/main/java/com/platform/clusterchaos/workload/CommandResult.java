package com.platform.clusterchaos.workload;

/**
 * Exit status and combined stdout/stderr of a finished subprocess.
 */
public record CommandResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
