package com.platform.clusterchaos.error;

/**
 * Exception for workload driver subprocess failures.
 */
public class DriverExecutionException extends HarnessException {

    private final String command;
    private final Integer exitCode;
    private final String output;

    public DriverExecutionException(ErrorCode errorCode, String command, Integer exitCode, String output, String message) {
        super(errorCode, message);
        this.command = command;
        this.exitCode = exitCode;
        this.output = output;
    }

    public DriverExecutionException(ErrorCode errorCode, String command, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.command = command;
        this.exitCode = null;
        this.output = null;
    }

    public static DriverExecutionException launchFailed(String command, Throwable cause) {
        return new DriverExecutionException(
            ErrorCode.DRIVER_LAUNCH_FAILED,
            command,
            String.format("Failed to run '%s': %s", command, cause.getMessage()),
            cause
        );
    }

    public static DriverExecutionException nonZeroExit(String command, int exitCode, String output) {
        return new DriverExecutionException(
            ErrorCode.DRIVER_EXIT_NONZERO,
            command,
            exitCode,
            output,
            String.format("'%s' exited with status %d: %s", command, exitCode, lastLine(output))
        );
    }

    public static DriverExecutionException noOutputCaptured(String behaviour, String output) {
        return new DriverExecutionException(
            ErrorCode.DRIVER_OUTPUT_UNPARSABLE,
            null,
            null,
            output,
            String.format("No %s output captured, check output", behaviour)
        );
    }

    private static String lastLine(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        String[] lines = output.strip().split("\\R");
        return lines[lines.length - 1].strip();
    }

    public String getCommand() {
        return command;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }
}
