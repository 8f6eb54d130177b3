package com.platform.clusterchaos.workload;

import com.platform.clusterchaos.config.HarnessProperties;
import com.platform.clusterchaos.error.DriverExecutionException;
import com.platform.clusterchaos.error.HarnessInterruptedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link CommandExecutor} on top of {@link ProcessBuilder}, with stderr merged into stdout.
 */
@Slf4j
@Component
public class ProcessCommandExecutor implements CommandExecutor {

    private final File workingDirectory;

    public ProcessCommandExecutor(HarnessProperties properties) {
        String dir = properties.driver().workingDirectory();
        this.workingDirectory = dir == null || dir.isBlank() ? null : new File(dir);
    }

    @Override
    public CommandResult execute(List<String> command) {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory);
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw DriverExecutionException.launchFailed(command.get(0), e);
        }

        try (InputStream stdout = process.getInputStream()) {
            String output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            int exitCode = process.waitFor();
            log.debug("{} exited with {}", command.get(0), exitCode);
            return new CommandResult(exitCode, output);
        } catch (IOException e) {
            process.destroyForcibly();
            throw DriverExecutionException.launchFailed(command.get(0), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new HarnessInterruptedException("waiting for " + command.get(0), e);
        }
    }
}
