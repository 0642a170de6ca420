package com.williamcallahan.baptismdesk.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the render, convert and combine helpers as child processes.
 *
 * <p>Output is captured through a temp file rather than a pipe so a chatty process can never
 * block on a full buffer while we wait for it.</p>
 */
@Component
public class ExternalCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommandRunner.class);

    private static final int MAX_LOGGED_OUTPUT = 2000;

    /**
     * Runs a command to completion or until the timeout expires.
     *
     * @param command program and arguments
     * @param workingDirectory directory the process starts in
     * @param timeout maximum wall time; the process is destroyed when exceeded
     * @return exit code and merged output
     * @throws UncheckedIOException if the process cannot be started
     */
    public CommandResult run(List<String> command, Path workingDirectory, Duration timeout) {
        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("command-", ".log");
            Process process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();
            log.debug("Started {} in {}", command, workingDirectory);

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                String output = readOutput(outputFile);
                log.warn("Command {} timed out after {}s", command.get(0), timeout.toSeconds());
                return new CommandResult(-1, output, true);
            }
            String output = readOutput(outputFile);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.warn("Command {} exited with {}: {}", command.get(0), exitCode, truncate(output));
            } else if (log.isDebugEnabled()) {
                log.debug("Command {} output: {}", command.get(0), truncate(output));
            }
            return new CommandResult(exitCode, output, false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to run " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + command, e);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private static String readOutput(Path outputFile) throws IOException {
        return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
    }

    private static String truncate(String output) {
        String flattened = output.strip();
        return flattened.length() > MAX_LOGGED_OUTPUT ? flattened.substring(0, MAX_LOGGED_OUTPUT) + "..." : flattened;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete command output {}: {}", file, e.getMessage());
        }
    }
}
