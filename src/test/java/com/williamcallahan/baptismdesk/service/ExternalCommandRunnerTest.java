package com.williamcallahan.baptismdesk.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs real shell commands to check exit codes, merged output, working directory and timeouts.
 */
@DisabledOnOs(OS.WINDOWS)
class ExternalCommandRunnerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private final ExternalCommandRunner runner = new ExternalCommandRunner();

    @Test
    void run_capturesStdoutAndStderrTogether() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2"), tempDir, TIMEOUT);

        assertTrue(result.succeeded());
        assertTrue(result.output().contains("out"));
        assertTrue(result.output().contains("err"));
    }

    @Test
    void run_startsInWorkingDirectory() {
        CommandResult result = runner.run(List.of("sh", "-c", "touch marker.txt"), tempDir, TIMEOUT);

        assertEquals(0, result.exitCode());
        assertTrue(Files.exists(tempDir.resolve("marker.txt")));
    }

    @Test
    void run_reportsNonZeroExit() {
        CommandResult result = runner.run(List.of("sh", "-c", "echo broken; exit 3"), tempDir, TIMEOUT);

        assertFalse(result.succeeded());
        assertEquals(3, result.exitCode());
        assertFalse(result.timedOut());
        assertEquals("broken", result.output().strip());
    }

    @Test
    void run_killsProcessOnTimeout() {
        CommandResult result = runner.run(List.of("sh", "-c", "sleep 30"), tempDir, Duration.ofMillis(200));

        assertTrue(result.timedOut());
        assertEquals(-1, result.exitCode());
        assertFalse(result.succeeded());
    }

    @Test
    void run_missingProgramRaisesUncheckedIo() {
        assertThrows(UncheckedIOException.class,
                () -> runner.run(List.of("definitely-not-a-program-4711"), tempDir, TIMEOUT));
    }
}
