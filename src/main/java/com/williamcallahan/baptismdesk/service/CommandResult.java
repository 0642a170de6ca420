package com.williamcallahan.baptismdesk.service;

/**
 * Outcome of one external process run.
 *
 * @param exitCode process exit code, -1 when the process was killed on timeout
 * @param output merged stdout and stderr
 * @param timedOut true if the process exceeded its timeout and was destroyed
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
