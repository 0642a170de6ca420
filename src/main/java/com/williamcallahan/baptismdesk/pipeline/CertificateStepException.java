package com.williamcallahan.baptismdesk.pipeline;

/**
 * Signals that one named step of certificate generation failed. For external process failures
 * the exit code and captured output are attached.
 */
public class CertificateStepException extends RuntimeException {

    private final String step;
    private final int exitCode;
    private final String processOutput;

    public CertificateStepException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
        this.exitCode = -1;
        this.processOutput = null;
    }

    /**
     * Creates a failure for a process that exited non-zero or timed out.
     *
     * @param step failed step name
     * @param message explanation of the failure
     * @param exitCode process exit code, -1 on timeout
     * @param processOutput merged process output
     */
    public CertificateStepException(String step, String message, int exitCode, String processOutput) {
        super(message);
        this.step = step;
        this.exitCode = exitCode;
        this.processOutput = processOutput;
    }

    public String getStep() {
        return step;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getProcessOutput() {
        return processOutput;
    }
}
