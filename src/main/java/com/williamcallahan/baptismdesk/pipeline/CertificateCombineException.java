package com.williamcallahan.baptismdesk.pipeline;

/**
 * Signals that certificates could not be merged, either because none could be downloaded or
 * because the merge process failed.
 */
public class CertificateCombineException extends RuntimeException {

    public CertificateCombineException(String message) {
        super(message);
    }

    public CertificateCombineException(String message, Throwable cause) {
        super(message, cause);
    }
}
