package com.williamcallahan.baptismdesk.pipeline;

/**
 * Signals that an upload could not be hashed, stored or compressed.
 */
public class UploadPipelineException extends RuntimeException {

    private final String profileId;

    /**
     * @param profileId resolved id, or null when the failure happened before one was assigned
     * @param message explanation of the failure
     * @param cause underlying exception
     */
    public UploadPipelineException(String profileId, String message, Throwable cause) {
        super(message, cause);
        this.profileId = profileId;
    }

    public String getProfileId() {
        return profileId;
    }
}
