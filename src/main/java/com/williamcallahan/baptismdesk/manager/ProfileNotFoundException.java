package com.williamcallahan.baptismdesk.manager;

/**
 * Signals that no profile with the requested id exists.
 */
public class ProfileNotFoundException extends RuntimeException {

    private final String profileId;

    public ProfileNotFoundException(String profileId) {
        super("Profile not found: " + profileId);
        this.profileId = profileId;
    }

    public String getProfileId() {
        return profileId;
    }
}
