package com.williamcallahan.baptismdesk.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Pipeline stage of a profile.
 *
 * <p>The only legal moves are {@code uploaded -> extracted}, {@code extracted -> generated},
 * {@code generated -> reviewed} and {@code reviewed -> generated}. Anything else is refused by
 * {@link #canTransitionTo(ProfileStatus)} and callers treat the request as a no-op.</p>
 */
public enum ProfileStatus {
    UPLOADED,
    EXTRACTED,
    GENERATED,
    REVIEWED;

    /**
     * Reports whether the state machine allows moving from this status to {@code target}.
     *
     * @param target requested status
     * @return true when the transition is one of the four legal edges
     */
    public boolean canTransitionTo(ProfileStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case UPLOADED:
                return target == EXTRACTED;
            case EXTRACTED:
                return target == GENERATED;
            case GENERATED:
                return target == REVIEWED;
            case REVIEWED:
                return target == GENERATED;
            default:
                return false;
        }
    }

    /**
     * Lowercase name used in the persisted snapshot and the HTTP API.
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProfileStatus fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            throw new IllegalArgumentException("Profile status is required");
        }
        return ProfileStatus.valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    }
}
