package com.williamcallahan.baptismdesk.manager;

import com.williamcallahan.baptismdesk.domain.ProfileEvent;

/**
 * The single subscriber to profile changes. Called on the profile manager thread, so
 * implementations must hand events off rather than block.
 */
@FunctionalInterface
public interface ProfileEventListener {

    void onEvent(ProfileEvent event);

    /**
     * Called once when another listener takes this one's place. No further events follow.
     */
    default void onReplaced() {
    }
}
