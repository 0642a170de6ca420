package com.williamcallahan.baptismdesk.pipeline;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Profile ids that are taken, either by a live profile or by an upload still in flight.
 *
 * <p>Concurrent uploads of identical bytes hash to the same candidate id before either profile
 * exists. Claiming the id here at resolution time makes the second upload see the collision.</p>
 */
public class IdReservations {

    private final Set<String> reserved = ConcurrentHashMap.newKeySet();

    /**
     * Atomically claims an id.
     *
     * @param profileId id to claim
     * @return true if the id was free and is now reserved
     */
    public boolean reserve(String profileId) {
        return reserved.add(profileId);
    }

    public void release(String profileId) {
        if (profileId != null) {
            reserved.remove(profileId);
        }
    }

    /**
     * Marks ids of already existing profiles as taken.
     */
    public void reserveAll(Collection<String> profileIds) {
        reserved.addAll(profileIds);
    }

    public boolean isReserved(String profileId) {
        return reserved.contains(profileId);
    }
}
