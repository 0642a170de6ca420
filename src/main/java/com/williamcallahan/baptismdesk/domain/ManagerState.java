package com.williamcallahan.baptismdesk.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Snapshot of everything the profile manager owns: the ordered profile collection (newest first)
 * plus configuration. This is the unit persisted after every accepted mutation.
 *
 * @param profiles profiles, newest first
 * @param inferenceUrl inference endpoint override, null for the configured default
 * @param certificateConfig field key to layout spec overrides
 */
public record ManagerState(List<Profile> profiles, String inferenceUrl, Map<String, String> certificateConfig) {

    public ManagerState {
        profiles = profiles == null ? List.of() : List.copyOf(profiles);
        certificateConfig = certificateConfig == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(certificateConfig));
    }

    public static ManagerState empty() {
        return new ManagerState(List.of(), null, Map.of());
    }

    public Optional<Profile> find(String profileId) {
        return profiles.stream().filter(profile -> profile.id().equals(profileId)).findFirst();
    }

    public boolean contains(String profileId) {
        return find(profileId).isPresent();
    }

    /**
     * Adds a profile at the head of the collection.
     */
    public ManagerState prepend(Profile profile) {
        List<Profile> updated = new ArrayList<>(profiles.size() + 1);
        updated.add(profile);
        updated.addAll(profiles);
        return new ManagerState(updated, inferenceUrl, certificateConfig);
    }

    public ManagerState remove(String profileId) {
        List<Profile> updated = new ArrayList<>(profiles);
        updated.removeIf(profile -> profile.id().equals(profileId));
        return new ManagerState(updated, inferenceUrl, certificateConfig);
    }

    /**
     * Rewrites the profile with {@code profileId}, keeping its position.
     */
    public ManagerState replace(String profileId, UnaryOperator<Profile> change) {
        List<Profile> updated = new ArrayList<>(profiles.size());
        for (Profile profile : profiles) {
            updated.add(profile.id().equals(profileId) ? change.apply(profile) : profile);
        }
        return new ManagerState(updated, inferenceUrl, certificateConfig);
    }

    public ManagerState withProfiles(List<Profile> updatedProfiles) {
        return new ManagerState(updatedProfiles, inferenceUrl, certificateConfig);
    }

    public ManagerState withInferenceUrl(String url) {
        return new ManagerState(profiles, url, certificateConfig);
    }

    public ManagerState withCertificateConfig(Map<String, String> config) {
        return new ManagerState(profiles, inferenceUrl, config);
    }
}
