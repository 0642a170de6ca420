package com.williamcallahan.baptismdesk.domain;

import java.util.List;
import java.util.Map;

/**
 * Change notifications pushed to the single registered subscriber after the manager applies a
 * mutation or learns that a pipeline job failed.
 */
public sealed interface ProfileEvent {

    /**
     * Stable event name, used as the SSE event type.
     */
    String type();

    record ProfilesUpdated(List<Profile> profiles) implements ProfileEvent {
        public ProfilesUpdated {
            profiles = List.copyOf(profiles);
        }

        @Override
        public String type() {
            return "profiles_updated";
        }
    }

    record ProfileUpdated(Profile profile) implements ProfileEvent {
        @Override
        public String type() {
            return "profile_updated";
        }
    }

    record InferenceUrlUpdated(String url) implements ProfileEvent {
        @Override
        public String type() {
            return "inference_url_updated";
        }
    }

    record CertificateConfigUpdated(Map<String, String> config) implements ProfileEvent {
        public CertificateConfigUpdated {
            config = Map.copyOf(config);
        }

        @Override
        public String type() {
            return "certificate_config_updated";
        }
    }

    /**
     * @param profileId resolved id, or null when the failure happened before an id existed
     */
    record UploadFailed(String profileId, String message) implements ProfileEvent {
        @Override
        public String type() {
            return "upload_error";
        }
    }

    record ExtractionFailed(String profileId, String message) implements ProfileEvent {
        @Override
        public String type() {
            return "extract_error";
        }
    }

    /**
     * @param step name of the certificate step that failed
     */
    record CertificateFailed(String profileId, String step, String message) implements ProfileEvent {
        @Override
        public String type() {
            return "certificate_error";
        }
    }
}
