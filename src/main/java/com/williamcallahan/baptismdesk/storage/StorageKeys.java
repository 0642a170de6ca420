package com.williamcallahan.baptismdesk.storage;

import java.util.List;

/**
 * Object key layout in the bucket. Per-profile artifacts live under folder-per-kind keys named by
 * profile id; the snapshot and the certificate template are single fixed keys.
 */
public final class StorageKeys {

    public static final String RAW_IMAGES = "raw_images";
    public static final String COMPRESSED_IMAGES = "compressed_images";
    public static final String HEADSHOTS = "headshots_rembg";
    public static final String CERTIFICATES = "certificates";
    public static final String CERTIFICATE_PREVIEWS = "certificate_previews";

    public static final String MANAGER_STATE = "manager_state.json";
    public static final String TEMPLATE = "template.pptx";

    public static final String CONTENT_TYPE_JPEG = "image/jpeg";
    public static final String CONTENT_TYPE_PNG = "image/png";
    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final String CONTENT_TYPE_PPTX =
            "application/vnd.openxmlformats-officedocument.presentationml.presentation";

    private StorageKeys() {}

    public static String rawImage(String profileId) {
        return RAW_IMAGES + "/" + profileId + ".jpg";
    }

    public static String compressedImage(String profileId) {
        return COMPRESSED_IMAGES + "/" + profileId + ".jpg";
    }

    public static String headshot(String profileId) {
        return HEADSHOTS + "/" + profileId + ".jpg";
    }

    public static String certificate(String profileId) {
        return CERTIFICATES + "/" + profileId + ".pptx";
    }

    public static String certificatePreview(String profileId) {
        return CERTIFICATE_PREVIEWS + "/" + profileId + ".png";
    }

    /**
     * Every object stored for a profile, removed together when the profile is deleted.
     */
    public static List<String> profileArtifacts(String profileId) {
        return List.of(
                rawImage(profileId),
                compressedImage(profileId),
                headshot(profileId),
                certificate(profileId),
                certificatePreview(profileId));
    }
}
