package com.williamcallahan.baptismdesk.web;

/**
 * Presigned read URLs for one profile's stored artifacts. A null entry means the object does not
 * exist yet.
 */
public record ProfileLinksResponse(
        String id, String rawImage, String compressedImage, String headshot, String certificate, String preview) {}
