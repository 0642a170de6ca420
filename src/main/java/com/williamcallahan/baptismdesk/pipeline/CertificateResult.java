package com.williamcallahan.baptismdesk.pipeline;

/**
 * Storage keys written by a successful certificate run.
 */
public record CertificateResult(String profileId, String documentKey, String previewKey) {}
