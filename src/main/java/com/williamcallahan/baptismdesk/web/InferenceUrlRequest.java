package com.williamcallahan.baptismdesk.web;

/**
 * @param url new inference base URL; blank restores the configured default
 */
public record InferenceUrlRequest(String url) {}
