package com.williamcallahan.baptismdesk.web;

/**
 * @param url effective inference base URL
 */
public record InferenceUrlResponse(String url) {}
