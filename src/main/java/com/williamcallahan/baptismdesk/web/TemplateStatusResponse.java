package com.williamcallahan.baptismdesk.web;

/**
 * @param exists whether a certificate template has been uploaded
 * @param url presigned download URL, null when absent
 */
public record TemplateStatusResponse(boolean exists, String url) {}
