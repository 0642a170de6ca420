package com.williamcallahan.baptismdesk.web;

/**
 * Shared contract for JSON status payloads so clients can branch on {@code status} uniformly.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return "success" or "error"
     */
    String status();
}
