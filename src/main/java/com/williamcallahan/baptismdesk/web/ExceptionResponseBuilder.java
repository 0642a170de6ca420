package com.williamcallahan.baptismdesk.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;

/**
 * Builds the JSON status payloads returned by every controller.
 */
@Component
public class ExceptionResponseBuilder {

    private static final int MAX_DETAIL_LENGTH = 500;

    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response whose details describe the exception.
     *
     * @param status HTTP status
     * @param message user-facing message
     * @param exception cause, may be null
     * @return error response entity
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    public ResponseEntity<ApiResponse> buildAcceptedResponse(String message) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception for clients: its type and message, plus status and body for
     * failed outbound HTTP calls.
     *
     * @param exception exception to describe
     * @return description, or null when no exception is given
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder details = new StringBuilder(exception.getClass().getSimpleName());
        if (exception.getMessage() != null) {
            details.append(": ").append(exception.getMessage());
        }
        if (exception instanceof RestClientResponseException httpFailure) {
            details.append(" [HTTP ").append(httpFailure.getStatusCode().value()).append(']');
            String body = httpFailure.getResponseBodyAsString();
            if (!body.isBlank()) {
                details.append(" ").append(body.strip());
            }
        }
        return details.length() > MAX_DETAIL_LENGTH ? details.substring(0, MAX_DETAIL_LENGTH) + "..." : details.toString();
    }
}
