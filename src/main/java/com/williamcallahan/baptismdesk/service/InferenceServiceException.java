package com.williamcallahan.baptismdesk.service;

/**
 * Signals that the inference endpoint could not produce extraction fields for a profile.
 *
 * <p>The {@link Kind} separates transport problems from HTTP rejections and from responses that
 * arrived but could not be understood, so callers can report each distinctly.</p>
 */
public class InferenceServiceException extends RuntimeException {

    /** Failure category. */
    public enum Kind {
        /** Connection refused, timeout or other I/O failure before a response arrived. */
        TRANSPORT,
        /** The endpoint answered with a non-200 status. */
        HTTP_STATUS,
        /** The body was not JSON or lacked the extraction result. */
        MALFORMED_RESPONSE
    }

    private final Kind kind;
    private final int statusCode;

    /**
     * Creates an exception of the given kind.
     *
     * @param kind failure category
     * @param message explanation of the failure
     * @param cause underlying exception, may be null
     */
    public InferenceServiceException(Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    /**
     * Creates an {@link Kind#HTTP_STATUS} exception carrying the response status.
     *
     * @param statusCode HTTP status returned by the endpoint
     * @param message explanation including a body snippet
     * @param cause underlying exception
     */
    public InferenceServiceException(int statusCode, String message, Throwable cause) {
        this(Kind.HTTP_STATUS, statusCode, message, cause);
    }

    private InferenceServiceException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return HTTP status for {@link Kind#HTTP_STATUS} failures, otherwise -1
     */
    public int getStatusCode() {
        return statusCode;
    }
}
