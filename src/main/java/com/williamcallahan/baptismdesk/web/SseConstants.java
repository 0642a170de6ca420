package com.williamcallahan.baptismdesk.web;

/**
 * SSE event names and streaming parameters for the profile event stream.
 *
 * <p>Profile events use their own {@code type()} as the event name; the constants here cover the
 * stream's control events.</p>
 */
public final class SseConstants {

    /** SSE event type for error notifications sent to the client. */
    public static final String EVENT_ERROR = "error";

    /** SSE event type sent when another client takes over the subscription. */
    public static final String EVENT_REPLACED = "replaced";

    /** SSE comment content for keepalive heartbeats. */
    public static final String COMMENT_KEEPALIVE = "keepalive";

    /** Heartbeat interval in seconds to keep SSE connections alive through proxies. */
    public static final int HEARTBEAT_INTERVAL_SECONDS = 20;

    private SseConstants() {
        // Non-instantiable utility class
    }
}
