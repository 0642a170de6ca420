package com.williamcallahan.baptismdesk.web;

import static com.williamcallahan.baptismdesk.web.SseConstants.COMMENT_KEEPALIVE;
import static com.williamcallahan.baptismdesk.web.SseConstants.EVENT_ERROR;
import static com.williamcallahan.baptismdesk.web.SseConstants.HEARTBEAT_INTERVAL_SECONDS;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Shared SSE helpers: JSON payloads, error events and keepalive heartbeats.
 *
 * @see SseConstants for event type constants
 */
@Component
public class SseSupport {
    private static final Logger log = LoggerFactory.getLogger(SseSupport.class);

    /** Fallback JSON payload when SSE error serialization fails. */
    private static final String ERROR_FALLBACK_JSON =
            "{\"message\":\"Error serialization failed\",\"details\":\"See server logs\"}";

    private final ObjectWriter jsonWriter;

    /**
     * Creates SSE support wired to the application's ObjectMapper.
     *
     * @param objectMapper JSON mapper for SSE payloads
     */
    public SseSupport(ObjectMapper objectMapper) {
        this.jsonWriter = objectMapper.writer();
    }

    /**
     * Disables proxy buffering so events reach the browser as they are emitted.
     *
     * @param response the servlet response to configure
     */
    public void configureStreamingHeaders(HttpServletResponse response) {
        response.addHeader("X-Accel-Buffering", "no"); // Nginx: disable proxy buffering
        response.addHeader(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform");
    }

    /**
     * Serializes an object to JSON for SSE data payloads.
     *
     * @param objectToSerialize object to serialize
     * @return JSON string representation
     * @throws IllegalStateException if serialization fails
     */
    public String jsonSerialize(Object objectToSerialize) {
        try {
            return jsonWriter.writeValueAsString(objectToSerialize);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE data", e);
        }
    }

    /**
     * Builds a named event whose data is the JSON form of {@code payload}.
     */
    public ServerSentEvent<String> event(String eventType, Object payload) {
        return ServerSentEvent.<String>builder().event(eventType).data(jsonSerialize(payload)).build();
    }

    /**
     * Creates a single SSE error event. Falls back to a fixed payload when the error itself cannot
     * be serialized, since this is the terminal path with nowhere further to report to.
     *
     * @param message user-facing error message
     * @param details additional diagnostic details
     * @return error event
     */
    public ServerSentEvent<String> sseError(String message, String details) {
        String json;
        try {
            json = jsonWriter.writeValueAsString(ApiErrorResponse.error(message, details));
        } catch (JsonProcessingException serializationFailure) {
            log.error("Failed to serialize SSE error payload", serializationFailure);
            json = ERROR_FALLBACK_JSON;
        }
        return ServerSentEvent.<String>builder().event(EVENT_ERROR).data(json).build();
    }

    /**
     * Emits keepalive comments at a fixed interval until {@code terminateOn} signals.
     *
     * @param terminateOn publisher whose first signal or completion stops the heartbeats
     * @return Flux of SSE comment events
     */
    public Flux<ServerSentEvent<String>> heartbeats(Publisher<?> terminateOn) {
        return Flux.interval(Duration.ofSeconds(HEARTBEAT_INTERVAL_SECONDS))
                .onBackpressureDrop()
                .takeUntilOther(terminateOn)
                .map(tick -> ServerSentEvent.<String>builder()
                        .comment(COMMENT_KEEPALIVE)
                        .build());
    }
}
