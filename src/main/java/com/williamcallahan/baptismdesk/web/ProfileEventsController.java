package com.williamcallahan.baptismdesk.web;

import com.williamcallahan.baptismdesk.domain.ProfileEvent;
import com.williamcallahan.baptismdesk.manager.ProfileEventListener;
import com.williamcallahan.baptismdesk.manager.ProfileManager;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Streams profile events to the browser. The connected client is the manager's single
 * subscriber; a newer connection takes over and the older stream ends with a
 * {@value SseConstants#EVENT_REPLACED} event.
 */
@RestController
@RequestMapping("/api/profiles")
public class ProfileEventsController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ProfileEventsController.class);

    private final ProfileManager profileManager;
    private final SseSupport sseSupport;

    public ProfileEventsController(ProfileManager profileManager, SseSupport sseSupport,
                                   ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.profileManager = profileManager;
        this.sseSupport = sseSupport;
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> events(HttpServletResponse response) {
        sseSupport.configureStreamingHeaders(response);

        Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().unicast().onBackpressureBuffer();
        Sinks.Empty<Void> closed = Sinks.empty();
        ProfileEventListener listener = new StreamingListener(sink);

        Flux<ServerSentEvent<String>> events = sink.asFlux()
                .doOnSubscribe(subscription -> profileManager.registerSubscriber(listener)
                        .whenComplete((ignored, failure) -> {
                            if (failure != null) {
                                log.warn("Could not register event stream: {}", failure.getMessage());
                                sink.tryEmitNext(sseSupport.sseError("Event stream unavailable", failure.getMessage()));
                                sink.tryEmitComplete();
                            }
                        }))
                .doFinally(signal -> {
                    closed.tryEmitEmpty();
                    profileManager.clearSubscriber(listener);
                    log.debug("Event stream closed ({})", signal);
                });

        return Flux.merge(events, sseSupport.heartbeats(closed.asMono()));
    }

    /**
     * Converts manager events to SSE frames. Runs on the manager thread, which is the only emitter
     * once registration succeeds.
     */
    private final class StreamingListener implements ProfileEventListener {
        private final Sinks.Many<ServerSentEvent<String>> sink;

        private StreamingListener(Sinks.Many<ServerSentEvent<String>> sink) {
            this.sink = sink;
        }

        @Override
        public void onEvent(ProfileEvent event) {
            Sinks.EmitResult result = sink.tryEmitNext(sseSupport.event(event.type(), event));
            if (result.isFailure()) {
                log.debug("Dropped {} event: {}", event.type(), result);
            }
        }

        @Override
        public void onReplaced() {
            sink.tryEmitNext(sseSupport.event(SseConstants.EVENT_REPLACED,
                    Map.of("message", "Another client took over the event stream")));
            sink.tryEmitComplete();
        }
    }
}
