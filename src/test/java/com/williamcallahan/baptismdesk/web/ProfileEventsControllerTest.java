package com.williamcallahan.baptismdesk.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.baptismdesk.domain.ProfileEvent;
import com.williamcallahan.baptismdesk.manager.ProfileEventListener;
import com.williamcallahan.baptismdesk.manager.ProfileManager;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.mock.web.MockHttpServletResponse;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

/**
 * Verifies the event stream registers as the manager's subscriber, relays events and ends when
 * another client takes over.
 */
class ProfileEventsControllerTest {

    private final ProfileManager profileManager = mock(ProfileManager.class);
    private final AtomicReference<ProfileEventListener> registered = new AtomicReference<>();
    private ProfileEventsController controller;

    @BeforeEach
    void setUp() {
        given(profileManager.clearSubscriber(any())).willReturn(CompletableFuture.completedFuture(true));
        controller = new ProfileEventsController(profileManager, new SseSupport(new ObjectMapper()),
                new ExceptionResponseBuilder());
    }

    @Test
    void events_relaysManagerEventsUntilReplaced() {
        given(profileManager.registerSubscriber(any())).willAnswer(invocation -> {
            registered.set(invocation.getArgument(0));
            return CompletableFuture.completedFuture(null);
        });
        Flux<ServerSentEvent<String>> stream = controller.events(new MockHttpServletResponse());

        StepVerifier.create(stream)
                .then(() -> registered.get().onEvent(new ProfileEvent.ExtractionFailed("abcd1234", "timed out")))
                .assertNext(event -> {
                    assertEquals("extract_error", event.event());
                    assertTrue(event.data().contains("\"message\":\"timed out\""), event.data());
                })
                .then(() -> registered.get().onReplaced())
                .assertNext(event -> assertEquals(SseConstants.EVENT_REPLACED, event.event()))
                .verifyComplete();

        then(profileManager).should().clearSubscriber(registered.get());
    }

    @Test
    void events_reportsRegistrationFailureAndCloses() {
        given(profileManager.registerSubscriber(any())).willReturn(
                CompletableFuture.failedFuture(new IllegalStateException("Profile manager is shut down")));

        StepVerifier.create(controller.events(new MockHttpServletResponse()))
                .assertNext(event -> {
                    assertEquals(SseConstants.EVENT_ERROR, event.event());
                    assertTrue(event.data().contains("Profile manager is shut down"), event.data());
                })
                .verifyComplete();
    }
}
