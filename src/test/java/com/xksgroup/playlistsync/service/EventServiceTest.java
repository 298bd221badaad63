package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.model.ResourceState;
import com.xksgroup.playlistsync.model.SyncStatus;
import com.xksgroup.playlistsync.service.sync.ResourceStateRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class EventServiceTest {

    private ResourceStateRegistry states;
    private EventService eventService;

    @BeforeEach
    void setUp() {
        states = new ResourceStateRegistry();
        eventService = new EventService(states);
    }

    @AfterEach
    void tearDown() {
        eventService.shutdown();
    }

    @Test
    void subscribersAreTrackedUntilCompletion() {
        SseEmitter emitter = eventService.subscribe("sub-1", "");
        eventService.subscribe("sub-2", "r1");

        assertThat(eventService.subscriberCount()).isEqualTo(2);
        assertThat(eventService.isSubscriberConnected("sub-1")).isTrue();
        assertThat(emitter.getTimeout()).isEqualTo(0L);
    }

    @Test
    void eventsWithoutConnectedClientsDoNotFail() {
        eventService.subscribe("sub-1", "r1");
        ResourceState state = states.get("r1");
        state.setStatus(SyncStatus.SYNCED);

        assertThatCode(() -> {
            eventService.onRender(state);
            eventService.onSyncFinished(state);
            eventService.onStatusUpdate("r1", null);
        }).doesNotThrowAnyException();
    }

    @Test
    void nonTerminalFinishIsIgnored() {
        ResourceState state = states.get("r2");
        state.setStatus(SyncStatus.QUEUED);

        assertThatCode(() -> eventService.onSyncFinished(state)).doesNotThrowAnyException();
    }
}
