package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ResourceState;
import com.xksgroup.playlistsync.model.SyncStatus;
import com.xksgroup.playlistsync.model.dto.SubscriberDto;
import com.xksgroup.playlistsync.service.sync.ResourceStateRegistry;
import com.xksgroup.playlistsync.service.sync.SyncEventListener;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Pushes sync state to SSE subscribers. Progress is throttled, state changes and
 * terminal events are sent as they happen.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventService implements SyncEventListener {

    public static final String EVENT_SYNC_STATUS = "sync-status";
    public static final String EVENT_RESOURCE_UPDATE = "resource-update";
    public static final String EVENT_SYNC_COMPLETED = "sync-completed";
    public static final String EVENT_SYNC_FAILED = "sync-failed";
    public static final String EVENT_SYNC_CANCELLED = "sync-cancelled";

    private final Map<String, SubscriberDto> emitters = new ConcurrentHashMap<>();
    private final ResourceStateRegistry states;

    // Throttling fields
    private static final long DISPATCH_COOLDOWN_MS = 1000;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final AtomicBoolean cooldownActive = new AtomicBoolean(false);
    private final AtomicBoolean pendingUpdate = new AtomicBoolean(false);

    /**
     * Client subscribes to SSE stream.
     */
    public SseEmitter subscribe(String subscriberId, String resourceId) {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.put(subscriberId, SubscriberDto.builder().sseEmitter(emitter).resourceId(resourceId).build());

        Runnable cleanup = () -> emitters.remove(subscriberId);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(t -> cleanup.run());

        log.debug("SSE subscriber {} connected (resource filter: '{}')", subscriberId, resourceId);
        safeSend(emitter, "connected", Map.of("ok", true));
        return emitter;
    }

    @Override
    public void onStatusUpdate(String resourceId, PlaylistStats stats) {
        dispatchProgression();
    }

    @Override
    public void onRender(ResourceState state) {
        emitters.values().stream()
                .filter(subscriber -> subscriber.watches(state.getResourceId()))
                .forEach(subscriber -> safeSend(subscriber.getSseEmitter(), EVENT_RESOURCE_UPDATE, state));
    }

    @Override
    public void onSyncFinished(ResourceState state) {
        String eventName = terminalEventName(state.getStatus());
        if (eventName == null) {
            return;
        }
        emitters.values().stream()
                .filter(subscriber -> subscriber.watches(state.getResourceId()))
                .forEach(subscriber -> safeSend(subscriber.getSseEmitter(), eventName, state));
    }

    /**
     * Smart-throttled dispatch:
     * - Sends immediately if cooldown not active.
     * - Otherwise, marks pending for next round.
     * - When cooldown expires, sends the latest progress once.
     */
    public void dispatchProgression() {
        if (cooldownActive.compareAndSet(false, true)) {
            doDispatch();

            scheduler.schedule(() -> {
                cooldownActive.set(false);

                if (pendingUpdate.getAndSet(false)) {
                    dispatchProgression();
                }
            }, DISPATCH_COOLDOWN_MS, TimeUnit.MILLISECONDS);
        } else {
            pendingUpdate.set(true);
        }
    }

    private void doDispatch() {
        List<ResourceState> syncing = states.snapshots().stream()
                .filter(ResourceState::isLoading)
                .collect(Collectors.toList());

        for (SubscriberDto subscriber : emitters.values()) {
            List<ResourceState> visible = syncing.stream()
                    .filter(state -> subscriber.watches(state.getResourceId()))
                    .collect(Collectors.toList());
            if (!visible.isEmpty()) {
                safeSend(subscriber.getSseEmitter(), EVENT_SYNC_STATUS, visible);
            }
        }
    }

    public boolean isSubscriberConnected(String subscriberId) {
        return emitters.containsKey(subscriberId);
    }

    public int subscriberCount() {
        return emitters.size();
    }

    private static String terminalEventName(SyncStatus status) {
        switch (status) {
            case SYNCED:
                return EVENT_SYNC_COMPLETED;
            case ERROR:
                return EVENT_SYNC_FAILED;
            case CANCELLED:
                return EVENT_SYNC_CANCELLED;
            default:
                return null;
        }
    }

    /**
     * Safely sends an SSE event, removing the emitter on failure.
     */
    private void safeSend(SseEmitter emitter, String eventName, Object data) {
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name(eventName)
                    .data(data)
                    .reconnectTime(3000)
                    .build());
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE subscriber after failed '{}' send: {}", eventName, e.getMessage());
            try {
                emitter.completeWithError(e);
            } catch (RuntimeException completeFailure) {
                log.trace("Emitter already completed: {}", completeFailure.getMessage());
            }
            emitters.entrySet().removeIf(en -> en.getValue().getSseEmitter() == emitter);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
