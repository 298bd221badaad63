package com.xksgroup.playlistsync.controller;

import com.xksgroup.playlistsync.service.EventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

@Tag(
        name = "Streaming de synchronisation",
        description = "Mises à jour en temps réel des synchronisations via Server-Sent Events (SSE)."
)
@RestController
@RequestMapping("/playlist-sync/api/v1")
@RequiredArgsConstructor
public class SyncEventsController {

    private final EventService eventService;

    @Operation(
            summary = "Diffuser les événements de synchronisation",
            description = """
                Flux **Server-Sent Events** des synchronisations.
                
                Événements :
                - `sync-status` : progression des synchronisations en cours (limitée en fréquence)
                - `resource-update` : tout changement d'état d'une ressource
                - `sync-completed`, `sync-failed`, `sync-cancelled` : fin d'une synchronisation
                
                Le paramètre `resourceId` restreint le flux à une ressource.
                """,
            responses = @ApiResponse(
                    responseCode = "200",
                    description = "Flux SSE démarré (Content-Type: text/event-stream)",
                    content = @Content(mediaType = "text/event-stream", schema = @Schema(implementation = String.class))
            )
    )
    @GetMapping(value = "/sync-events", produces = "text/event-stream")
    public SseEmitter streamSyncEvents(@AuthenticationPrincipal Jwt principal,
                                       @RequestParam(required = false, defaultValue = "") String resourceId) {
        // One stream per connection, the JWT subject only makes the id readable in logs
        String subscriberId = (principal != null ? principal.getSubject() + ":" : "") + UUID.randomUUID();
        return eventService.subscribe(subscriberId, resourceId);
    }
}
