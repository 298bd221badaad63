package com.xksgroup.playlistsync.controller;

import com.mongodb.MongoException;
import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.dto.HealthDto;
import com.xksgroup.playlistsync.repo.PlaylistResourceRepository;
import com.xksgroup.playlistsync.service.EventService;
import com.xksgroup.playlistsync.service.SyncOrchestrator;
import com.xksgroup.playlistsync.service.store.ChunkStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/playlist-sync/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Santé", description = "Vérification de la base MongoDB et état des synchronisations")
public class HealthController {

    private final MongoTemplate mongoTemplate;
    private final PlaylistResourceRepository resourceRepository;
    private final ChunkStore chunkStore;
    private final SyncOrchestrator orchestrator;
    private final EventService eventService;

    @GetMapping
    @Operation(
        summary = "Vérification de santé du service",
        description = "Vérifie la connectivité MongoDB et retourne le nombre de synchronisations actives et de blocs stockés par ressource."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Le service est en bonne santé"),
        @ApiResponse(responseCode = "503", description = "MongoDB est injoignable")
    })
    public ResponseEntity<HealthDto> health() {
        HealthDto.HealthDtoBuilder health = HealthDto.builder()
                .activeSyncs(orchestrator.activeSyncCount())
                .sseSubscribers(eventService.subscriberCount());

        try {
            mongoTemplate.getDb().runCommand(new Document("ping", 1));
            List<PlaylistResource> resources = resourceRepository.findAll();
            Map<String, Long> chunkCounts = new LinkedHashMap<>();
            resources.forEach(resource -> chunkCounts.put(resource.getId(), chunkStore.countChunks(resource.getId())));

            return ResponseEntity.ok(health
                    .status("healthy")
                    .mongoReachable(true)
                    .resources(resources.size())
                    .chunkCounts(chunkCounts)
                    .build());
        } catch (DataAccessException | MongoException e) {
            log.error("Health check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health
                    .status("unhealthy")
                    .mongoReachable(false)
                    .mongoError(e.getMessage())
                    .build());
        }
    }
}
