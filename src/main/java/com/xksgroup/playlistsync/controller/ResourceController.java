package com.xksgroup.playlistsync.controller;

import com.xksgroup.playlistsync.config.security.response.ActionResponse;
import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.SyncStatus;
import com.xksgroup.playlistsync.model.dto.ResourceDto;
import com.xksgroup.playlistsync.model.dto.ResourceRequest;
import com.xksgroup.playlistsync.service.ResourceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/playlist-sync/api/v1/resources")
@RequiredArgsConstructor
@Tag(name = "Ressources playlist", description = "Gestion des sources de playlists (M3U, Xtream) et de leur synchronisation")
public class ResourceController {

    private final ResourceService resourceService;

    @GetMapping
    @Operation(summary = "Lister les ressources", description = "Retourne toutes les ressources avec leur statut de synchronisation courant")
    public ResponseEntity<List<ResourceDto>> listResources() {
        return ResponseEntity.ok(resourceService.listResources());
    }

    @PostMapping
    @Operation(
            summary = "Créer une ressource",
            description = """
                    Enregistre une nouvelle source de playlist.
                    
                    - `M3U` : `url` est obligatoire
                    - `XTREAM` : `credentials` (host, username, password) sont obligatoires et vérifiés auprès du fournisseur
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Ressource créée",
                    content = @Content(schema = @Schema(implementation = ResourceDto.class))),
            @ApiResponse(responseCode = "400", description = "Données invalides", content = @Content),
            @ApiResponse(responseCode = "422", description = "Identifiants refusés par le fournisseur", content = @Content)
    })
    public ResponseEntity<ResourceDto> createResource(@Valid @RequestBody ResourceRequest request) {
        PlaylistResource created = resourceService.createResource(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(resourceService.toDto(created));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Obtenir une ressource par son ID")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ressource trouvée"),
            @ApiResponse(responseCode = "404", description = "Ressource non trouvée", content = @Content)
    })
    public ResponseEntity<ResourceDto> getResource(
            @Parameter(description = "Identifiant de la ressource", example = "res-2f1c", required = true)
            @PathVariable String id) {
        return ResponseEntity.ok(resourceService.toDto(resourceService.getResource(id)));
    }

    @PutMapping("/{id}")
    @Operation(
            summary = "Modifier une ressource",
            description = "Un changement d'URL, de type ou d'identifiants supprime les données stockées ; un simple renommage les conserve."
    )
    public ResponseEntity<ResourceDto> updateResource(@PathVariable String id,
                                                      @Valid @RequestBody ResourceRequest request) {
        return ResponseEntity.ok(resourceService.toDto(resourceService.updateResource(id, request)));
    }

    @PatchMapping("/{id}/active")
    @Operation(summary = "Activer ou désactiver une ressource", description = "Les données stockées sont conservées")
    public ResponseEntity<ResourceDto> setActive(@PathVariable String id,
                                                 @RequestParam boolean active) {
        return ResponseEntity.ok(resourceService.toDto(resourceService.setActive(id, active)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Supprimer une ressource", description = "Annule la synchronisation en cours et supprime toutes les données stockées")
    public ResponseEntity<Map<String, Object>> deleteResource(@PathVariable String id) {
        resourceService.deleteResource(id);
        return ResponseEntity.ok(Map.of("deleted", true, "id", id));
    }

    @DeleteMapping
    @Operation(summary = "Réinitialisation complète", description = "Annule toutes les synchronisations et supprime toutes les ressources et données")
    public ResponseEntity<ActionResponse> resetAll(HttpServletRequest request) {
        resourceService.resetAll();
        return ResponseEntity.ok(ActionResponse.of(200, "Toutes les ressources ont été supprimées", null, request.getRequestURI()));
    }

    @PostMapping("/{id}/sync")
    @Operation(summary = "Lancer la synchronisation d'une ressource",
            description = "La synchronisation s'exécute en arrière-plan ; suivre la progression via `/sync-events`.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Synchronisation lancée"),
            @ApiResponse(responseCode = "404", description = "Ressource non trouvée", content = @Content),
            @ApiResponse(responseCode = "409", description = "Ressource désactivée", content = @Content)
    })
    public ResponseEntity<ActionResponse> startSync(@PathVariable String id, HttpServletRequest request) {
        resourceService.startSync(id);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ActionResponse.of(202, "Synchronisation lancée", Map.of("id", id), request.getRequestURI()));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Annuler la synchronisation d'une ressource")
    public ResponseEntity<ActionResponse> cancelSync(@PathVariable String id, HttpServletRequest request) {
        boolean cancelled = resourceService.cancelSync(id);
        String message = cancelled ? "Annulation demandée" : "Aucune synchronisation en cours";
        return ResponseEntity.ok(ActionResponse.of(200, message, Map.of("id", id, "cancelled", cancelled), request.getRequestURI()));
    }

    @PostMapping("/sync")
    @Operation(summary = "Synchroniser toutes les ressources actives")
    public ResponseEntity<ActionResponse> syncAll(HttpServletRequest request) {
        List<String> queued = resourceService.syncAllActive();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ActionResponse.of(202, queued.size() + " synchronisation(s) lancée(s)", queued, request.getRequestURI()));
    }

    @PostMapping("/cancel")
    @Operation(summary = "Annuler toutes les synchronisations en cours")
    public ResponseEntity<ActionResponse> cancelAll(HttpServletRequest request) {
        int cancelled = resourceService.cancelAll();
        return ResponseEntity.ok(ActionResponse.of(200, cancelled + " synchronisation(s) annulée(s)", cancelled, request.getRequestURI()));
    }

    @PostMapping(value = "/{id}/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Importer un fichier M3U",
            description = "Remplace les données de la ressource par le fichier envoyé, avec le même chemin de staging et de validation qu'une synchronisation")
    public ResponseEntity<ResourceDto> importFile(@PathVariable String id,
                                                  @RequestPart("file") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded playlist is empty");
        }
        SyncStatus status;
        try (InputStream input = file.getInputStream()) {
            status = resourceService.importStream(id, input);
        }
        log.info("Import of '{}' into {} ended with {}", file.getOriginalFilename(), id, status);
        return ResponseEntity.ok(resourceService.toDto(resourceService.getResource(id)));
    }

    @PostMapping(value = "/{id}/import", consumes = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Importer une playlist M3U en texte brut")
    public ResponseEntity<ResourceDto> importText(@PathVariable String id, @RequestBody String text) {
        SyncStatus status = resourceService.importText(id, text);
        log.info("Text import into {} ended with {}", id, status);
        return ResponseEntity.ok(resourceService.toDto(resourceService.getResource(id)));
    }

    @GetMapping("/{id}/content")
    @Operation(summary = "Contenu d'une ressource", description = "Vue catégorie → groupe → éléments des données validées de la ressource")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Contenu trouvé"),
            @ApiResponse(responseCode = "204", description = "Aucune donnée synchronisée", content = @Content),
            @ApiResponse(responseCode = "404", description = "Ressource non trouvée", content = @Content)
    })
    public ResponseEntity<CategorizedPlaylist> getContent(@PathVariable String id) {
        return resourceService.getContent(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
