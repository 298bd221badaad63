package com.xksgroup.playlistsync.controller;

import com.xksgroup.playlistsync.config.security.response.ActionResponse;
import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.ContentCategory;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.service.ContentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/playlist-sync/api/v1/content")
@RequiredArgsConstructor
@Tag(name = "Contenu", description = "Vue agrégée des ressources actives, par catégorie et par groupe")
public class ContentController {

    private final ContentService contentService;

    @GetMapping
    @Operation(summary = "Contenu agrégé", description = "Fusion des données validées de toutes les ressources actives, dans leur ordre de création")
    public ResponseEntity<CategorizedPlaylist> aggregate() {
        return ResponseEntity.ok(contentService.aggregate());
    }

    @GetMapping("/{category}")
    @Operation(summary = "Groupes d'une catégorie", description = "Chaque élément porte le nom de sa ressource d'origine dans `source`")
    public ResponseEntity<Map<String, List<PlaylistItem>>> groups(
            @Parameter(description = "channels, movies ou series", example = "movies", required = true)
            @PathVariable String category) {
        return ResponseEntity.ok(contentService.groups(ContentCategory.fromKey(category)));
    }

    @GetMapping("/{category}/groups/{group}")
    @Operation(summary = "Éléments d'un groupe")
    public ResponseEntity<List<PlaylistItem>> items(@PathVariable String category, @PathVariable String group) {
        return ResponseEntity.ok(contentService.items(ContentCategory.fromKey(category), group));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Recharger le contenu",
            description = "Charge depuis le stockage les vues manquantes en mémoire et lance la synchronisation des ressources sans données")
    public ResponseEntity<ActionResponse> refresh(HttpServletRequest request) {
        List<String> syncing = contentService.refreshContent();
        return ResponseEntity.ok(ActionResponse.of(200, "Contenu rechargé", Map.of("syncing", syncing), request.getRequestURI()));
    }
}
