package com.xksgroup.playlistsync.controller;

import com.xksgroup.playlistsync.model.dto.RemoteMergeResult;
import com.xksgroup.playlistsync.model.dto.ResourceRequest;
import com.xksgroup.playlistsync.service.ResourceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/playlist-sync/api/v1/remote-resources")
@RequiredArgsConstructor
@Tag(name = "Ressources distantes", description = "Fusion d'une liste de ressources gérée côté serveur")
public class RemoteResourceController {

    private final ResourceService resourceService;

    @PostMapping
    @Operation(
            summary = "Appliquer une liste de ressources distante",
            description = """
                    Rapproche chaque entrée par `id`, ou par `url` et `name`.
                    
                    - Entrée inconnue : ressource créée
                    - URL, type ou identifiants modifiés : ressource réinitialisée
                    - Politique `REPLACE` (`playlist.remote.merge-policy`) : les ressources locales absentes de la liste sont supprimées
                    """
    )
    public ResponseEntity<RemoteMergeResult> applyRemote(@RequestBody List<@Valid ResourceRequest> remote) {
        return ResponseEntity.ok(resourceService.applyRemote(remote));
    }
}
