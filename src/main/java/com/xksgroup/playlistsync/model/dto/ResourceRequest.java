package com.xksgroup.playlistsync.model.dto;

import com.xksgroup.playlistsync.model.ProviderCredentials;
import com.xksgroup.playlistsync.model.ResourceType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Création ou modification d'une ressource playlist")
public class ResourceRequest {

    @Schema(description = "Identifiant stable, généré si absent", example = "res-2f1c")
    private String id;

    @NotBlank(message = "name is required")
    @Size(max = 200, message = "name must be at most 200 characters")
    @Schema(description = "Nom affiché de la ressource", example = "Ma playlist")
    private String name;

    @Schema(description = "URL de la playlist M3U (type M3U)", example = "http://example.com/list.m3u")
    private String url;

    @Schema(description = "Type de source", example = "M3U")
    private ResourceType type;

    @Valid
    @Schema(description = "Identifiants du fournisseur (type XTREAM)")
    private ProviderCredentials credentials;

    @Schema(description = "Ressource active", example = "true")
    private Boolean active;
}
