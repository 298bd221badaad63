package com.xksgroup.playlistsync.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ProviderCredentials;
import com.xksgroup.playlistsync.model.ResourceState;
import com.xksgroup.playlistsync.model.ResourceType;
import com.xksgroup.playlistsync.model.SyncStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Client view of a resource: persisted descriptor merged with its runtime state.
 * The provider password is never returned.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResourceDto {

    static final String MASKED_PASSWORD = "********";

    private String id;
    private String name;
    private String url;
    private ResourceType type;
    private ProviderCredentials credentials;
    private boolean active;
    private PlaylistStats stats;
    private Instant lastSynced;
    private Instant createdAt;
    private Instant updatedAt;

    private SyncStatus status;
    private boolean loading;
    private PlaylistStats progress;
    private String lastError;

    public static ResourceDto from(PlaylistResource resource, ResourceState state) {
        ResourceState snapshot = state.snapshot();
        return ResourceDto.builder()
                .id(resource.getId())
                .name(resource.getName())
                .url(resource.getUrl())
                .type(resource.getType())
                .credentials(mask(resource.getCredentials()))
                .active(resource.isActive())
                .stats(resource.getStats())
                .lastSynced(resource.getLastSynced())
                .createdAt(resource.getCreatedAt())
                .updatedAt(resource.getUpdatedAt())
                .status(snapshot.getStatus())
                .loading(snapshot.isLoading())
                .progress(snapshot.getProgress())
                .lastError(snapshot.getLastError())
                .build();
    }

    private static ProviderCredentials mask(ProviderCredentials credentials) {
        if (credentials == null) {
            return null;
        }
        return ProviderCredentials.builder()
                .host(credentials.getHost())
                .username(credentials.getUsername())
                .password(MASKED_PASSWORD)
                .build();
    }
}
