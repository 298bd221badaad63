package com.xksgroup.playlistsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted descriptor of a playlist source. Runtime state (status, loading
 * flag, cancellation token) lives in {@link ResourceState} and is never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "playlist_resources")
public class PlaylistResource {

    @Id
    private String id;

    private String name;

    // Raw playlist URL for M3U, normalized host for XTREAM
    private String url;

    private ProviderCredentials credentials;

    @Builder.Default
    private ResourceType type = ResourceType.M3U;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private PlaylistStats stats = new PlaylistStats();

    private Instant lastSynced;

    // Set while temp chunks are being moved under the real id
    private boolean commitPending;

    private Instant createdAt;
    private Instant updatedAt;
}
