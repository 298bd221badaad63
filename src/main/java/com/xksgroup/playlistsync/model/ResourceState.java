package com.xksgroup.playlistsync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.xksgroup.playlistsync.service.sync.CancellationToken;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * In-memory state of one resource: sync status, live progress and the
 * committed dataset. Guarded by its own monitor, see {@link #snapshot()}.
 */
@RequiredArgsConstructor
@ToString(exclude = {"playlist", "cancellationToken"})
public class ResourceState {

    @Getter
    private final String resourceId;

    private SyncStatus status = SyncStatus.PENDING;
    private boolean loading;
    private PlaylistStats progress;
    private String lastError;
    private Instant updatedAt = Instant.now();

    @JsonIgnore
    private CategorizedPlaylist playlist;

    @JsonIgnore
    private CancellationToken cancellationToken;

    public synchronized void markSyncing(CancellationToken token) {
        this.status = SyncStatus.SYNCING;
        this.loading = true;
        this.cancellationToken = token;
        this.progress = PlaylistStats.empty();
        this.lastError = null;
        this.updatedAt = Instant.now();
    }

    public synchronized void updateProgress(PlaylistStats stats) {
        this.progress = stats;
        this.updatedAt = Instant.now();
    }

    public synchronized void markTerminal(SyncStatus terminal, String error) {
        this.status = terminal;
        this.lastError = error;
        this.updatedAt = Instant.now();
    }

    public synchronized void markSynced(CategorizedPlaylist committed) {
        this.playlist = committed;
        this.status = SyncStatus.SYNCED;
        this.lastError = null;
        this.updatedAt = Instant.now();
    }

    /**
     * Clear the transient sync fields, but only the token that belongs to the finishing flow.
     */
    public synchronized void clearInFlight(CancellationToken token) {
        if (this.cancellationToken == token) {
            this.cancellationToken = null;
        }
        this.loading = false;
        this.progress = null;
        this.updatedAt = Instant.now();
    }

    public synchronized void setStatus(SyncStatus status) {
        this.status = status;
        this.updatedAt = Instant.now();
    }

    public synchronized void setPlaylist(CategorizedPlaylist playlist) {
        this.playlist = playlist;
    }

    public synchronized SyncStatus getStatus() {
        return status;
    }

    public synchronized boolean isLoading() {
        return loading;
    }

    public synchronized PlaylistStats getProgress() {
        return progress;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonIgnore
    public synchronized CategorizedPlaylist getPlaylist() {
        return playlist;
    }

    @JsonIgnore
    public synchronized CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public synchronized ResourceState snapshot() {
        ResourceState copy = new ResourceState(resourceId);
        copy.status = status;
        copy.loading = loading;
        copy.progress = progress != null ? progress.copy() : null;
        copy.lastError = lastError;
        copy.updatedAt = updatedAt;
        copy.playlist = playlist;
        return copy;
    }
}
