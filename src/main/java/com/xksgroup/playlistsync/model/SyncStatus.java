package com.xksgroup.playlistsync.model;

public enum SyncStatus {
    PENDING,        // Never synced, or source changed since last sync
    QUEUED,         // Active, waiting for a sync or for cached data
    DISABLED,       // Resource switched off
    SYNCING,        // Sync in progress
    SYNCED,         // Committed dataset available
    ERROR,          // Last sync failed
    CANCELLED;      // Last sync was cancelled or superseded

    public boolean isTerminal() {
        return this == SYNCED || this == ERROR || this == CANCELLED;
    }
}
