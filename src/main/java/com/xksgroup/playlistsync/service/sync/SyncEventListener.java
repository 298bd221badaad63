package com.xksgroup.playlistsync.service.sync;

import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ResourceState;

/**
 * Observer of sync flows. Called from sync threads; implementations must not block.
 */
public interface SyncEventListener {

    /**
     * Throttled progress of an in-flight sync.
     */
    void onStatusUpdate(String resourceId, PlaylistStats stats);

    /**
     * Any visible state change: status, loading flag, committed data.
     */
    void onRender(ResourceState state);

    /**
     * A sync attempt ended; {@code state} carries its terminal status.
     */
    void onSyncFinished(ResourceState state);

    static SyncEventListener none() {
        return new SyncEventListener() {
            @Override
            public void onStatusUpdate(String resourceId, PlaylistStats stats) {
            }

            @Override
            public void onRender(ResourceState state) {
            }

            @Override
            public void onSyncFinished(ResourceState state) {
            }
        };
    }
}
