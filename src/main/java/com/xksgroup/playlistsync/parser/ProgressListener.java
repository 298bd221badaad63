package com.xksgroup.playlistsync.parser;

import com.xksgroup.playlistsync.model.PlaylistStats;

@FunctionalInterface
public interface ProgressListener {

    /**
     * @param stats a copy of the running counters, safe to keep
     */
    void onProgress(PlaylistStats stats);

    static ProgressListener none() {
        return stats -> { };
    }
}
