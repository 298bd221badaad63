package com.xksgroup.playlistsync.parser;

import com.xksgroup.playlistsync.model.PlaylistItem;

import java.util.List;

/**
 * Receives completed item batches. The parser does not read further input
 * until {@code accept} returns, which bounds memory to one batch.
 */
@FunctionalInterface
public interface BatchSink {

    void accept(List<PlaylistItem> batch);

    static BatchSink discarding() {
        return batch -> { };
    }
}
