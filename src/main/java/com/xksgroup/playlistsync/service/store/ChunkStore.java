package com.xksgroup.playlistsync.service.store;

import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.PlaylistItem;

import java.util.List;
import java.util.Optional;

/**
 * Owner-namespaced storage of item batches keyed by (ownerId, chunkId).
 * <p>
 * An owner is either a resource id or the temp staging id of that resource
 * ({@link #tempOwnerId(String)}); the store never mixes the two. Every single
 * operation is atomic per chunk, so concurrent syncs of different resources
 * need no extra locking.
 */
public interface ChunkStore {

    String TEMP_PREFIX = "temp_";

    /**
     * Upsert one chunk. Writing the same (ownerId, chunkId) twice keeps the last items.
     *
     * @throws com.xksgroup.playlistsync.exception.ChunkStoreException when the write fails
     */
    void put(String ownerId, int chunkId, List<PlaylistItem> items);

    /**
     * Rebuild the categorized view from every chunk of the owner, in chunkId order.
     *
     * @return empty when the owner has no chunks or the read failed
     */
    Optional<CategorizedPlaylist> getAll(String ownerId);

    /**
     * Transfer every chunk of {@code sourceOwnerId} to {@code targetOwnerId}, keeping
     * chunkIds. Chunks move one at a time; an interrupted move can be resumed by
     * calling it again.
     *
     * @throws com.xksgroup.playlistsync.exception.ChunkStoreException when the move fails
     */
    void move(String sourceOwnerId, String targetOwnerId);

    /**
     * Finish a commit that was interrupted after it started clearing the target.
     * Target chunks at or above the lowest remaining source chunkId are stale (either
     * old data not yet cleared or never overwritten) and are removed before the
     * move resumes. Does nothing when the source is empty.
     *
     * @throws com.xksgroup.playlistsync.exception.ChunkStoreException when the move fails
     */
    void resumeMove(String sourceOwnerId, String targetOwnerId);

    /**
     * Remove all chunks of the owner. No-op for an unknown owner.
     *
     * @throws com.xksgroup.playlistsync.exception.ChunkStoreException when the delete fails
     */
    void deleteAll(String ownerId);

    /**
     * Wipe everything. Full application reset only.
     */
    void clear();

    long countChunks(String ownerId);

    static String tempOwnerId(String resourceId) {
        return TEMP_PREFIX + resourceId;
    }
}
