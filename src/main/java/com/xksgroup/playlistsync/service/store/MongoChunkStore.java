package com.xksgroup.playlistsync.service.store;

import com.xksgroup.playlistsync.exception.ChunkStoreException;
import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.PlaylistChunk;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.repo.PlaylistChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * {@link ChunkStore} backed by the {@code playlist_chunks} collection, one document
 * per chunk with a unique (ownerId, chunkId) index. Single-document writes are
 * atomic in MongoDB, which is the only atomicity the store relies on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MongoChunkStore implements ChunkStore {

    // Single-record snapshots written by older versions, keyed by resource id
    static final String LEGACY_COLLECTION = "playlists";

    private final MongoTemplate mongoTemplate;
    private final PlaylistChunkRepository chunkRepository;

    @Override
    public void put(String ownerId, int chunkId, List<PlaylistItem> items) {
        try {
            mongoTemplate.upsert(chunkQuery(ownerId, chunkId), Update.update("items", items), PlaylistChunk.class);
            log.debug("Stored chunk {} for owner {} ({} items)", chunkId, ownerId, items.size());
        } catch (DataAccessException e) {
            log.error("Failed to store chunk {} for owner {}: {}", chunkId, ownerId, e.getMessage(), e);
            throw new ChunkStoreException("Failed to store chunk " + chunkId + " for " + ownerId, e);
        }
    }

    @Override
    public Optional<CategorizedPlaylist> getAll(String ownerId) {
        Query query = new Query(where("ownerId").is(ownerId)).with(Sort.by(Sort.Direction.ASC, "chunkId"));
        CategorizedPlaylist playlist = new CategorizedPlaylist();
        AtomicInteger chunkCount = new AtomicInteger();

        try (Stream<PlaylistChunk> chunks = mongoTemplate.stream(query, PlaylistChunk.class)) {
            chunks.forEach(chunk -> {
                playlist.addChunk(chunk);
                chunkCount.incrementAndGet();
            });
        } catch (DataAccessException e) {
            log.error("Failed to load chunks for owner {}, treating as no data: {}", ownerId, e.getMessage(), e);
            return Optional.empty();
        }

        if (chunkCount.get() == 0) {
            log.debug("No chunks stored for owner {}", ownerId);
            return Optional.empty();
        }
        log.debug("Loaded {} chunks for owner {}", chunkCount.get(), ownerId);
        return Optional.of(playlist);
    }

    @Override
    public void move(String sourceOwnerId, String targetOwnerId) {
        if (sourceOwnerId.equals(targetOwnerId)) {
            return;
        }

        // Only ids are needed to reassign, items stay where they are
        Query nextSource = new Query(where("ownerId").is(sourceOwnerId))
                .with(Sort.by(Sort.Direction.ASC, "chunkId"));
        nextSource.fields().include("ownerId", "chunkId");

        int moved = 0;
        try {
            PlaylistChunk chunk;
            while ((chunk = mongoTemplate.findOne(nextSource, PlaylistChunk.class)) != null) {
                // Free the (target, chunkId) slot, then reassign the chunk in one document update
                mongoTemplate.remove(chunkQuery(targetOwnerId, chunk.getChunkId()), PlaylistChunk.class);
                mongoTemplate.updateFirst(new Query(where("_id").is(chunk.getId())),
                        Update.update("ownerId", targetOwnerId), PlaylistChunk.class);
                moved++;
            }
        } catch (DataAccessException e) {
            log.error("Move from {} to {} interrupted after {} chunks: {}",
                    sourceOwnerId, targetOwnerId, moved, e.getMessage(), e);
            throw new ChunkStoreException("Failed to move chunks from " + sourceOwnerId + " to " + targetOwnerId, e);
        }
        log.info("Moved {} chunks from {} to {}", moved, sourceOwnerId, targetOwnerId);
    }

    @Override
    public void resumeMove(String sourceOwnerId, String targetOwnerId) {
        Query firstSource = new Query(where("ownerId").is(sourceOwnerId))
                .with(Sort.by(Sort.Direction.ASC, "chunkId"));
        firstSource.fields().include("chunkId");

        PlaylistChunk first;
        try {
            first = mongoTemplate.findOne(firstSource, PlaylistChunk.class);
            if (first == null) {
                log.info("Nothing left to move from {} to {}", sourceOwnerId, targetOwnerId);
                return;
            }
            long stale = mongoTemplate.remove(new Query(where("ownerId").is(targetOwnerId)
                    .and("chunkId").gte(first.getChunkId())), PlaylistChunk.class).getDeletedCount();
            log.info("Resuming move from {} to {} at chunk {} ({} stale chunks removed)",
                    sourceOwnerId, targetOwnerId, first.getChunkId(), stale);
        } catch (DataAccessException e) {
            log.error("Failed to prepare resumed move from {} to {}: {}", sourceOwnerId, targetOwnerId, e.getMessage(), e);
            throw new ChunkStoreException("Failed to resume move from " + sourceOwnerId + " to " + targetOwnerId, e);
        }
        move(sourceOwnerId, targetOwnerId);
    }

    @Override
    public void deleteAll(String ownerId) {
        try {
            long deleted = chunkRepository.deleteByOwnerId(ownerId);
            mongoTemplate.remove(new Query(where("_id").is(ownerId)), LEGACY_COLLECTION);
            if (deleted > 0) {
                log.info("Deleted {} chunks for owner {}", deleted, ownerId);
            }
        } catch (DataAccessException e) {
            log.error("Failed to delete chunks for owner {}: {}", ownerId, e.getMessage(), e);
            throw new ChunkStoreException("Failed to delete chunks of " + ownerId, e);
        }
    }

    @Override
    public void clear() {
        try {
            chunkRepository.deleteAll();
            mongoTemplate.remove(new Query(), LEGACY_COLLECTION);
            log.info("Cleared chunk store");
        } catch (DataAccessException e) {
            log.error("Failed to clear chunk store: {}", e.getMessage(), e);
            throw new ChunkStoreException("Failed to clear chunk store", e);
        }
    }

    @Override
    public long countChunks(String ownerId) {
        try {
            return chunkRepository.countByOwnerId(ownerId);
        } catch (DataAccessException e) {
            log.warn("Failed to count chunks for owner {}: {}", ownerId, e.getMessage());
            return 0;
        }
    }

    private Query chunkQuery(String ownerId, int chunkId) {
        return new Query(where("ownerId").is(ownerId).and("chunkId").is(chunkId));
    }
}
