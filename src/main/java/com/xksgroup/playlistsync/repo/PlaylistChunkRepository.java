package com.xksgroup.playlistsync.repo;

import com.xksgroup.playlistsync.model.PlaylistChunk;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlaylistChunkRepository extends MongoRepository<PlaylistChunk, String> {

    long countByOwnerId(String ownerId);

    long deleteByOwnerId(String ownerId);
}
