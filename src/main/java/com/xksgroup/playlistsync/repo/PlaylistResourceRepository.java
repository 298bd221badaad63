package com.xksgroup.playlistsync.repo;

import com.xksgroup.playlistsync.model.PlaylistResource;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PlaylistResourceRepository extends MongoRepository<PlaylistResource, String> {

    List<PlaylistResource> findAllByOrderByCreatedAtAsc();

    @Query("{ 'active': true }")
    List<PlaylistResource> findActive();

    List<PlaylistResource> findByCommitPendingTrue();
}
