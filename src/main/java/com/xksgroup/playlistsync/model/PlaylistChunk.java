package com.xksgroup.playlistsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = PlaylistChunk.COLLECTION)
@CompoundIndex(name = "owner_chunk_idx", def = "{'ownerId': 1, 'chunkId': 1}", unique = true)
public class PlaylistChunk {

    public static final String COLLECTION = "playlist_chunks";

    @Id
    private String id;

    private String ownerId;     // resource id, or its temp staging id during a sync
    private int chunkId;        // write order within one sync session, starting at 0

    private List<PlaylistItem> items;
}
