package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.ContentCategory;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.ResourceState;
import com.xksgroup.playlistsync.model.SyncStatus;
import com.xksgroup.playlistsync.repo.PlaylistResourceRepository;
import com.xksgroup.playlistsync.service.store.ChunkStore;
import com.xksgroup.playlistsync.service.sync.ResourceStateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side: the merged view of every active resource.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentService {

    private final PlaylistResourceRepository resourceRepository;
    private final ResourceStateRegistry states;
    private final ChunkStore chunkStore;
    private final SyncOrchestrator orchestrator;

    /**
     * Merge the committed views of all active resources, in resource creation order.
     * Items are tagged with the name of their resource.
     */
    public CategorizedPlaylist aggregate() {
        CategorizedPlaylist aggregated = new CategorizedPlaylist();
        for (PlaylistResource resource : resourceRepository.findAllByOrderByCreatedAtAsc()) {
            if (!resource.isActive()) {
                continue;
            }
            ResourceState state = states.get(resource.getId());
            CategorizedPlaylist view = state.getPlaylist();
            if (view == null && state.getStatus() == SyncStatus.SYNCED) {
                // Committed but not read back yet
                view = chunkStore.getAll(resource.getId()).orElse(null);
                state.setPlaylist(view);
            }
            if (view != null) {
                String source = resource.getName();
                aggregated.addAll(view, item -> item.toBuilder().source(source).build());
            }
        }
        return aggregated;
    }

    /**
     * Make sure every active resource has its view in memory: load it from the store,
     * or start a sync when the store has nothing.
     *
     * @return ids of the resources whose sync was started
     */
    public List<String> refreshContent() {
        List<String> syncing = new ArrayList<>();
        for (PlaylistResource resource : resourceRepository.findActive()) {
            ResourceState state = states.get(resource.getId());
            if (state.getPlaylist() != null || orchestrator.isSyncing(resource.getId())) {
                continue;
            }
            Optional<CategorizedPlaylist> cached = chunkStore.getAll(resource.getId());
            if (cached.isPresent()) {
                state.markSynced(cached.get());
            } else {
                log.info("No stored data for {}, starting sync", resource.getId());
                state.setStatus(SyncStatus.QUEUED);
                orchestrator.syncAsync(resource);
                syncing.add(resource.getId());
            }
        }
        return syncing;
    }

    public Map<String, List<PlaylistItem>> groups(ContentCategory category) {
        return aggregate().groups(category);
    }

    public List<PlaylistItem> items(ContentCategory category, String group) {
        return aggregate().items(category, group);
    }
}
