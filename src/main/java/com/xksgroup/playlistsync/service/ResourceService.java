package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.exception.ChunkStoreException;
import com.xksgroup.playlistsync.exception.ResourceNotFoundException;
import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ProviderCredentials;
import com.xksgroup.playlistsync.model.ResourceState;
import com.xksgroup.playlistsync.model.ResourceType;
import com.xksgroup.playlistsync.model.SyncStatus;
import com.xksgroup.playlistsync.model.dto.RemoteMergeResult;
import com.xksgroup.playlistsync.model.dto.ResourceDto;
import com.xksgroup.playlistsync.model.dto.ResourceRequest;
import com.xksgroup.playlistsync.repo.PlaylistResourceRepository;
import com.xksgroup.playlistsync.service.provider.ProviderClient;
import com.xksgroup.playlistsync.service.store.ChunkStore;
import com.xksgroup.playlistsync.service.sync.ResourceStateRegistry;
import com.xksgroup.playlistsync.service.sync.SyncEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Lifecycle of playlist resources: CRUD on descriptors, activation, sync
 * triggers, import, startup recovery and remote list merging.
 */
@Slf4j
@Service
public class ResourceService {

    private final PlaylistResourceRepository resourceRepository;
    private final ChunkStore chunkStore;
    private final SyncOrchestrator orchestrator;
    private final ResourceStateRegistry states;
    private final ProviderClient providerClient;
    private final RemoteResourceMerger merger;
    private final SyncEventListener listener;
    private final boolean verifyOnSave;
    private final boolean syncOnStartup;
    private final RemoteMergePolicy mergePolicy;

    public ResourceService(PlaylistResourceRepository resourceRepository,
                           ChunkStore chunkStore,
                           SyncOrchestrator orchestrator,
                           ResourceStateRegistry states,
                           ProviderClient providerClient,
                           RemoteResourceMerger merger,
                           SyncEventListener listener,
                           @Value("${playlist.provider.verify-on-save:true}") boolean verifyOnSave,
                           @Value("${playlist.sync.on-startup:false}") boolean syncOnStartup,
                           @Value("${playlist.remote.merge-policy:MERGE}") RemoteMergePolicy mergePolicy) {
        this.resourceRepository = resourceRepository;
        this.chunkStore = chunkStore;
        this.orchestrator = orchestrator;
        this.states = states;
        this.providerClient = providerClient;
        this.merger = merger;
        this.listener = listener;
        this.verifyOnSave = verifyOnSave;
        this.syncOnStartup = syncOnStartup;
        this.mergePolicy = mergePolicy;
    }

    public List<ResourceDto> listResources() {
        return resourceRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    public PlaylistResource getResource(String resourceId) {
        return resourceRepository.findById(resourceId)
                .orElseThrow(() -> new ResourceNotFoundException(resourceId));
    }

    public ResourceDto toDto(PlaylistResource resource) {
        return ResourceDto.from(resource, states.get(resource.getId()));
    }

    public PlaylistResource createResource(ResourceRequest request) {
        ResourceRequest normalized = normalize(request);
        validateSource(normalized);

        String resourceId = normalized.getId() != null && !normalized.getId().isBlank()
                ? normalized.getId()
                : "res-" + UUID.randomUUID();
        if (resourceRepository.existsById(resourceId)) {
            throw new IllegalArgumentException("Resource already exists: " + resourceId);
        }
        if (verifyOnSave && normalized.getType() == ResourceType.XTREAM) {
            providerClient.authenticate(normalized.getCredentials());
        }

        Instant now = Instant.now();
        PlaylistResource resource = PlaylistResource.builder()
                .id(resourceId)
                .name(normalized.getName())
                .url(normalized.getUrl())
                .type(normalized.getType())
                .credentials(normalized.getCredentials())
                .active(normalized.getActive() == null || normalized.getActive())
                .stats(PlaylistStats.empty())
                .createdAt(now)
                .updatedAt(now)
                .build();
        PlaylistResource saved = resourceRepository.save(resource);

        ResourceState state = states.get(resourceId);
        state.setStatus(saved.isActive() ? SyncStatus.PENDING : SyncStatus.DISABLED);
        listener.onRender(state.snapshot());

        log.info("Created resource {} '{}' ({})", resourceId, saved.getName(), saved.getType());
        return saved;
    }

    /**
     * Update a descriptor. A new url, type or credentials invalidate the stored data;
     * a rename keeps it.
     */
    public PlaylistResource updateResource(String resourceId, ResourceRequest request) {
        PlaylistResource resource = getResource(resourceId);
        ResourceRequest normalized = normalize(request);
        validateSource(normalized);

        boolean sourceChanged = !Objects.equals(resource.getUrl(), normalized.getUrl())
                || resource.getType() != normalized.getType()
                || !Objects.equals(resource.getCredentials(), normalized.getCredentials());

        if (sourceChanged && verifyOnSave && normalized.getType() == ResourceType.XTREAM) {
            providerClient.authenticate(normalized.getCredentials());
        }

        resource.setName(normalized.getName());
        resource.setUrl(normalized.getUrl());
        resource.setType(normalized.getType());
        resource.setCredentials(normalized.getCredentials());
        if (normalized.getActive() != null) {
            resource.setActive(normalized.getActive());
        }
        resource.setUpdatedAt(Instant.now());

        if (sourceChanged) {
            log.info("Source of resource {} changed, discarding stored data", resourceId);
            orchestrator.cancelSync(resourceId);
            orchestrator.awaitIdle(resourceId);
            resetData(resource);
        }
        PlaylistResource saved = resourceRepository.save(resource);

        ResourceState state = states.get(resourceId);
        if (!saved.isActive()) {
            state.setStatus(SyncStatus.DISABLED);
        } else if (sourceChanged) {
            state.setStatus(SyncStatus.PENDING);
        } else if (state.getStatus() == SyncStatus.DISABLED) {
            state.setStatus(state.getPlaylist() != null ? SyncStatus.SYNCED : SyncStatus.QUEUED);
        }
        listener.onRender(state.snapshot());
        return saved;
    }

    /**
     * Toggle a resource. Stored data is kept either way.
     */
    public PlaylistResource setActive(String resourceId, boolean active) {
        PlaylistResource resource = getResource(resourceId);
        if (!active) {
            orchestrator.cancelSync(resourceId);
        }
        resource.setActive(active);
        resource.setUpdatedAt(Instant.now());
        PlaylistResource saved = resourceRepository.save(resource);

        ResourceState state = states.get(resourceId);
        if (!active) {
            state.setStatus(SyncStatus.DISABLED);
        } else {
            state.setStatus(state.getPlaylist() != null ? SyncStatus.SYNCED : SyncStatus.QUEUED);
        }
        listener.onRender(state.snapshot());
        log.info("Resource {} {}", resourceId, active ? "activated" : "deactivated");
        return saved;
    }

    public void deleteResource(String resourceId) {
        PlaylistResource resource = getResource(resourceId);

        orchestrator.cancelSync(resourceId);
        orchestrator.awaitIdle(resourceId);

        chunkStore.deleteAll(resourceId);
        chunkStore.deleteAll(ChunkStore.tempOwnerId(resourceId));
        resourceRepository.delete(resource);
        states.remove(resourceId);

        log.info("Deleted resource {} '{}'", resourceId, resource.getName());
    }

    /**
     * Full reset: every sync is stopped, every chunk and descriptor removed.
     */
    public void resetAll() {
        orchestrator.cancelAll();
        orchestrator.awaitAllIdle();

        chunkStore.clear();
        resourceRepository.deleteAll();
        states.clear();
        log.warn("All resources and playlist data have been reset");
    }

    public CompletableFuture<SyncStatus> startSync(String resourceId) {
        PlaylistResource resource = getResource(resourceId);
        if (!resource.isActive()) {
            throw new IllegalStateException("Resource " + resourceId + " is disabled");
        }
        return orchestrator.syncAsync(resource);
    }

    /**
     * @return ids of the resources whose sync was queued
     */
    public List<String> syncAllActive() {
        List<String> queued = new ArrayList<>();
        for (PlaylistResource resource : resourceRepository.findActive()) {
            orchestrator.syncAsync(resource);
            queued.add(resource.getId());
        }
        log.info("Queued sync of {} active resources", queued.size());
        return queued;
    }

    public boolean cancelSync(String resourceId) {
        getResource(resourceId);
        return orchestrator.cancelSync(resourceId);
    }

    public int cancelAll() {
        return orchestrator.cancelAll();
    }

    public SyncStatus importStream(String resourceId, InputStream input) {
        PlaylistResource resource = getResource(resourceId);
        log.info("Importing uploaded playlist into {}", resourceId);
        return orchestrator.importStream(resource, input);
    }

    public SyncStatus importText(String resourceId, String text) {
        PlaylistResource resource = getResource(resourceId);
        log.info("Importing {} characters of playlist text into {}", text.length(), resourceId);
        return orchestrator.importText(resource, text);
    }

    /**
     * Committed view of one resource, loaded from the store when not in memory yet.
     */
    public Optional<CategorizedPlaylist> getContent(String resourceId) {
        getResource(resourceId);
        ResourceState state = states.get(resourceId);
        if (state.getPlaylist() != null) {
            return Optional.of(state.getPlaylist());
        }
        Optional<CategorizedPlaylist> cached = chunkStore.getAll(resourceId);
        cached.ifPresent(state::setPlaylist);
        return cached;
    }

    /**
     * Rebuild runtime state from the store after a restart: finish interrupted
     * commits, drop stale staging data and load committed views.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void loadCachedContent() {
        List<PlaylistResource> resources = resourceRepository.findAll();
        List<PlaylistResource> withoutData = new ArrayList<>();

        for (PlaylistResource resource : resources) {
            String resourceId = resource.getId();
            String tempId = ChunkStore.tempOwnerId(resourceId);
            ResourceState state = states.get(resourceId);

            boolean recovered = false;
            try {
                if (resource.isCommitPending()) {
                    log.warn("Resuming interrupted commit of resource {}", resourceId);
                    chunkStore.resumeMove(tempId, resourceId);
                    recovered = true;
                } else {
                    chunkStore.deleteAll(tempId);
                }
            } catch (ChunkStoreException e) {
                log.error("Could not recover stored data of {}: {}", resourceId, e.getMessage(), e);
                state.markTerminal(SyncStatus.ERROR, e.getMessage());
                continue;
            }

            Optional<CategorizedPlaylist> cached = chunkStore.getAll(resourceId);
            if (recovered) {
                resource.setCommitPending(false);
                resource.setStats(cached.map(CategorizedPlaylist::stats).orElseGet(PlaylistStats::empty));
                resource.setLastSynced(Instant.now());
                resource.setUpdatedAt(Instant.now());
                resourceRepository.save(resource);
            }

            if (!resource.isActive()) {
                cached.ifPresent(state::setPlaylist);
                state.setStatus(SyncStatus.DISABLED);
            } else if (cached.isPresent()) {
                state.markSynced(cached.get());
            } else {
                state.setStatus(SyncStatus.QUEUED);
                withoutData.add(resource);
            }
        }
        log.info("Loaded cached content of {} resources ({} without data)", resources.size(), withoutData.size());

        if (syncOnStartup) {
            withoutData.forEach(orchestrator::syncAsync);
        }
    }

    /**
     * Merge a remotely managed resource list into the local one.
     */
    public RemoteMergeResult applyRemote(List<ResourceRequest> remote) {
        List<ResourceRequest> normalized = remote.stream().map(this::normalize).collect(Collectors.toList());
        RemoteResourceMerger.MergePlan plan = merger.plan(resourceRepository.findAll(), normalized, mergePolicy);
        RemoteMergeResult.RemoteMergeResultBuilder result = RemoteMergeResult.builder().policy(mergePolicy);

        for (ResourceRequest addition : plan.additions()) {
            ResourceRequest entry = ResourceRequest.builder()
                    .id(addition.getId())
                    .name(addition.getName())
                    .url(addition.getUrl())
                    .type(addition.getType())
                    .credentials(addition.getCredentials())
                    .active(true)
                    .build();
            try {
                validateSource(entry);
                result.added(createWithoutVerification(entry).getId());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid remote resource '{}': {}", addition.getName(), e.getMessage());
            }
        }

        for (RemoteResourceMerger.Update update : plan.updates()) {
            PlaylistResource local = update.local();
            local.setUrl(update.remote().getUrl());
            local.setCredentials(update.remote().getCredentials());
            if (update.remote().getType() != null) {
                local.setType(update.remote().getType());
            }
            orchestrator.cancelSync(local.getId());
            orchestrator.awaitIdle(local.getId());
            resetData(local);
            local.setUpdatedAt(Instant.now());
            resourceRepository.save(local);

            ResourceState state = states.get(local.getId());
            state.setStatus(local.isActive() ? SyncStatus.PENDING : SyncStatus.DISABLED);
            listener.onRender(state.snapshot());
            result.updated(local.getId());
        }

        for (PlaylistResource removal : plan.removals()) {
            deleteResource(removal.getId());
            result.removed(removal.getId());
        }

        RemoteMergeResult merged = result.build();
        log.info("Applied remote resource list with policy {}: {} added, {} updated, {} removed",
                mergePolicy, merged.getAdded().size(), merged.getUpdated().size(), merged.getRemoved().size());
        return merged;
    }

    private PlaylistResource createWithoutVerification(ResourceRequest entry) {
        String resourceId = entry.getId() != null && !entry.getId().isBlank() ? entry.getId() : "res-" + UUID.randomUUID();
        Instant now = Instant.now();
        PlaylistResource saved = resourceRepository.save(PlaylistResource.builder()
                .id(resourceId)
                .name(entry.getName())
                .url(entry.getUrl())
                .type(entry.getType())
                .credentials(entry.getCredentials())
                .active(true)
                .stats(PlaylistStats.empty())
                .createdAt(now)
                .updatedAt(now)
                .build());
        ResourceState state = states.get(resourceId);
        state.setStatus(SyncStatus.PENDING);
        listener.onRender(state.snapshot());
        return saved;
    }

    private void resetData(PlaylistResource resource) {
        resource.setStats(PlaylistStats.empty());
        resource.setLastSynced(null);
        resource.setCommitPending(false);
        chunkStore.deleteAll(resource.getId());
        states.get(resource.getId()).setPlaylist(null);
    }

    private ResourceRequest normalize(ResourceRequest request) {
        ResourceType type = request.getType() != null ? request.getType() : ResourceType.M3U;
        String url = request.getUrl() != null ? request.getUrl().trim() : null;
        ProviderCredentials credentials = request.getCredentials();

        if (type == ResourceType.XTREAM && credentials != null) {
            credentials = ProviderCredentials.builder()
                    .host(ProviderCredentials.normalizeHost(credentials.getHost()))
                    .username(credentials.getUsername())
                    .password(credentials.getPassword())
                    .build();
            url = credentials.getHost();
        }
        return ResourceRequest.builder()
                .id(request.getId())
                .name(request.getName())
                .url(url)
                .type(type)
                .credentials(credentials)
                .active(request.getActive())
                .build();
    }

    private void validateSource(ResourceRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Resource name is required");
        }
        if (request.getType() == ResourceType.XTREAM) {
            ProviderCredentials credentials = request.getCredentials();
            if (credentials == null || isBlank(credentials.getHost())
                    || isBlank(credentials.getUsername()) || isBlank(credentials.getPassword())) {
                throw new IllegalArgumentException("Provider resources need host, username and password");
            }
        } else if (isBlank(request.getUrl())) {
            throw new IllegalArgumentException("Playlist resources need a url");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
