package com.xksgroup.playlistsync.service;

import com.xksgroup.playlistsync.exception.ChunkStoreException;
import com.xksgroup.playlistsync.exception.SyncCancelledException;
import com.xksgroup.playlistsync.model.CategorizedPlaylist;
import com.xksgroup.playlistsync.model.PlaylistItem;
import com.xksgroup.playlistsync.model.PlaylistResource;
import com.xksgroup.playlistsync.model.PlaylistStats;
import com.xksgroup.playlistsync.model.ProviderCatalog;
import com.xksgroup.playlistsync.model.ResourceState;
import com.xksgroup.playlistsync.model.ResourceType;
import com.xksgroup.playlistsync.model.SyncStatus;
import com.xksgroup.playlistsync.parser.BatchSink;
import com.xksgroup.playlistsync.parser.PlaylistParser;
import com.xksgroup.playlistsync.parser.ProgressListener;
import com.xksgroup.playlistsync.repo.PlaylistResourceRepository;
import com.xksgroup.playlistsync.service.helper.FetchRoute;
import com.xksgroup.playlistsync.service.helper.PlaylistFetcher;
import com.xksgroup.playlistsync.service.provider.ProviderClient;
import com.xksgroup.playlistsync.service.store.ChunkStore;
import com.xksgroup.playlistsync.service.sync.ChunkWriterPipeline;
import com.xksgroup.playlistsync.service.sync.CancellationToken;
import com.xksgroup.playlistsync.service.sync.ResourceStateRegistry;
import com.xksgroup.playlistsync.service.sync.SyncEventListener;
import com.xksgroup.playlistsync.service.sync.SyncSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs the sync of one resource end to end: staging under the temp owner,
 * commit by moving chunks under the real owner, and cleanup on every exit path.
 * <p>
 * At most one attempt per resource is active. Starting a new attempt cancels the
 * running one and waits until it has settled before touching the store.
 */
@Slf4j
@Service
public class SyncOrchestrator {

    private final ChunkStore chunkStore;
    private final PlaylistFetcher fetcher;
    private final ProviderClient providerClient;
    private final PlaylistParser parser;
    private final PlaylistResourceRepository resourceRepository;
    private final ResourceStateRegistry states;
    private final SyncEventListener listener;
    private final Executor syncExecutor;
    private final Executor chunkWriterExecutor;
    private final int queueCapacity;
    private final long settleTimeoutMs;

    private final Map<String, SyncSession> sessions = new ConcurrentHashMap<>();

    public SyncOrchestrator(ChunkStore chunkStore,
                            PlaylistFetcher fetcher,
                            ProviderClient providerClient,
                            PlaylistParser parser,
                            PlaylistResourceRepository resourceRepository,
                            ResourceStateRegistry states,
                            SyncEventListener listener,
                            @Qualifier("syncExecutor") Executor syncExecutor,
                            @Qualifier("chunkWriterExecutor") Executor chunkWriterExecutor,
                            @Value("${playlist.sync.queue-capacity:1}") int queueCapacity,
                            @Value("${playlist.sync.settle-timeout-ms:30000}") long settleTimeoutMs) {
        this.chunkStore = chunkStore;
        this.fetcher = fetcher;
        this.providerClient = providerClient;
        this.parser = parser;
        this.resourceRepository = resourceRepository;
        this.states = states;
        this.listener = listener;
        this.syncExecutor = syncExecutor;
        this.chunkWriterExecutor = chunkWriterExecutor;
        this.queueCapacity = queueCapacity;
        this.settleTimeoutMs = settleTimeoutMs;
    }

    /**
     * Sync a resource from its source and block until the attempt ends.
     *
     * @return the terminal status of the attempt
     */
    public SyncStatus sync(PlaylistResource resource) {
        return run(resource, openSession(resource.getId()), sourceStep(resource));
    }

    /**
     * Queue a sync on the sync executor. The attempt is registered right away, so
     * {@link #cancelSync(String)} also reaches attempts that have not started yet.
     */
    public CompletableFuture<SyncStatus> syncAsync(PlaylistResource resource) {
        return submit(resource, sourceStep(resource));
    }

    /**
     * Replace the resource data with an uploaded playlist, through the same staging and commit path.
     */
    public SyncStatus importStream(PlaylistResource resource, InputStream input) {
        return run(resource, openSession(resource.getId()),
                (tempId, token, progress) -> writeChunks(tempId, token,
                        sink -> parser.parseStream(input, sink, progress, token)));
    }

    public SyncStatus importText(PlaylistResource resource, String text) {
        return run(resource, openSession(resource.getId()),
                (tempId, token, progress) -> writeChunks(tempId, token,
                        sink -> parser.parseText(text, sink, progress)));
    }

    /**
     * @return true when a running attempt was signalled
     */
    public boolean cancelSync(String resourceId) {
        SyncSession session = sessions.get(resourceId);
        if (session == null) {
            return false;
        }
        boolean cancelled = session.getToken().cancel();
        if (cancelled) {
            log.info("Cancellation requested for sync of {}", resourceId);
        }
        return cancelled;
    }

    public int cancelAll() {
        int cancelled = 0;
        for (String resourceId : sessions.keySet()) {
            if (cancelSync(resourceId)) {
                cancelled++;
            }
        }
        log.info("Cancelled {} running syncs", cancelled);
        return cancelled;
    }

    /**
     * Wait until no attempt of the resource is running.
     *
     * @return false when the attempt did not settle in time
     */
    public boolean awaitIdle(String resourceId) {
        SyncSession session = sessions.get(resourceId);
        if (session == null) {
            return true;
        }
        boolean settled = session.awaitSettled(settleTimeoutMs);
        if (!settled) {
            log.warn("Sync of {} did not settle within {} ms", resourceId, settleTimeoutMs);
        }
        return settled;
    }

    public boolean awaitAllIdle() {
        boolean allSettled = true;
        for (String resourceId : sessions.keySet()) {
            allSettled &= awaitIdle(resourceId);
        }
        return allSettled;
    }

    public boolean isSyncing(String resourceId) {
        return sessions.containsKey(resourceId);
    }

    public int activeSyncCount() {
        return sessions.size();
    }

    private CompletableFuture<SyncStatus> submit(PlaylistResource resource, StagingStep step) {
        SyncSession session = openSession(resource.getId());
        try {
            return CompletableFuture.supplyAsync(() -> run(resource, session, step), syncExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Sync executor rejected sync of {}", resource.getId());
            release(resource.getId(), session);
            throw e;
        }
    }

    private SyncSession openSession(String resourceId) {
        SyncSession[] opened = new SyncSession[1];
        sessions.compute(resourceId, (id, previous) -> {
            if (previous != null) {
                log.info("Superseding running sync of {}", id);
                previous.getToken().cancel();
            }
            opened[0] = new SyncSession(id, previous);
            return opened[0];
        });
        return opened[0];
    }

    private SyncStatus run(PlaylistResource resource, SyncSession session, StagingStep step) {
        String resourceId = resource.getId();
        String tempId = ChunkStore.tempOwnerId(resourceId);
        CancellationToken token = session.getToken();
        ResourceState state = states.get(resourceId);
        boolean committing = false;

        try {
            session.awaitPrevious(settleTimeoutMs);
            token.throwIfCancelled();

            state.markSyncing(token);
            listener.onRender(state.snapshot());
            log.info("Starting sync of {} ({}, {})", resourceId, resource.getName(), resource.getType());

            chunkStore.deleteAll(tempId);

            PlaylistStats staged = step.stage(tempId, token, stats -> {
                state.updateProgress(stats);
                listener.onStatusUpdate(resourceId, stats);
            });

            // Last cancellation point, the commit below runs to completion
            token.throwIfCancelled();
            committing = true;
            commit(resourceId, tempId, state, staged);
            log.info("Sync of {} completed with {} items", resourceId, staged.total());
            return SyncStatus.SYNCED;

        } catch (SyncCancelledException e) {
            log.info("Sync of {} cancelled: {}", resourceId, e.getMessage());
            discardStaging(session, tempId);
            state.markTerminal(SyncStatus.CANCELLED, null);
            return SyncStatus.CANCELLED;

        } catch (IOException | RuntimeException e) {
            if (committing) {
                // Staged chunks stay in place, startup recovery resumes the move
                log.error("Commit of {} failed, recovery pending: {}", resourceId, e.getMessage(), e);
            } else {
                log.error("Sync of {} failed: {}", resourceId, e.getMessage(), e);
                discardStaging(session, tempId);
            }
            state.markTerminal(SyncStatus.ERROR, e.getMessage());
            return SyncStatus.ERROR;

        } finally {
            if (session.ownsStore()) {
                state.clearInFlight(token);
            }
            release(resourceId, session);
            ResourceState settled = state.snapshot();
            listener.onRender(settled);
            listener.onSyncFinished(settled);
        }
    }

    /**
     * Make the staged dataset the committed one. {@code commitPending} brackets
     * the window in which the resource has no complete dataset in the store.
     */
    void commit(String resourceId, String tempId, ResourceState state, PlaylistStats staged) {
        updateDescriptor(resourceId, descriptor -> descriptor.setCommitPending(true));

        chunkStore.deleteAll(resourceId);
        chunkStore.move(tempId, resourceId);

        updateDescriptor(resourceId, descriptor -> {
            descriptor.setStats(staged.copy());
            descriptor.setLastSynced(Instant.now());
            descriptor.setCommitPending(false);
        });

        Optional<CategorizedPlaylist> committed = chunkStore.getAll(resourceId);
        if (committed.isPresent()) {
            state.markSynced(committed.get());
        } else if (staged.total() == 0) {
            state.markSynced(CategorizedPlaylist.empty());
        } else {
            // Chunks are stored, the view is loaded again on the next content read
            log.warn("Committed {} items for {} but could not read them back", staged.total(), resourceId);
            state.markSynced(null);
        }
    }

    /**
     * Drop the resource's staging data. Skipped while a superseded attempt may still
     * be writing there: that attempt cleans up after itself.
     */
    private void discardStaging(SyncSession session, String tempId) {
        if (!session.ownsStore()) {
            log.debug("Leaving {} to the superseded sync still running", tempId);
            return;
        }
        try {
            chunkStore.deleteAll(tempId);
        } catch (ChunkStoreException e) {
            // Leftovers are dropped by the next sync or at startup
            log.warn("Could not discard staged chunks of {}: {}", tempId, e.getMessage());
        }
    }

    /**
     * The session stays registered until it has settled, so a newer attempt or
     * {@link #awaitIdle(String)} still sees the older attempts behind it.
     */
    private void release(String resourceId, SyncSession session) {
        session.markSettled();
        session.getSettled().whenComplete((ignored, failure) -> sessions.remove(resourceId, session));
    }

    private void updateDescriptor(String resourceId, Consumer<PlaylistResource> change) {
        resourceRepository.findById(resourceId).ifPresentOrElse(descriptor -> {
            change.accept(descriptor);
            descriptor.setUpdatedAt(Instant.now());
            resourceRepository.save(descriptor);
        }, () -> log.warn("Resource {} no longer exists, descriptor not updated", resourceId));
    }

    private StagingStep sourceStep(PlaylistResource resource) {
        if (resource.getType() == ResourceType.XTREAM) {
            return (tempId, token, progress) -> stageProvider(resource, tempId, token, progress);
        }
        return (tempId, token, progress) -> stagePlaylist(resource, tempId, token, progress);
    }

    private PlaylistStats stagePlaylist(PlaylistResource resource, String tempId, CancellationToken token,
                                        ProgressListener progress) {
        AtomicInteger attempts = new AtomicInteger();
        return fetcher.fetch(resource.getUrl(), token, (body, route) -> {
            if (attempts.getAndIncrement() > 0) {
                log.info("Discarding chunks of the failed attempt before reading {} via {}", resource.getId(), route);
                chunkStore.deleteAll(tempId);
            }
            if (route == FetchRoute.PROXY) {
                progress.onProgress(PlaylistStats.empty());
            }
            return writeChunks(tempId, token, sink -> parser.parseStream(body, sink, progress, token));
        });
    }

    private PlaylistStats stageProvider(PlaylistResource resource, String tempId, CancellationToken token,
                                        ProgressListener progress) throws IOException {
        ProviderCatalog catalog = providerClient.fetchAll(resource.getCredentials(), token);
        progress.onProgress(catalog.stats().copy());

        List<PlaylistItem> items = catalog.data().flatten();
        int batchSize = parser.getBatchSize();
        return writeChunks(tempId, token, sink -> {
            for (int from = 0; from < items.size(); from += batchSize) {
                sink.accept(List.copyOf(items.subList(from, Math.min(items.size(), from + batchSize))));
            }
            return catalog.stats().copy();
        });
    }

    private PlaylistStats writeChunks(String tempId, CancellationToken token, ParseStep step) throws IOException {
        try (ChunkWriterPipeline pipeline = ChunkWriterPipeline.start(
                chunkStore, tempId, queueCapacity, chunkWriterExecutor, token)) {
            PlaylistStats stats = step.parse(pipeline);
            int chunks = pipeline.finish();
            log.debug("Staged {} items in {} chunks under {}", stats.total(), chunks, tempId);
            return stats;
        }
    }

    @FunctionalInterface
    private interface StagingStep {
        PlaylistStats stage(String tempId, CancellationToken token, ProgressListener progress) throws IOException;
    }

    @FunctionalInterface
    private interface ParseStep {
        PlaylistStats parse(BatchSink sink) throws IOException;
    }
}
